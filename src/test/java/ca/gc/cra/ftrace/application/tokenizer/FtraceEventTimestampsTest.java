package ca.gc.cra.ftrace.application.tokenizer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.ftrace.domain.blob.TraceBlobView;
import ca.gc.cra.ftrace.testutil.ProtoWriter;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;

class FtraceEventTimestampsTest {

  @Test
  void leadingTimestampTakesFastPath() {
    TraceBlobView event = TraceBlobView.wrap(new ProtoWriter()
        .varint(1, 123_456_789_000L)
        .varint(2, 42)
        .bytes(4, new byte[12])
        .toByteArray());

    assertTrue(FtraceEventTimestamps.qualifiesForFastPath(event));
    assertEquals(OptionalLong.of(123_456_789_000L), FtraceEventTimestamps.fastPath(event));
    assertEquals(OptionalLong.of(123_456_789_000L), FtraceEventTimestamps.find(event));
  }

  @Test
  void fastAndSlowPathAgreeOnQualifyingEvents() {
    long[] timestamps = {0L, 1L, 127L, 128L, 1L << 35, Long.MAX_VALUE, -1L};
    for (long ts : timestamps) {
      TraceBlobView event = TraceBlobView.wrap(new ProtoWriter()
          .varint(1, ts)
          .bytes(4, new byte[16])
          .toByteArray());

      assertTrue(FtraceEventTimestamps.qualifiesForFastPath(event));
      assertEquals(FtraceEventTimestamps.slowPath(event), FtraceEventTimestamps.fastPath(event), "ts=" + ts);
    }
  }

  @Test
  void shortEventUsesSlowPath() {
    TraceBlobView event = TraceBlobView.wrap(new ProtoWriter().varint(1, 5).toByteArray());

    assertFalse(FtraceEventTimestamps.qualifiesForFastPath(event));
    assertEquals(OptionalLong.of(5), FtraceEventTimestamps.find(event));
  }

  @Test
  void eventOfExactlyTenBytesUsesSlowPath() {
    byte[] bytes = new ProtoWriter().varint(1, 9).bytes(4, new byte[6]).toByteArray();
    assertEquals(10, bytes.length);
    TraceBlobView event = TraceBlobView.wrap(bytes);

    assertFalse(FtraceEventTimestamps.qualifiesForFastPath(event));
    assertEquals(OptionalLong.of(9), FtraceEventTimestamps.find(event));
  }

  @Test
  void timestampAfterOtherFieldsIsFoundBySlowPath() {
    TraceBlobView event = TraceBlobView.wrap(new ProtoWriter()
        .varint(2, 1000)
        .bytes(4, new byte[16])
        .varint(1, 77)
        .varint(1, 78)
        .toByteArray());

    assertFalse(FtraceEventTimestamps.qualifiesForFastPath(event));
    assertEquals(OptionalLong.of(77), FtraceEventTimestamps.find(event));
  }

  @Test
  void fixedWidthTimestampsAreAccepted() {
    TraceBlobView fixed64 = TraceBlobView.wrap(new ProtoWriter().fixed64(1, 99).toByteArray());
    TraceBlobView fixed32 = TraceBlobView.wrap(new ProtoWriter().fixed32(1, -1).toByteArray());

    assertEquals(OptionalLong.of(99), FtraceEventTimestamps.find(fixed64));
    assertEquals(OptionalLong.of(0xFFFF_FFFFL), FtraceEventTimestamps.find(fixed32));
  }

  @Test
  void lengthDelimitedTimestampIsNotFound() {
    TraceBlobView event = TraceBlobView.wrap(new ProtoWriter().string(1, "not-a-number").toByteArray());

    assertTrue(FtraceEventTimestamps.find(event).isEmpty());
  }

  @Test
  void missingTimestampIsNotFound() {
    TraceBlobView event = TraceBlobView.wrap(new ProtoWriter().varint(2, 1).toByteArray());

    assertTrue(FtraceEventTimestamps.find(event).isEmpty());
    assertTrue(FtraceEventTimestamps.find(TraceBlobView.wrap(new byte[0])).isEmpty());
  }

  @Test
  void unterminatedFastPathVarintIsNotFound() {
    ProtoWriter writer = new ProtoWriter().raw(FtraceEventTimestamps.TIMESTAMP_TAG);
    for (int i = 0; i < 12; i++) {
      writer.raw(0xFF);
    }
    TraceBlobView event = TraceBlobView.wrap(writer.toByteArray());

    assertTrue(FtraceEventTimestamps.qualifiesForFastPath(event));
    assertTrue(FtraceEventTimestamps.find(event).isEmpty());
  }

  @Test
  void malformedEventIsNotFoundBySlowPath() {
    TraceBlobView event = TraceBlobView.wrap(new byte[] {0x12, 0x7F, 0x01});

    assertTrue(FtraceEventTimestamps.slowPath(event).isEmpty());
  }

  @Test
  void eventInsideLargerBufferIsReadRelativeToItsOffset() {
    byte[] prefix = {0x08, 0x01};
    byte[] event = new ProtoWriter().varint(1, 4242).bytes(4, new byte[12]).toByteArray();
    byte[] buffer = new byte[prefix.length + event.length];
    System.arraycopy(prefix, 0, buffer, 0, prefix.length);
    System.arraycopy(event, 0, buffer, prefix.length, event.length);

    TraceBlobView view = new TraceBlobView(buffer, prefix.length, event.length);

    assertEquals(OptionalLong.of(4242), FtraceEventTimestamps.find(view));
  }
}
