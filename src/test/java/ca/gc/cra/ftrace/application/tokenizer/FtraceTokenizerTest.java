package ca.gc.cra.ftrace.application.tokenizer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.ftrace.domain.blob.TraceBlobView;
import ca.gc.cra.ftrace.domain.clock.BuiltinClock;
import ca.gc.cra.ftrace.domain.ftrace.FtraceClock;
import ca.gc.cra.ftrace.testutil.FakeClockResolver;
import ca.gc.cra.ftrace.testutil.FixedStringPool;
import ca.gc.cra.ftrace.testutil.ProtoWriter;
import ca.gc.cra.ftrace.testutil.RecordingEventSink;
import ca.gc.cra.ftrace.testutil.RecordingMetricsPort;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FtraceTokenizerTest {
  private RecordingEventSink sink;
  private RecordingMetricsPort metrics;
  private FakeClockResolver resolver;

  @BeforeEach
  void setUp() {
    sink = new RecordingEventSink();
    metrics = new RecordingMetricsPort();
    resolver = new FakeClockResolver(1_000);
  }

  @Test
  void defaultClockEventsPassThroughUnchanged() throws Exception {
    byte[] first = event(100);
    byte[] second = event(200);
    TraceBlobView bundle = view(new ProtoWriter().varint(1, 3).bytes(2, first).bytes(2, second));

    tokenizer().tokenizeBundle(bundle);

    assertEquals(List.of(100L, 200L), sink.timestamps());
    assertTrue(sink.events().stream().allMatch(e -> e.cpu() == 3));
    assertEquals(TraceBlobView.wrap(first), sink.events().get(0).ftrace());
    assertEquals(TraceBlobView.wrap(second), sink.events().get(1).ftrace());
    assertTrue(resolver.calls().isEmpty());
  }

  @Test
  void eventSlicesShareBundleBuffer() throws Exception {
    TraceBlobView bundle = view(new ProtoWriter().varint(1, 0).bytes(2, event(5)));

    tokenizer().tokenizeBundle(bundle);

    assertSame(bundle.buffer(), sink.events().get(0).ftrace().buffer());
  }

  @Test
  void globalClockResolvesThroughMonotonic() throws Exception {
    TraceBlobView bundle = view(new ProtoWriter().varint(1, 0).bytes(2, event(500)).varint(5, 2));

    tokenizer().tokenizeBundle(bundle);

    assertEquals(List.of(1_500L), sink.timestamps());
    assertEquals(List.of(new FakeClockResolver.Call(BuiltinClock.MONOTONIC.id(), 500)), resolver.calls());
  }

  @Test
  void explicitUnspecifiedClockIsBootTime() throws Exception {
    TraceBlobView bundle = view(new ProtoWriter().varint(1, 0).varint(5, 0).bytes(2, event(500)));

    tokenizer().tokenizeBundle(bundle);

    assertEquals(List.of(500L), sink.timestamps());
  }

  @Test
  void localClockIsRejected() {
    TraceBlobView bundle = view(new ProtoWriter().varint(1, 0).varint(5, 3).bytes(2, event(500)));

    FtraceTokenizerException ex =
        assertThrows(FtraceTokenizerException.class, () -> tokenizer().tokenizeBundle(bundle));

    assertEquals("Unable to parse ftrace packets with local clock", ex.getMessage());
    assertEquals(FtraceClock.LOCAL, ex.clock());
    assertTrue(sink.events().isEmpty());
  }

  @Test
  void unknownClocksAreRejected() {
    for (long wire : new long[] {1, 9}) {
      TraceBlobView bundle = view(new ProtoWriter().varint(1, 0).varint(5, wire).bytes(2, event(500)));

      FtraceTokenizerException ex =
          assertThrows(FtraceTokenizerException.class, () -> tokenizer().tokenizeBundle(bundle));

      assertEquals("Unable to parse ftrace packets with unknown clock", ex.getMessage());
      assertEquals(FtraceClock.UNKNOWN, ex.clock());
    }
    assertTrue(sink.events().isEmpty());
  }

  @Test
  void rejectedClockDoesNotCountLostEvents() {
    TraceBlobView bundle = view(new ProtoWriter().varint(1, 0).varint(3, 1).varint(5, 3));

    assertThrows(FtraceTokenizerException.class, () -> tokenizer().tokenizeBundle(bundle));
    assertEquals(0, metrics.count(FtraceStats.BUNDLE_LOST_EVENTS));
  }

  @Test
  void missingCpuCountsTokenizerErrorAndDropsBundle() throws Exception {
    TraceBlobView bundle = view(new ProtoWriter().bytes(2, event(100)));

    tokenizer().tokenizeBundle(bundle);

    assertTrue(sink.events().isEmpty());
    assertEquals(1, metrics.count(FtraceStats.BUNDLE_TOKENIZER_ERRORS));
  }

  @Test
  void missingCpuWinsOverUnsupportedClock() throws Exception {
    TraceBlobView bundle = view(new ProtoWriter().varint(5, 3).bytes(2, event(100)));

    tokenizer().tokenizeBundle(bundle);

    assertEquals(1, metrics.count(FtraceStats.BUNDLE_TOKENIZER_ERRORS));
  }

  @Test
  void cpuAtLimitIsDroppedWithoutCounter() throws Exception {
    TraceBlobView bundle = view(new ProtoWriter().varint(1, FtraceTokenizer.MAX_CPUS).bytes(2, event(100)));

    tokenizer().tokenizeBundle(bundle);

    assertTrue(sink.events().isEmpty());
    assertEquals(0, metrics.totalIncrements());
  }

  @Test
  void highestCpuIsAccepted() throws Exception {
    TraceBlobView bundle = view(new ProtoWriter().varint(1, FtraceTokenizer.MAX_CPUS - 1).bytes(2, event(100)));

    tokenizer().tokenizeBundle(bundle);

    assertEquals(FtraceTokenizer.MAX_CPUS - 1, sink.events().get(0).cpu());
  }

  @Test
  void eventWithoutTimestampIsCountedAndOthersContinue() throws Exception {
    byte[] noTimestamp = new ProtoWriter().varint(2, 42).toByteArray();
    TraceBlobView bundle = view(new ProtoWriter()
        .varint(1, 1)
        .bytes(2, event(10))
        .bytes(2, noTimestamp)
        .bytes(2, event(30)));

    tokenizer().tokenizeBundle(bundle);

    assertEquals(List.of(10L, 30L), sink.timestamps());
    assertEquals(1, metrics.count(FtraceStats.BUNDLE_TOKENIZER_ERRORS));
  }

  @Test
  void clockConversionFailureDropsEventSilently() throws Exception {
    resolver = new FakeClockResolver(1_000, ts -> ts == 20);
    TraceBlobView bundle = view(new ProtoWriter()
        .varint(1, 1)
        .varint(5, 2)
        .bytes(2, event(10))
        .bytes(2, event(20))
        .bytes(2, event(30)));

    tokenizer().tokenizeBundle(bundle);

    assertEquals(List.of(1_010L, 1_030L), sink.timestamps());
    assertEquals(0, metrics.totalIncrements());
  }

  @Test
  void lostEventsFlagIsCounted() throws Exception {
    TraceBlobView bundle = view(new ProtoWriter().varint(1, 0).varint(3, 1).bytes(2, event(1)));

    tokenizer().tokenizeBundle(bundle);

    assertEquals(1, metrics.count(FtraceStats.BUNDLE_LOST_EVENTS));
    assertEquals(1, sink.events().size());
  }

  @Test
  void compactSchedRowsPrecedeBundleEvents() throws Exception {
    ProtoWriter compact = new ProtoWriter()
        .string(5, "init")
        .packed(1, 900)
        .packed(2, 1)
        .packed(3, 1)
        .packed(4, 120)
        .packed(6, 0)
        .packed(7, 950)
        .packed(8, 2)
        .packed(9, 0)
        .packed(10, 120)
        .packed(11, 0);
    TraceBlobView bundle = view(new ProtoWriter()
        .varint(1, 4)
        .bytes(2, event(100))
        .message(4, compact));

    tokenizer().tokenizeBundle(bundle);

    assertEquals(List.of(900L, 950L, 100L), sink.timestamps());
    assertTrue(sink.events().get(0).schedSwitch() != null);
    assertTrue(sink.events().get(1).schedWaking() != null);
    assertTrue(sink.events().get(2).ftrace() != null);
  }

  @Test
  void malformedBundleIsCountedAndDropped() throws Exception {
    byte[] valid = new ProtoWriter().varint(1, 0).bytes(2, event(1)).toByteArray();
    byte[] truncated = new byte[valid.length - 1];
    System.arraycopy(valid, 0, truncated, 0, truncated.length);

    tokenizer().tokenizeBundle(TraceBlobView.wrap(truncated));

    assertTrue(sink.events().isEmpty());
    assertEquals(1, metrics.count(FtraceStats.BUNDLE_TOKENIZER_ERRORS));
  }

  @Test
  void unrelatedFieldsAreIgnored() throws Exception {
    TraceBlobView bundle = view(new ProtoWriter()
        .varint(1, 0)
        .string(8, "ignored")
        .fixed64(9, 1)
        .bytes(2, event(7)));

    tokenizer().tokenizeBundle(bundle);

    assertEquals(List.of(7L), sink.timestamps());
  }

  @Test
  void tokenizeFtraceEventCanBeCalledDirectly() {
    tokenizer().tokenizeFtraceEvent(6, BuiltinClock.MONOTONIC, TraceBlobView.wrap(event(40)));

    assertEquals(List.of(1_040L), sink.timestamps());
    assertEquals(6, sink.events().get(0).cpu());
  }

  @Test
  void canonicalClockMapping() throws Exception {
    assertEquals(BuiltinClock.BOOTTIME, FtraceTokenizer.toCanonicalClock(FtraceClock.UNSPECIFIED));
    assertEquals(BuiltinClock.MONOTONIC, FtraceTokenizer.toCanonicalClock(FtraceClock.GLOBAL));
    assertThrows(FtraceTokenizerException.class, () -> FtraceTokenizer.toCanonicalClock(FtraceClock.LOCAL));
    assertThrows(FtraceTokenizerException.class, () -> FtraceTokenizer.toCanonicalClock(FtraceClock.UNKNOWN));
  }

  private FtraceTokenizer tokenizer() {
    TraceTimeResolver timeResolver = new TraceTimeResolver(resolver);
    CompactSchedDecoder compact = new CompactSchedDecoder(
        new FixedStringPool(), timeResolver, sink, metrics, CompactSchedClockPolicy.ABORT_BATCH);
    return new FtraceTokenizer(timeResolver, compact, sink, metrics);
  }

  private static byte[] event(long timestamp) {
    return new ProtoWriter()
        .varint(1, timestamp)
        .varint(2, 1234)
        .bytes(4, new byte[] {1, 2, 3, 4, 5, 6, 7, 8})
        .toByteArray();
  }

  private static TraceBlobView view(ProtoWriter writer) {
    return TraceBlobView.wrap(writer.toByteArray());
  }
}
