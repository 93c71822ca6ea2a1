package ca.gc.cra.ftrace.infrastructure.trace;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.ftrace.domain.blob.TraceBlobView;
import ca.gc.cra.ftrace.testutil.ProtoWriter;
import ca.gc.cra.ftrace.testutil.RecordingMetricsPort;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProtoTraceFileSourceTest {
  @TempDir Path tempDir;

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void yieldsPacketsAndSkipsOtherFields() throws Exception {
    byte[] first = {0x08, 0x01};
    byte[] second = {0x10, 0x02};
    Path trace = write(new ProtoWriter()
        .bytes(1, first)
        .varint(2, 9)
        .string(3, "metadata")
        .bytes(1, second));
    ProtoTraceFileSource source = new ProtoTraceFileSource(trace, metrics);
    source.start();

    Optional<TraceBlobView> p1 = source.poll();
    Optional<TraceBlobView> p2 = source.poll();
    Optional<TraceBlobView> end = source.poll();

    assertArrayEquals(first, p1.orElseThrow().toByteArray());
    assertArrayEquals(second, p2.orElseThrow().toByteArray());
    assertTrue(end.isEmpty());
    assertTrue(source.isExhausted());
    assertEquals(0, metrics.totalIncrements());
    source.close();
  }

  @Test
  void truncatedTrailerIsCountedAndEndsStream() throws Exception {
    byte[] valid = new ProtoWriter().bytes(1, new byte[] {0x08, 0x01}).toByteArray();
    byte[] trailer = {0x0A, 0x10, 0x08};
    byte[] content = new byte[valid.length + trailer.length];
    System.arraycopy(valid, 0, content, 0, valid.length);
    System.arraycopy(trailer, 0, content, valid.length, trailer.length);
    Path trace = tempDir.resolve("truncated.pftrace");
    Files.write(trace, content);
    ProtoTraceFileSource source = new ProtoTraceFileSource(trace, metrics);
    source.start();

    assertTrue(source.poll().isPresent());
    assertTrue(source.poll().isEmpty());
    assertTrue(source.isExhausted());
    assertEquals(1, metrics.count(ProtoTraceFileSource.PACKETS_TRUNCATED));
  }

  @Test
  void emptyFileIsExhaustedImmediately() throws Exception {
    Path trace = tempDir.resolve("empty.pftrace");
    Files.write(trace, new byte[0]);
    ProtoTraceFileSource source = new ProtoTraceFileSource(trace, metrics);
    source.start();

    assertFalse(source.isExhausted());
    assertTrue(source.poll().isEmpty());
    assertTrue(source.isExhausted());
  }

  @Test
  void missingFileFailsOnStart() {
    ProtoTraceFileSource source = new ProtoTraceFileSource(tempDir.resolve("missing"), metrics);

    assertThrows(NoSuchFileException.class, source::start);
  }

  @Test
  void pollBeforeStartIsRejected() {
    ProtoTraceFileSource source = new ProtoTraceFileSource(tempDir.resolve("missing"), metrics);

    assertThrows(IllegalStateException.class, source::poll);
  }

  private Path write(ProtoWriter writer) throws Exception {
    Path trace = tempDir.resolve("trace.pftrace");
    Files.write(trace, writer.toByteArray());
    return trace;
  }
}
