package ca.gc.cra.ftrace.infrastructure.trace;

import ca.gc.cra.ftrace.application.port.MetricsPort;
import ca.gc.cra.ftrace.application.port.TracePacketSource;
import ca.gc.cra.ftrace.domain.blob.TraceBlobView;
import ca.gc.cra.ftrace.domain.ftrace.FtraceWireFields;
import ca.gc.cra.ftrace.domain.proto.ProtoField;
import ca.gc.cra.ftrace.domain.proto.ProtoReader;
import ca.gc.cra.ftrace.domain.proto.ProtoWireException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Packet source reading a serialized {@code Trace} file.
 * <p><strong>Why:</strong> Lets the tokenizer run offline against traces written by the tracing service.</p>
 * <p><strong>Role:</strong> {@link TracePacketSource} adapter used by the {@code tokenize} command.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Load the file into a single buffer and yield each {@code packet} field as a zero-copy view.</li>
 *   <li>Skip other top-level fields.</li>
 *   <li>Stop at a truncated or malformed trailer, counting it under {@code trace.packets.truncated}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 * <p><strong>Performance:</strong> The whole file is held in memory for the lifetime of the source.</p>
 *
 * @since 0.1.0
 */
public final class ProtoTraceFileSource implements TracePacketSource {
  private static final Logger log = LoggerFactory.getLogger(ProtoTraceFileSource.class);

  /** Trailing bytes that could not be decoded as a packet. */
  public static final String PACKETS_TRUNCATED = "trace.packets.truncated";

  private final Path path;
  private final MetricsPort metrics;
  private TraceBlobView trace;
  private ProtoReader reader;
  private boolean exhausted;

  /**
   * Creates a source for {@code path}; nothing is read until {@link #start()}.
   *
   * @param path trace file; must not be {@code null}
   * @param metrics diagnostic counters; must not be {@code null}
   */
  public ProtoTraceFileSource(Path path, MetricsPort metrics) {
    this.path = Objects.requireNonNull(path, "path");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void start() throws IOException {
    if (reader != null) {
      throw new IllegalStateException("source already started");
    }
    trace = TraceBlobView.wrap(Files.readAllBytes(path));
    reader = new ProtoReader(trace);
    log.info("Opened trace {} ({} bytes)", path, trace.length());
  }

  @Override
  public Optional<TraceBlobView> poll() {
    if (reader == null) {
      throw new IllegalStateException("source not started");
    }
    while (!exhausted && reader.hasRemaining()) {
      ProtoField field;
      try {
        field = reader.readField();
      } catch (ProtoWireException ex) {
        log.warn("Trace {} ends with {} undecodable bytes at offset {}: {}",
            path, reader.limit() - reader.position(), reader.position(), ex.getMessage());
        metrics.increment(PACKETS_TRUNCATED);
        exhausted = true;
        return Optional.empty();
      }
      if (field.number() == FtraceWireFields.Trace.PACKET && field.isLengthDelimited()) {
        return Optional.of(trace.sliceAbsolute(field.valueOffset(), field.valueLength()));
      }
      log.debug("Skipping top-level trace field {}", field.number());
    }
    exhausted = true;
    return Optional.empty();
  }

  @Override
  public boolean isExhausted() {
    return exhausted;
  }

  @Override
  public void close() {
    reader = null;
    trace = null;
    exhausted = true;
  }
}
