package ca.gc.cra.ftrace.infrastructure.sink;

import ca.gc.cra.ftrace.application.port.EventSinkPort;
import ca.gc.cra.ftrace.application.port.StringPoolPort;
import ca.gc.cra.ftrace.domain.blob.TraceBlobView;
import ca.gc.cra.ftrace.domain.ftrace.InlineSchedSwitch;
import ca.gc.cra.ftrace.domain.ftrace.InlineSchedWaking;
import ca.gc.cra.ftrace.domain.strings.StringId;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.HexFormat;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Event sink writing one JSON object per event to {@code events.ndjson}.
 * <p><strong>Why:</strong> Gives the command-line import an inspectable output without a downstream sorter.</p>
 * <p><strong>Role:</strong> {@link EventSinkPort} adapter created by {@code CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one tokenizer thread writes.</p>
 * <p><strong>Performance:</strong> Streams through a single buffered {@link JsonGenerator}; raw payloads are
 * hex-encoded only when requested.</p>
 *
 * @implNote Push methods wrap {@link IOException} in {@link UncheckedIOException}.
 * @since 0.1.0
 */
public final class NdjsonEventSink implements EventSinkPort {
  private static final Logger log = LoggerFactory.getLogger(NdjsonEventSink.class);

  /** Output file name inside the configured directory. */
  public static final String FILE_NAME = "events.ndjson";

  private final Path file;
  private final StringPoolPort stringPool;
  private final boolean includePayload;
  private final JsonGenerator generator;
  private long written;
  private boolean closed;

  private NdjsonEventSink(Path file, StringPoolPort stringPool, boolean includePayload, JsonGenerator generator) {
    this.file = file;
    this.stringPool = stringPool;
    this.includePayload = includePayload;
    this.generator = generator;
  }

  /**
   * Creates {@code <directory>/events.ndjson}, truncating any previous content.
   *
   * @param directory output directory; created when missing
   * @param stringPool pool used to resolve command names; must not be {@code null}
   * @param includePayload whether raw ftrace events are written as hex
   * @return open sink
   * @throws IOException if the directory or file cannot be created
   */
  public static NdjsonEventSink open(Path directory, StringPoolPort stringPool, boolean includePayload)
      throws IOException {
    Objects.requireNonNull(directory, "directory");
    Objects.requireNonNull(stringPool, "stringPool");
    Files.createDirectories(directory);
    Path file = directory.resolve(FILE_NAME);
    BufferedWriter writer = Files.newBufferedWriter(
        file,
        StandardCharsets.UTF_8,
        StandardOpenOption.CREATE,
        StandardOpenOption.TRUNCATE_EXISTING,
        StandardOpenOption.WRITE);
    JsonGenerator generator = new JsonFactory().createGenerator(writer);
    generator.setRootValueSeparator(null);
    log.info("Writing events to {}", file);
    return new NdjsonEventSink(file, stringPool, includePayload, generator);
  }

  /**
   * Returns the output file.
   *
   * @return path of {@code events.ndjson}
   */
  public Path file() {
    return file;
  }

  /**
   * Returns the number of events written so far.
   *
   * @return event count
   */
  public long written() {
    return written;
  }

  @Override
  public void pushFtraceEvent(int cpu, long timestamp, TraceBlobView event) {
    try {
      begin("ftrace", cpu, timestamp);
      generator.writeNumberField("size", event.length());
      if (includePayload) {
        generator.writeStringField(
            "payload", HexFormat.of().formatHex(event.buffer(), event.offset(), event.end()));
      }
      end();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to write ftrace event to " + file, ex);
    }
  }

  @Override
  public void pushInlineSchedSwitch(int cpu, long timestamp, InlineSchedSwitch event) {
    try {
      begin("sched_switch", cpu, timestamp);
      generator.writeNumberField("prevState", event.prevState());
      generator.writeNumberField("nextPid", event.nextPid());
      generator.writeNumberField("nextPrio", event.nextPrio());
      generator.writeStringField("nextComm", resolve(event.nextComm()));
      end();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to write sched_switch to " + file, ex);
    }
  }

  @Override
  public void pushInlineSchedWaking(int cpu, long timestamp, InlineSchedWaking event) {
    try {
      begin("sched_waking", cpu, timestamp);
      generator.writeNumberField("pid", event.pid());
      generator.writeNumberField("targetCpu", event.targetCpu());
      generator.writeNumberField("prio", event.prio());
      generator.writeStringField("comm", resolve(event.comm()));
      end();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to write sched_waking to " + file, ex);
    }
  }

  @Override
  public void flush() throws IOException {
    if (!closed) {
      generator.flush();
    }
  }

  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    generator.close();
    log.info("Wrote {} events to {}", written, file);
  }

  private void begin(String type, int cpu, long timestamp) throws IOException {
    if (closed) {
      throw new IOException("sink already closed");
    }
    generator.writeStartObject();
    generator.writeStringField("type", type);
    generator.writeNumberField("cpu", cpu);
    generator.writeNumberField("ts", timestamp);
  }

  private void end() throws IOException {
    generator.writeEndObject();
    generator.writeRaw('\n');
    written++;
  }

  private String resolve(StringId id) {
    return stringPool.lookup(id).orElse("");
  }
}
