package ca.gc.cra.ftrace.application.port;

import ca.gc.cra.ftrace.domain.blob.TraceBlobView;
import ca.gc.cra.ftrace.domain.ftrace.InlineSchedSwitch;
import ca.gc.cra.ftrace.domain.ftrace.InlineSchedWaking;

/**
 * <strong>What:</strong> Port receiving timestamped per-CPU events from the tokenizer.
 * <p><strong>Why:</strong> Decouples decoding from the cross-CPU ordering stage and from any persistence format.</p>
 * <p><strong>Role:</strong> Domain port implemented by {@code NdjsonEventSink} and by sorting stages.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Accept events in the order a CPU produced them; timestamps are already in the trace clock.</li>
 *   <li>Flush and release resources when the import finishes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Called from the tokenizer thread only.</p>
 * <p><strong>Performance:</strong> Push methods sit on the hot path; raw events are zero-copy views.</p>
 *
 * @implNote Push methods do not declare checked exceptions; adapters report I/O failures as
 * {@link java.io.UncheckedIOException}.
 * @since 0.1.0
 */
public interface EventSinkPort extends AutoCloseable {
  /**
   * Accepts one serialized ftrace event.
   *
   * @param cpu CPU the event was recorded on
   * @param timestamp trace-clock timestamp in nanoseconds
   * @param event zero-copy view of the serialized event
   */
  void pushFtraceEvent(int cpu, long timestamp, TraceBlobView event);

  /**
   * Accepts one {@code sched_switch} decoded from a compact batch.
   *
   * @param cpu CPU the event was recorded on
   * @param timestamp trace-clock timestamp in nanoseconds
   * @param event decoded switch record
   */
  void pushInlineSchedSwitch(int cpu, long timestamp, InlineSchedSwitch event);

  /**
   * Accepts one {@code sched_waking} decoded from a compact batch.
   *
   * @param cpu CPU the event was recorded on
   * @param timestamp trace-clock timestamp in nanoseconds
   * @param event decoded waking record
   */
  void pushInlineSchedWaking(int cpu, long timestamp, InlineSchedWaking event);

  /**
   * Flushes buffered events.
   *
   * @throws Exception if pending data cannot be written
   */
  default void flush() throws Exception {}

  /**
   * Releases sink resources.
   *
   * @throws Exception if shutdown fails
   */
  @Override
  default void close() throws Exception {}
}
