package ca.gc.cra.ftrace.application.port;

import java.util.OptionalLong;

/**
 * <strong>What:</strong> Port converting timestamps from a source clock into the trace clock.
 * <p><strong>Why:</strong> Per-CPU bundles may be recorded against a clock other than boot time; conversion depends
 * on clock snapshots that only the wider import knows about.</p>
 * <p><strong>Role:</strong> Domain port implemented by {@code SnapshotClockTracker}.</p>
 * <p><strong>Thread-safety:</strong> Implementations document their own guarantees; the tokenizer calls from one
 * thread.</p>
 * <p><strong>Observability:</strong> Implementations own their failure counters; callers treat an empty result as
 * "drop silently".</p>
 *
 * @since 0.1.0
 */
public interface ClockResolverPort {
  /**
   * Converts {@code timestamp} expressed in clock {@code clockId} into the trace clock.
   *
   * @param clockId builtin clock identifier of the source timestamp
   * @param timestamp raw timestamp in nanoseconds
   * @return converted timestamp, or empty when no conversion is possible
   */
  OptionalLong toTraceTime(int clockId, long timestamp);
}
