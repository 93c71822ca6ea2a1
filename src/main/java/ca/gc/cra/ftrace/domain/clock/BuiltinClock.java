package ca.gc.cra.ftrace.domain.clock;

import java.util.Optional;

/**
 * <strong>What:</strong> Canonical clock identifiers shared by every trace data source.
 * <p><strong>Why:</strong> Timestamps from different producers are normalized to a single trace clock before they
 * reach the event sink; clock snapshots relate these identifiers to each other.</p>
 * <p><strong>Role:</strong> Domain enumeration consumed by the tokenizer and the clock tracker.</p>
 * <p><strong>Thread-safety:</strong> Immutable enum.</p>
 *
 * @implNote Identifiers match the values used on the wire by clock snapshot packets.
 * @since 0.1.0
 */
public enum BuiltinClock {
  /** {@code CLOCK_REALTIME}. */
  REALTIME(1),
  /** {@code CLOCK_REALTIME_COARSE}. */
  REALTIME_COARSE(2),
  /** {@code CLOCK_MONOTONIC}; the kernel's {@code global} ftrace clock. */
  MONOTONIC(3),
  /** {@code CLOCK_MONOTONIC_COARSE}. */
  MONOTONIC_COARSE(4),
  /** {@code CLOCK_MONOTONIC_RAW}. */
  MONOTONIC_RAW(5),
  /** {@code CLOCK_BOOTTIME}; the default ftrace clock and the trace clock. */
  BOOTTIME(6);

  /** Clock that every emitted timestamp is expressed in. */
  public static final BuiltinClock TRACE_CLOCK = BOOTTIME;

  private final int id;

  BuiltinClock(int id) {
    this.id = id;
  }

  /**
   * Returns the numeric identifier used on the wire.
   *
   * @return clock identifier
   */
  public int id() {
    return id;
  }

  /**
   * Looks up a builtin clock by wire identifier.
   *
   * @param id clock identifier
   * @return matching clock, or empty for sequence-scoped or unknown identifiers
   */
  public static Optional<BuiltinClock> fromId(int id) {
    for (BuiltinClock clock : values()) {
      if (clock.id == id) {
        return Optional.of(clock);
      }
    }
    return Optional.empty();
  }
}
