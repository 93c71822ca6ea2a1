package ca.gc.cra.ftrace.domain.ftrace;

import ca.gc.cra.ftrace.domain.clock.BuiltinClock;
import java.util.Optional;

/**
 * Clock domain selector carried by each ftrace bundle.
 *
 * <p>Only {@link #UNSPECIFIED} and {@link #GLOBAL} have a defined conversion to a {@link BuiltinClock}.
 * {@link #LOCAL} is a per-CPU counter that cannot be related to other clocks.</p>
 *
 * @since 0.1.0
 */
public enum FtraceClock {
  /** Field absent or zero; the kernel default, boot time. */
  UNSPECIFIED(0),
  /** The capture layer could not identify the clock. */
  UNKNOWN(1),
  /** {@code trace_clock=global}, equivalent to {@code CLOCK_MONOTONIC}. */
  GLOBAL(2),
  /** {@code trace_clock=local}, unsynchronized per-CPU counter. */
  LOCAL(3);

  private final int wireValue;

  FtraceClock(int wireValue) {
    this.wireValue = wireValue;
  }

  /**
   * Returns the enum number used on the wire.
   *
   * @return wire value
   */
  public int wireValue() {
    return wireValue;
  }

  /**
   * Maps a decoded wire value to a clock domain; unrecognized numbers become {@link #UNKNOWN}.
   *
   * @param raw decoded varint
   * @return clock domain
   */
  public static FtraceClock fromWire(long raw) {
    for (FtraceClock clock : values()) {
      if (clock.wireValue == raw) {
        return clock;
      }
    }
    return UNKNOWN;
  }

  /**
   * Returns the canonical clock timestamps in this domain are expressed in.
   *
   * @return canonical clock, or empty when no conversion strategy exists
   */
  public Optional<BuiltinClock> canonicalClock() {
    return switch (this) {
      case UNSPECIFIED -> Optional.of(BuiltinClock.BOOTTIME);
      case GLOBAL -> Optional.of(BuiltinClock.MONOTONIC);
      case LOCAL, UNKNOWN -> Optional.empty();
    };
  }
}
