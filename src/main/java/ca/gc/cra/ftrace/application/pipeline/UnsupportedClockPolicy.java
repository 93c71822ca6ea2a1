package ca.gc.cra.ftrace.application.pipeline;

/**
 * Reaction of the import when a bundle uses a clock domain that cannot be converted.
 *
 * @since 0.1.0
 */
public enum UnsupportedClockPolicy {
  /** Abort the import with the tokenizer's error. */
  FAIL,
  /** Log, count {@code ftrace.bundle.unsupported_clock}, and continue with the next packet. */
  SKIP;

  /**
   * Parses a configuration value, ignoring case.
   *
   * @param value configured value; must not be {@code null}
   * @return matching policy
   * @throws IllegalArgumentException if the value names no policy
   */
  public static UnsupportedClockPolicy fromString(String value) {
    for (UnsupportedClockPolicy policy : values()) {
      if (policy.name().equalsIgnoreCase(value.trim())) {
        return policy;
      }
    }
    throw new IllegalArgumentException("unsupportedClock must be FAIL or SKIP (was " + value + ")");
  }
}
