package ca.gc.cra.ftrace.application.tokenizer;

/**
 * Reaction of the compact scheduling decoder when a row's timestamp cannot be converted to the trace clock.
 *
 * @since 0.1.0
 */
public enum CompactSchedClockPolicy {
  /** Stop decoding the batch; later rows are dropped and the column length check is skipped. */
  ABORT_BATCH,
  /** Drop only the failing row and keep decoding. */
  SKIP_ROW;

  /**
   * Parses a configuration value, ignoring case.
   *
   * @param value configured value; must not be {@code null}
   * @return matching policy
   * @throws IllegalArgumentException if the value names no policy
   */
  public static CompactSchedClockPolicy fromString(String value) {
    for (CompactSchedClockPolicy policy : values()) {
      if (policy.name().equalsIgnoreCase(value.trim())) {
        return policy;
      }
    }
    throw new IllegalArgumentException(
        "compactSchedClockFailure must be ABORT_BATCH or SKIP_ROW (was " + value + ")");
  }
}
