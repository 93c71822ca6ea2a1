package ca.gc.cra.ftrace.application.tokenizer;

/**
 * Counter names reported by the tokenizer through {@code MetricsPort}.
 *
 * @since 0.1.0
 */
public final class FtraceStats {
  /** Bundle without a readable CPU, or event without a timestamp. */
  public static final String BUNDLE_TOKENIZER_ERRORS = "ftrace.bundle.tokenizer.errors";
  /** Compact batch whose columns failed to decode or had unequal lengths; one per batch. */
  public static final String COMPACT_SCHED_PARSE_ERRORS = "ftrace.compact_sched.parse_errors";
  /** Compact row whose comm index points past the intern table. */
  public static final String COMPACT_SCHED_COMM_INDEX_OUT_OF_BOUNDS = "ftrace.compact_sched.comm_index_out_of_bounds";
  /** Bundle flagged by the capture layer as having lost ring-buffer data. */
  public static final String BUNDLE_LOST_EVENTS = "ftrace.bundle.lost_events";
  /** Bundle skipped because its clock domain cannot be converted. */
  public static final String BUNDLE_UNSUPPORTED_CLOCK = "ftrace.bundle.unsupported_clock";

  private FtraceStats() {}
}
