package ca.gc.cra.ftrace.api;

/**
 * <strong>What:</strong> Process exit codes of the command-line tools.
 * <p><strong>Why:</strong> Scripts driving imports need to tell bad arguments apart from unreadable traces and
 * from traces the tokenizer rejects.</p>
 * <p><strong>Thread-safety:</strong> Immutable enum.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Reading the trace or writing the output failed. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** The trace uses a clock domain that cannot be converted. */
  DECODE_ERROR(6),
  /** Process was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process status.
   *
   * @return exit status
   */
  public int code() {
    return code;
  }
}
