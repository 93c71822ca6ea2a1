package ca.gc.cra.ftrace.application.tokenizer;

import ca.gc.cra.ftrace.domain.ftrace.FtraceClock;
import java.util.Objects;

/**
 * Raised when a bundle's clock domain has no conversion to the trace clock.
 *
 * <p>This is the only failure the tokenizer reports to its caller; malformed data is counted and dropped
 * instead.</p>
 *
 * @since 0.1.0
 */
public final class FtraceTokenizerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final transient FtraceClock clock;

  /**
   * Creates an exception for the rejected clock domain.
   *
   * @param message human readable reason
   * @param clock clock domain carried by the bundle
   */
  public FtraceTokenizerException(String message, FtraceClock clock) {
    super(message);
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Returns the clock domain that caused the failure.
   *
   * @return offending clock domain
   */
  public FtraceClock clock() {
    return clock;
  }
}
