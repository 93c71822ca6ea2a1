package ca.gc.cra.ftrace.domain.proto;

/**
 * Mutable error marker shared by the packed iterators of one columnar batch.
 *
 * <p>Not thread-safe; one flag belongs to one decoding pass.</p>
 *
 * @since 0.1.0
 */
public final class ParseErrorFlag {
  private boolean set;

  /** Records that at least one column failed to decode. */
  public void set() {
    set = true;
  }

  /**
   * Reports whether any column failed to decode.
   *
   * @return {@code true} once {@link #set()} has been called
   */
  public boolean isSet() {
    return set;
  }
}
