package ca.gc.cra.ftrace.domain.strings;

/**
 * Handle to a string owned by the global string pool.
 *
 * <p>Handles outlive the per-bundle intern tables that reference them.</p>
 *
 * @param id pool-assigned identifier; {@code 0} denotes the null string
 * @since 0.1.0
 */
public record StringId(int id) {
  /** Handle of the null/empty string. */
  public static final StringId NULL = new StringId(0);

  /**
   * Validates the identifier.
   *
   * @throws IllegalArgumentException if {@code id} is negative
   */
  public StringId {
    if (id < 0) {
      throw new IllegalArgumentException("string id must be non-negative (was " + id + ")");
    }
  }

  /**
   * Reports whether this handle refers to the null string.
   *
   * @return {@code true} for {@link #NULL}
   */
  public boolean isNull() {
    return id == 0;
  }
}
