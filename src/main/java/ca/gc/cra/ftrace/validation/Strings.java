package ca.gc.cra.ftrace.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> String checks for configuration and CLI values.
 * <p><strong>Why:</strong> Values end up in file paths, log lines and telemetry resource attributes; rejecting
 * control characters up front keeps those consumers simple.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 * @see Paths
 */
public final class Strings {
  private Strings() {}

  /**
   * Requires a non-blank value without control characters.
   *
   * @param name parameter name used in error messages
   * @param value candidate value
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains control characters
   */
  public static String requireNonBlank(String name, String value) {
    Objects.requireNonNull(value, label(name));
    if (containsControl(value)) {
      throw new IllegalArgumentException(label(name) + " must not contain control characters");
    }
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    return trimmed;
  }

  /**
   * Requires a printable ASCII value no longer than {@code maxLength}.
   *
   * @param name parameter name used in error messages
   * @param value candidate value
   * @param maxLength maximum length in characters
   * @return trimmed value
   * @throws IllegalArgumentException if the value is blank, too long, or contains characters outside
   *     {@code 0x20-0x7E}
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String trimmed = requireNonBlank(name, value);
    if (trimmed.length() > maxLength) {
      throw new IllegalArgumentException(label(name) + " length must be <= " + maxLength);
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(label(name) + " must contain printable ASCII characters");
      }
    }
    return trimmed;
  }

  /**
   * Parses a strict boolean, accepting only {@code true} or {@code false} in any case.
   *
   * @param name parameter name used in error messages
   * @param value candidate value; blank yields {@code defaultValue}
   * @param defaultValue value used when {@code value} is {@code null} or blank
   * @return parsed flag
   * @throws IllegalArgumentException if the value is neither {@code true} nor {@code false}
   */
  public static boolean parseBoolean(String name, String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String trimmed = value.trim();
    if (trimmed.equalsIgnoreCase("true")) {
      return true;
    }
    if (trimmed.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException(label(name) + " must be true or false (was " + value + ")");
  }

  static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
