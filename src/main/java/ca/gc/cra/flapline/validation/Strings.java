package ca.gc.cra.flapline.validation;

import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> String checks for CLI arguments, YAML values and thread-name prefixes.
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since FLAPLINE 0.1
 * @see Numbers
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a string is non-null, non-blank and free of control characters.
   *
   * @param name setting name used in diagnostics
   * @param value candidate text
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Ensures a value is printable ASCII no longer than {@code maxLength}.
   *
   * @param name setting name used in diagnostics
   * @param value candidate text
   * @param maxLength maximum length in characters
   * @return trimmed value
   * @throws IllegalArgumentException if the value is too long or contains characters outside {@code 0x20-0x7E}
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  /**
   * Parses {@code true/false}, {@code yes/no} or {@code 1/0}, case-insensitively.
   *
   * @param name setting name used in diagnostics
   * @param value candidate text
   * @return parsed flag
   * @throws IllegalArgumentException if the value is not a recognised boolean
   */
  public static boolean parseBoolean(String name, String value) {
    String normalized = requireNonBlank(name, value).toLowerCase(Locale.ROOT);
    switch (normalized) {
      case "true", "yes", "1":
        return true;
      case "false", "no", "0":
        return false;
      default:
        throw new IllegalArgumentException(message(name, "must be true or false (was '" + value + "')"));
    }
  }

  static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
