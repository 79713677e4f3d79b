package ca.gc.cra.flapline.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * Numeric range checks for CLI and YAML settings.
 *
 * <p>Stateless; violations raise {@link IllegalArgumentException} with the setting name in the message.</p>
 *
 * @since FLAPLINE 0.1
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a value falls within an inclusive range.
   *
   * @param name setting name used in diagnostics; blank becomes {@code "value"}
   * @param value candidate value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value}
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Int variant of {@link #requireRange(String, long, long, long)}.
   *
   * @param name setting name used in diagnostics
   * @param value candidate value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value}
   */
  public static int requireRange(String name, int value, int min, int max) {
    return (int) requireRange(name, (long) value, min, max);
  }

  /**
   * Parses a decimal integer setting.
   *
   * @param name setting name used in diagnostics
   * @param raw text to parse; surrounding whitespace and {@code _} separators are ignored
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is blank or not an integer
   */
  public static long parseLong(String name, String raw) {
    String trimmed = Strings.requireNonBlank(name, raw).replace("_", "");
    try {
      return Long.parseLong(trimmed);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was '" + raw + "')", ex);
    }
  }

  /**
   * Parses a comma-separated list of integers, each within an inclusive range.
   *
   * @param name setting name used in diagnostics
   * @param raw list such as {@code "5, 20,20"}; {@code null}, blank, and empty tokens are skipped
   * @param min inclusive lower bound for every element
   * @param max inclusive upper bound for every element
   * @return parsed values in input order, duplicates kept
   * @throws IllegalArgumentException if an element is not an integer or lies outside {@code [min, max]}
   */
  public static List<Long> parseLongList(String name, String raw, long min, long max) {
    if (raw == null || raw.isBlank()) {
      return List.of();
    }
    List<Long> values = new ArrayList<>();
    for (String token : raw.split(",")) {
      if (token.isBlank()) {
        continue;
      }
      values.add(requireRange(name, parseLong(name, token), min, max));
    }
    return List.copyOf(values);
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
