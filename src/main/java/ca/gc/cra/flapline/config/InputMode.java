package ca.gc.cra.flapline.config;

import java.util.Locale;

/**
 * <strong>What:</strong> Input strategies available to the play session.
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since FLAPLINE 0.1
 */
public enum InputMode {
  /** Self-playing bot steering toward the next gap. */
  AUTOPILOT,
  /** Flaps at the tick numbers listed in {@code script}. */
  SCRIPT,
  /** One flap every {@code flapEvery} ticks. */
  PERIODIC;

  /**
   * Parses a mode name, defaulting to {@link #AUTOPILOT} when blank.
   *
   * @param value textual mode such as {@code "script"}
   * @return parsed mode
   * @throws IllegalArgumentException if the value does not name a mode
   */
  public static InputMode fromString(String value) {
    if (value == null || value.isBlank()) {
      return AUTOPILOT;
    }
    try {
      return InputMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown input: " + value + " (expected AUTOPILOT, SCRIPT or PERIODIC)", ex);
    }
  }
}
