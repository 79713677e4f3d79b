package ca.gc.cra.flapline.config;

import ca.gc.cra.flapline.validation.Numbers;
import ca.gc.cra.flapline.validation.Strings;
import java.util.Map;

/** Typed lookups over flattened key/value settings; blank or absent keys yield the default. */
final class Options {
  private Options() {}

  static long longValue(Map<String, String> options, String key, long defaultValue) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    return Numbers.parseLong(key, raw);
  }

  static int intValue(Map<String, String> options, String key, int defaultValue) {
    long value = longValue(options, key, defaultValue);
    return (int) Numbers.requireRange(key, value, Integer.MIN_VALUE, Integer.MAX_VALUE);
  }

  static boolean booleanValue(Map<String, String> options, String key, boolean defaultValue) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    return Strings.parseBoolean(key, raw);
  }
}
