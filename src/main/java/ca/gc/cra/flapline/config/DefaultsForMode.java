package ca.gc.cra.flapline.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Flattened default settings per CLI mode, derived from {@link SessionSettings#defaults()} and
 * {@link BenchSettings#defaults()}.
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns defaults for the requested mode merged with the common defaults.
   *
   * @param mode {@code play} or {@code bench}
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException for an unknown mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "play" -> buildPlayDefaults();
      case "bench" -> buildBenchDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    map.put("dryRun", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildPlayDefaults() {
    SessionSettings defaults = SessionSettings.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("workers", Integer.toString(defaults.workers()));
    map.put("queueCapacity", Integer.toString(defaults.queueCapacity()));
    map.put("tickHz", Integer.toString(defaults.tickHz()));
    map.put("maxTicks", Long.toString(defaults.maxTicks()));
    map.put("input", defaults.input().name());
    map.put("scriptTailTicks", Long.toString(defaults.scriptTailTicks()));
    map.put("flapEvery", Integer.toString(defaults.flapEvery()));
    map.put("seed", Long.toString(defaults.seed()));
    map.put("latencyWarnMicros", Long.toString(defaults.latencyWarnMicros()));
    map.put("realtime", Boolean.toString(defaults.realtime()));
    map.put("daemonWorkers", Boolean.toString(defaults.daemonWorkers()));
    return map;
  }

  private static Map<String, String> buildBenchDefaults() {
    BenchSettings defaults = BenchSettings.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("workers", Integer.toString(defaults.workers()));
    map.put("commands", Integer.toString(defaults.commands()));
    map.put("queueCapacity", Integer.toString(defaults.queueCapacity()));
    return map;
  }
}
