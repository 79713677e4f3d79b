package ca.gc.cra.flapline.config;

import ca.gc.cra.flapline.infrastructure.input.ScriptedInputSource;
import ca.gc.cra.flapline.validation.Numbers;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Settings for one play session: pool size, channel bound, tick rate and input.
 * <p><strong>Role:</strong> Configuration record consumed by {@link CompositionRoot} and
 * {@link ca.gc.cra.flapline.application.pipeline.GameSessionUseCase}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param workers worker thread count, 1 to 64
 * @param queueCapacity channel bound; {@code 0} is unbounded, otherwise at least {@code workers}
 * @param tickHz physics ticks per second, 1 to 1000
 * @param maxTicks tick limit for the session
 * @param input input strategy
 * @param script comma-separated flap ticks, each 0 to 10,000,000, used when {@code input=SCRIPT}
 * @param scriptTailTicks ticks to keep running after the last scripted flap
 * @param flapEvery flap interval used when {@code input=PERIODIC}
 * @param seed seed for pipe gap placement
 * @param latencyWarnMicros hand-off latency above which workers log a warning
 * @param realtime whether ticks are paced to wall time
 * @param daemonWorkers whether worker threads are daemon threads
 * @since FLAPLINE 0.1
 */
public record SessionSettings(
    int workers,
    int queueCapacity,
    int tickHz,
    long maxTicks,
    InputMode input,
    String script,
    long scriptTailTicks,
    int flapEvery,
    long seed,
    long latencyWarnMicros,
    boolean realtime,
    boolean daemonWorkers) {

  static final int MAX_WORKERS = 64;
  static final int MAX_QUEUE_CAPACITY = 1 << 20;

  /**
   * Validates ranges and cross-field constraints.
   *
   * @throws IllegalArgumentException when a value is out of range, the script is malformed, or
   *     {@code input=SCRIPT} has no script
   */
  public SessionSettings {
    Numbers.requireRange("workers", workers, 1, MAX_WORKERS);
    if (queueCapacity != 0) {
      Numbers.requireRange("queueCapacity", queueCapacity, workers, MAX_QUEUE_CAPACITY);
    }
    Numbers.requireRange("tickHz", tickHz, 1, 1_000);
    Numbers.requireRange("maxTicks", maxTicks, 1, 10_000_000);
    input = Objects.requireNonNullElse(input, InputMode.AUTOPILOT);
    script = script == null ? "" : script.trim();
    Numbers.requireRange("scriptTailTicks", scriptTailTicks, 0, 10_000_000);
    Numbers.requireRange("flapEvery", flapEvery, 1, 10_000);
    Numbers.requireRange("latencyWarnMicros", latencyWarnMicros, 1, 10_000_000);
    List<Long> ticks = ScriptedInputSource.parseTicks(script);
    if (input == InputMode.SCRIPT && ticks.isEmpty()) {
      throw new IllegalArgumentException("script is required when input=SCRIPT");
    }
  }

  /**
   * Returns the built-in defaults: four workers, unbounded channel, 60 Hz for one minute, autopilot.
   *
   * @return default settings
   */
  public static SessionSettings defaults() {
    return new SessionSettings(4, 0, 60, 3_600, InputMode.AUTOPILOT, "", 120, 20, 42L, 1_000, true, false);
  }

  /**
   * Builds settings from flattened key/value pairs; absent keys keep their defaults.
   *
   * @param options keys such as {@code workers}, {@code tickHz}, {@code input}
   * @return validated settings
   * @throws IllegalArgumentException when a value cannot be parsed or is out of range
   */
  public static SessionSettings fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    SessionSettings d = defaults();
    return new SessionSettings(
        Options.intValue(options, "workers", d.workers()),
        Options.intValue(options, "queueCapacity", d.queueCapacity()),
        Options.intValue(options, "tickHz", d.tickHz()),
        Options.longValue(options, "maxTicks", d.maxTicks()),
        InputMode.fromString(options.get("input")),
        options.getOrDefault("script", d.script()),
        Options.longValue(options, "scriptTailTicks", d.scriptTailTicks()),
        Options.intValue(options, "flapEvery", d.flapEvery()),
        Options.longValue(options, "seed", d.seed()),
        Options.longValue(options, "latencyWarnMicros", d.latencyWarnMicros()),
        Options.booleanValue(options, "realtime", d.realtime()),
        Options.booleanValue(options, "daemonWorkers", d.daemonWorkers()));
  }
}
