package ca.gc.cra.flapline.config;

import ca.gc.cra.flapline.validation.Numbers;
import java.util.Map;
import java.util.Objects;

/**
 * Settings for the channel hand-off benchmark.
 *
 * @param workers consumer thread count, 1 to 64
 * @param commands values pushed by the producer, 1 to 50,000,000
 * @param queueCapacity channel bound; {@code 0} is unbounded, otherwise at least {@code workers}
 * @since FLAPLINE 0.1
 */
public record BenchSettings(int workers, int commands, int queueCapacity) {

  /**
   * Validates ranges.
   *
   * @throws IllegalArgumentException when a value is out of range
   */
  public BenchSettings {
    Numbers.requireRange("workers", workers, 1, SessionSettings.MAX_WORKERS);
    Numbers.requireRange("commands", commands, 1, 50_000_000);
    if (queueCapacity != 0) {
      Numbers.requireRange("queueCapacity", queueCapacity, workers, SessionSettings.MAX_QUEUE_CAPACITY);
    }
  }

  /**
   * Eight workers, 100,000 commands, unbounded channel.
   *
   * @return default settings
   */
  public static BenchSettings defaults() {
    return new BenchSettings(8, 100_000, 0);
  }

  /**
   * Builds settings from flattened key/value pairs; absent keys keep their defaults.
   *
   * @param options keys {@code workers}, {@code commands}, {@code queueCapacity}
   * @return validated settings
   */
  public static BenchSettings fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    BenchSettings d = defaults();
    return new BenchSettings(
        Options.intValue(options, "workers", d.workers()),
        Options.intValue(options, "commands", d.commands()),
        Options.intValue(options, "queueCapacity", d.queueCapacity()));
  }
}
