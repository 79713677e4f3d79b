package ca.gc.cra.flapline.application.port;

/**
 * <strong>What:</strong> Port abstracting FLAPLINE metrics emission.
 * <p><strong>Why:</strong> The channel, pool, and session record counters and latency samples without binding
 * to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} serves tests and
 * disabled exporters.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from the tick loop and every
 * worker thread.</p>
 * <p><strong>Performance:</strong> Calls sit on the hand-off path and must not block.</p>
 *
 * @since FLAPLINE 0.1
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric name (e.g., {@code channel.submit.dropped}); must not be {@code null}
   */
  default void increment(String key) {
    add(key, 1L);
  }

  /**
   * Adds {@code delta} to the named counter.
   *
   * @param key dotted metric name; must not be {@code null}
   * @param delta non-negative amount to add
   */
  void add(String key, long delta);

  /**
   * Records a histogram sample.
   *
   * @param key dotted metric name (e.g., {@code session.command.latencyMicros}); must not be {@code null}
   * @param value observed value in the unit implied by the name
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void add(String key, long delta) {}

    @Override public void observe(String key, long value) {}
  };
}
