package ca.gc.cra.flapline.config;

import ca.gc.cra.flapline.application.pipeline.ChannelBenchmarkUseCase;
import ca.gc.cra.flapline.application.pipeline.GameSessionUseCase;
import ca.gc.cra.flapline.application.port.ClockPort;
import ca.gc.cra.flapline.application.port.InputSource;
import ca.gc.cra.flapline.application.port.MetricsPort;
import ca.gc.cra.flapline.domain.game.GameState;
import ca.gc.cra.flapline.infrastructure.input.AutopilotInputSource;
import ca.gc.cra.flapline.infrastructure.input.PeriodicInputSource;
import ca.gc.cra.flapline.infrastructure.input.ScriptedInputSource;
import ca.gc.cra.flapline.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.flapline.infrastructure.time.SystemClockAdapter;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires FLAPLINE use cases to concrete adapters.
 * <p><strong>Role:</strong> Composition root used by the CLI entry points.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the {@link InputSource} named by {@link SessionSettings#input()}.</li>
 *   <li>Construct session and benchmark use cases with shared metrics and clock adapters.</li>
 *   <li>Flush and close the metrics adapter on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Factory methods are not synchronized; call during CLI bootstrap.</p>
 *
 * @since FLAPLINE 0.1
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a root backed by the OpenTelemetry metrics adapter and the system clock.
   */
  public CompositionRoot() {
    this(new OpenTelemetryMetricsAdapter(), new SystemClockAdapter());
  }

  /**
   * Creates a root with explicit metrics and clock adapters.
   *
   * @param metrics metrics adapter shared by every use case
   * @param clock clock shared by every use case
   */
  public CompositionRoot(MetricsPort metrics, ClockPort clock) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Builds the input source for a session.
   *
   * @param settings session settings
   * @return input source matching {@link SessionSettings#input()}
   */
  public InputSource inputSource(SessionSettings settings) {
    return switch (settings.input()) {
      case AUTOPILOT -> new AutopilotInputSource();
      case SCRIPT -> ScriptedInputSource.parse(settings.script(), settings.scriptTailTicks());
      case PERIODIC -> new PeriodicInputSource(settings.flapEvery(), 0);
    };
  }

  /**
   * Builds a session over a fresh game seeded from the settings.
   *
   * @param settings session settings
   * @return session use case, not yet run
   */
  public GameSessionUseCase gameSessionUseCase(SessionSettings settings) {
    return new GameSessionUseCase(
        settings, inputSource(settings), new GameState(settings.seed()), metrics, clock);
  }

  /**
   * Builds a channel benchmark.
   *
   * @param settings benchmark settings
   * @return benchmark use case, not yet run
   */
  public ChannelBenchmarkUseCase channelBenchmarkUseCase(BenchSettings settings) {
    return new ChannelBenchmarkUseCase(settings, metrics, clock);
  }

  /**
   * Returns the shared metrics adapter.
   *
   * @return metrics adapter
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Returns the shared clock.
   *
   * @return clock adapter
   */
  public ClockPort clock() {
    return clock;
  }

  @Override
  public void close() {
    if (metrics instanceof OpenTelemetryMetricsAdapter adapter) {
      try {
        adapter.forceFlush();
      } finally {
        adapter.close();
      }
      log.debug("Metrics adapter closed");
    }
  }
}
