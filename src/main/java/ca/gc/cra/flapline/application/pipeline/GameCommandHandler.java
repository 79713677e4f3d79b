package ca.gc.cra.flapline.application.pipeline;

import ca.gc.cra.flapline.application.port.ClockPort;
import ca.gc.cra.flapline.application.port.CommandChannel;
import ca.gc.cra.flapline.application.port.CommandHandler;
import ca.gc.cra.flapline.application.port.MetricsPort;
import ca.gc.cra.flapline.domain.command.PlayerCommand;
import ca.gc.cra.flapline.domain.game.GameState;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Worker loop applying player commands to the shared {@link GameState}.
 *
 * <p>Each worker thread runs {@link #consume(CommandChannel)} once; the method returns when the channel is
 * stopped and drained. One handler instance is shared by every worker, so counters are concurrent.</p>
 *
 * <p><strong>Observability:</strong> Observes {@code session.command.latencyMicros} per command and warns
 * (first occurrence, then every {@value #SLOW_LOG_EVERY}th) when the hand-off latency exceeds the
 * configured threshold.</p>
 *
 * @since FLAPLINE 0.1
 */
public final class GameCommandHandler implements CommandHandler<PlayerCommand> {
  private static final Logger log = LoggerFactory.getLogger(GameCommandHandler.class);
  static final long SLOW_LOG_EVERY = 1_000L;

  private final GameState world;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final long latencyWarnMicros;
  private final LatencyRecorder latencies = new LatencyRecorder();
  private final LongAdder applied = new LongAdder();
  private final LongAdder flapsTaken = new LongAdder();
  private final AtomicLong slowCommands = new AtomicLong();

  /**
   * Creates a handler bound to one game.
   *
   * @param world shared game state; must outlive every worker running this handler
   * @param clock clock used to age commands; must match the producer's clock
   * @param metrics metrics sink
   * @param latencyWarnMicros hand-off latency above which a warning is logged
   */
  public GameCommandHandler(GameState world, ClockPort clock, MetricsPort metrics, long latencyWarnMicros) {
    if (latencyWarnMicros <= 0) {
      throw new IllegalArgumentException("latencyWarnMicros must be > 0 (was " + latencyWarnMicros + ")");
    }
    this.world = Objects.requireNonNull(world, "world");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.latencyWarnMicros = latencyWarnMicros;
  }

  @Override
  public void consume(CommandChannel<PlayerCommand> channel) throws InterruptedException {
    Optional<PlayerCommand> next;
    while ((next = channel.take()).isPresent()) {
      PlayerCommand command = next.get();
      long latencyMicros = TimeUnit.NANOSECONDS.toMicros(command.ageNanos(clock.nowNanos()));
      if (world.processCommand(command)) {
        flapsTaken.increment();
      }
      applied.increment();
      latencies.record(latencyMicros);
      metrics.observe("session.command.latencyMicros", latencyMicros);
      if (latencyMicros > latencyWarnMicros) {
        long slow = slowCommands.incrementAndGet();
        if (slow == 1 || slow % SLOW_LOG_EVERY == 0) {
          log.warn("Command for player {} waited {} us in the channel (threshold {} us, {} slow so far)",
              command.playerId(), latencyMicros, latencyWarnMicros, slow);
        }
      }
    }
  }

  /**
   * Returns the number of commands this handler has applied.
   *
   * @return applied command count
   */
  public long appliedCount() {
    return applied.sum();
  }

  /**
   * Returns the number of flaps that changed the bird's velocity.
   *
   * @return effective flap count
   */
  public long effectiveFlaps() {
    return flapsTaken.sum();
  }

  /**
   * Returns the number of commands slower than the warning threshold.
   *
   * @return slow command count
   */
  public long slowCommands() {
    return slowCommands.get();
  }

  /**
   * Returns the hand-off latency summary so far.
   *
   * @return latency summary in microseconds
   */
  public LatencySummary latency() {
    return latencies.summary();
  }
}
