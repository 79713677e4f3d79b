package ca.gc.cra.flapline.application.pipeline;

import ca.gc.cra.flapline.application.port.ClockPort;
import ca.gc.cra.flapline.application.port.InputSource;
import ca.gc.cra.flapline.application.port.MetricsPort;
import ca.gc.cra.flapline.config.SessionSettings;
import ca.gc.cra.flapline.domain.command.ActionType;
import ca.gc.cra.flapline.domain.command.PlayerCommand;
import ca.gc.cra.flapline.domain.game.BirdState;
import ca.gc.cra.flapline.domain.game.GameState;
import ca.gc.cra.flapline.infrastructure.channel.BlockingCommandChannel;
import ca.gc.cra.flapline.infrastructure.exec.TeardownOutcome;
import ca.gc.cra.flapline.infrastructure.exec.WorkerPool;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.LockSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs one game session: a fixed-rate producer loop feeding player commands to a
 * worker pool that applies them to the shared {@link GameState}.
 * <p><strong>Role:</strong> Application-layer orchestrator owning the channel and the pool.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Poll the {@link InputSource} once per tick and submit a {@link PlayerCommand} per flap.</li>
 *   <li>Advance physics by {@code 1/tickHz} seconds per tick, pacing to wall time when {@code realtime}.</li>
 *   <li>On every exit path run {@code channel.stop()} then {@code pool.join()} before releasing the channel.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #run()} may be called once, from a single producer thread.</p>
 * <p><strong>Observability:</strong> Sets MDC {@code session}, increments {@code session.tick.count} and logs
 * the teardown outcome.</p>
 *
 * @since FLAPLINE 0.1
 */
public final class GameSessionUseCase {
  private static final Logger log = LoggerFactory.getLogger(GameSessionUseCase.class);
  static final String MDC_SESSION = "session";
  static final int PLAYER_ID = 0;

  private final SessionSettings settings;
  private final InputSource input;
  private final GameState world;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final String sessionId;
  private final AtomicBoolean ran = new AtomicBoolean();

  /**
   * Creates a session with a random identifier.
   *
   * @param settings validated session settings
   * @param input source of per-tick events
   * @param world game state shared with the workers
   * @param metrics metrics sink
   * @param clock clock for command timestamps, pacing and elapsed time
   */
  public GameSessionUseCase(
      SessionSettings settings, InputSource input, GameState world, MetricsPort metrics, ClockPort clock) {
    this(settings, input, world, metrics, clock, UUID.randomUUID().toString().substring(0, 8));
  }

  GameSessionUseCase(
      SessionSettings settings,
      InputSource input,
      GameState world,
      MetricsPort metrics,
      ClockPort clock,
      String sessionId) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.input = Objects.requireNonNull(input, "input");
    this.world = Objects.requireNonNull(world, "world");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
  }

  /**
   * Plays the session until the bird dies, input runs out, the tick limit is hit, or the thread is interrupted.
   *
   * <p>An interrupt ends the loop rather than propagating; the interrupt status is set again before this
   * method returns.</p>
   *
   * @return summary of the run
   * @throws IllegalStateException if called more than once
   */
  public SessionReport run() {
    if (!ran.compareAndSet(false, true)) {
      throw new IllegalStateException("Session " + sessionId + " already ran");
    }
    String previousSession = MDC.get(MDC_SESSION);
    MDC.put(MDC_SESSION, sessionId);
    long startNanos = clock.nowNanos();
    BlockingCommandChannel<PlayerCommand> channel =
        new BlockingCommandChannel<>("session-" + sessionId, settings.queueCapacity(), metrics);
    GameCommandHandler handler =
        new GameCommandHandler(world, clock, metrics, settings.latencyWarnMicros());
    WorkerPool<PlayerCommand> pool = new WorkerPool<>(
        settings.workers(),
        channel,
        handler,
        new WorkerPool.Settings("flapline-" + sessionId, settings.daemonWorkers()),
        metrics);

    long ticks = 0;
    long submitted = 0;
    SessionReport.EndReason reason = SessionReport.EndReason.MAX_TICKS;
    TeardownOutcome outcome = TeardownOutcome.NOT_STARTED;
    boolean interrupted = false;
    try {
      log.info("Session starting: input={} workers={} tickHz={} maxTicks={} queueCapacity={} realtime={}",
          input.name(), settings.workers(), settings.tickHz(), settings.maxTicks(),
          settings.queueCapacity() == BlockingCommandChannel.UNBOUNDED ? "unbounded" : settings.queueCapacity(),
          settings.realtime());
      pool.start();
      double dt = 1d / settings.tickHz();
      long periodNanos = TimeUnit.SECONDS.toNanos(1) / settings.tickHz();
      while (true) {
        if (Thread.currentThread().isInterrupted()) {
          reason = SessionReport.EndReason.INTERRUPTED;
          break;
        }
        if (ticks >= settings.maxTicks()) {
          reason = SessionReport.EndReason.MAX_TICKS;
          break;
        }
        if (input.isExhausted()) {
          reason = SessionReport.EndReason.INPUT_EXHAUSTED;
          break;
        }
        for (ActionType action : input.poll(ticks, world)) {
          if (action == ActionType.FLAP) {
            channel.submit(PlayerCommand.flap(PLAYER_ID, clock.nowNanos()));
            submitted++;
          }
        }
        world.updatePhysics(dt);
        ticks++;
        metrics.increment("session.tick.count");
        if (!world.birdState().alive()) {
          reason = SessionReport.EndReason.BIRD_DIED;
          break;
        }
        if (settings.realtime()) {
          paceUntil(startNanos + ticks * periodNanos);
        }
      }
    } finally {
      // join() must not observe a pending interrupt; restored below.
      interrupted = Thread.interrupted();
      channel.stop();
      outcome = pool.join();
      if (outcome.workersQuiesced()) {
        log.info("Session workers joined ({}); releasing channel", outcome);
      } else {
        log.error("Session workers not quiesced ({}); channel released with {} live workers",
            outcome, pool.liveWorkers());
      }
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
      restoreSession(previousSession);
    }

    BirdState bird = world.birdState();
    SessionReport report = new SessionReport(
        sessionId,
        ticks,
        submitted,
        handler.appliedCount(),
        channel.droppedCount(),
        bird.score(),
        bird.alive(),
        reason,
        handler.latency(),
        outcome,
        Duration.ofNanos(Math.max(0L, clock.nowNanos() - startNanos)));
    log.info("Session {} ended ({}) after {} ticks: score={} submitted={} applied={} dropped={}",
        sessionId, report.endReason(), ticks, report.finalScore(), submitted,
        report.commandsApplied(), report.commandsDropped());
    return report;
  }

  /**
   * Returns the identifier used for MDC and thread names.
   *
   * @return session identifier
   */
  public String sessionId() {
    return sessionId;
  }

  private void paceUntil(long deadlineNanos) {
    long remaining;
    while ((remaining = deadlineNanos - clock.nowNanos()) > 0) {
      LockSupport.parkNanos(remaining);
      if (Thread.currentThread().isInterrupted()) {
        return;
      }
    }
  }

  private static void restoreSession(String previous) {
    if (previous == null) {
      MDC.remove(MDC_SESSION);
    } else {
      MDC.put(MDC_SESSION, previous);
    }
  }
}
