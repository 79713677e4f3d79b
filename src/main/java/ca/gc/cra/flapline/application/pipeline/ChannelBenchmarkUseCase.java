package ca.gc.cra.flapline.application.pipeline;

import ca.gc.cra.flapline.application.port.ClockPort;
import ca.gc.cra.flapline.application.port.CommandChannel;
import ca.gc.cra.flapline.application.port.MetricsPort;
import ca.gc.cra.flapline.config.BenchSettings;
import ca.gc.cra.flapline.infrastructure.channel.BlockingCommandChannel;
import ca.gc.cra.flapline.infrastructure.exec.TeardownOutcome;
import ca.gc.cra.flapline.infrastructure.exec.WorkerPool;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicIntegerArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Floods a channel from one producer into a worker pool and verifies exactly-once delivery.
 *
 * <p>Each value carries a sequence number; workers tick a per-sequence slot so duplicates and losses can be
 * counted after join. Dropped submissions on a bounded channel are reported separately from losses.</p>
 *
 * @since FLAPLINE 0.1
 */
public final class ChannelBenchmarkUseCase {
  private static final Logger log = LoggerFactory.getLogger(ChannelBenchmarkUseCase.class);

  private final BenchSettings settings;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a benchmark run.
   *
   * @param settings validated benchmark settings
   * @param metrics metrics sink
   * @param clock clock used to stamp and age values
   */
  public ChannelBenchmarkUseCase(BenchSettings settings, MetricsPort metrics, ClockPort clock) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Runs the benchmark once.
   *
   * @return throughput, latency and delivery counts
   */
  public BenchmarkResult run() {
    int commands = settings.commands();
    AtomicIntegerArray deliveries = new AtomicIntegerArray(commands);
    LatencyRecorder latencies = new LatencyRecorder();
    BlockingCommandChannel<Stamped> channel =
        new BlockingCommandChannel<>("bench", settings.queueCapacity(), metrics);
    WorkerPool<Stamped> pool = new WorkerPool<>(
        settings.workers(),
        channel,
        ch -> drain(ch, deliveries, latencies),
        new WorkerPool.Settings("flapline-bench", false),
        metrics);

    log.info("Benchmark starting: commands={} workers={} queueCapacity={}",
        commands, settings.workers(), settings.queueCapacity());
    long start = clock.nowNanos();
    TeardownOutcome outcome;
    try {
      pool.start();
      for (int i = 0; i < commands; i++) {
        channel.submit(new Stamped(i, clock.nowNanos()));
      }
    } finally {
      channel.stop();
      outcome = pool.join();
    }
    Duration elapsed = Duration.ofNanos(Math.max(1L, clock.nowNanos() - start));

    long duplicates = 0;
    long undelivered = 0;
    for (int i = 0; i < commands; i++) {
      int seen = deliveries.get(i);
      if (seen == 0) {
        undelivered++;
      } else if (seen > 1) {
        duplicates += seen - 1;
      }
    }
    long dropped = channel.droppedCount();
    BenchmarkResult result = new BenchmarkResult(
        commands,
        settings.workers(),
        channel.acceptedCount(),
        dropped,
        duplicates,
        Math.max(0L, undelivered - dropped),
        latencies.summary(),
        outcome,
        elapsed);
    if (result.duplicates() > 0 || result.missing() > 0) {
      log.error("Benchmark delivery mismatch: duplicates={} missing={}", result.duplicates(), result.missing());
    }
    log.info("Benchmark finished in {} ms: {} cmd/s, p50={} us p99={} us max={} us, teardown={}",
        elapsed.toMillis(), Math.round(result.throughputPerSecond()), result.latency().p50Micros(),
        result.latency().p99Micros(), result.latency().maxMicros(), outcome);
    return result;
  }

  private void drain(CommandChannel<Stamped> channel, AtomicIntegerArray deliveries, LatencyRecorder latencies)
      throws InterruptedException {
    Optional<Stamped> next;
    while ((next = channel.take()).isPresent()) {
      Stamped value = next.get();
      long micros = TimeUnit.NANOSECONDS.toMicros(Math.max(0L, clock.nowNanos() - value.submittedNanos()));
      deliveries.incrementAndGet(value.sequence());
      latencies.record(micros);
      metrics.observe("bench.handoff.latencyMicros", micros);
    }
  }

  private record Stamped(int sequence, long submittedNanos) {}

  /**
   * Benchmark outcome.
   *
   * @param commands values the producer attempted to submit
   * @param workers worker thread count
   * @param accepted values accepted by the channel
   * @param dropped values rejected by a full bounded channel
   * @param duplicates extra deliveries beyond the first for any value
   * @param missing accepted values never delivered
   * @param latency hand-off latency summary
   * @param teardown how the pool was released
   * @param elapsed producer start to join return
   */
  public record BenchmarkResult(
      int commands,
      int workers,
      long accepted,
      long dropped,
      long duplicates,
      long missing,
      LatencySummary latency,
      TeardownOutcome teardown,
      Duration elapsed) {

    /**
     * Returns delivered values per second of elapsed time.
     *
     * @return throughput in commands per second
     */
    public double throughputPerSecond() {
      double seconds = elapsed.toNanos() / 1_000_000_000d;
      return seconds <= 0d ? 0d : (accepted - missing) / seconds;
    }
  }
}
