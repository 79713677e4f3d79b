package ca.gc.cra.flapline.application.pipeline;

import java.util.Arrays;
import java.util.SplittableRandom;

/**
 * Thread-safe latency sampler shared by every worker of a run.
 *
 * <p>Count and maximum are exact. Percentiles are computed over a uniform reservoir of at most
 * {@code reservoirSize} samples so long benchmark runs stay within a fixed footprint.</p>
 */
final class LatencyRecorder {
  static final int DEFAULT_RESERVOIR = 100_000;

  private final long[] reservoir;
  private final SplittableRandom random = new SplittableRandom(0x5EEDL);
  private long count;
  private long max;

  LatencyRecorder() {
    this(DEFAULT_RESERVOIR);
  }

  LatencyRecorder(int reservoirSize) {
    if (reservoirSize <= 0) {
      throw new IllegalArgumentException("reservoirSize must be > 0 (was " + reservoirSize + ")");
    }
    this.reservoir = new long[reservoirSize];
  }

  synchronized void record(long micros) {
    long sample = Math.max(0L, micros);
    if (count < reservoir.length) {
      reservoir[(int) count] = sample;
    } else {
      long slot = random.nextLong(count + 1);
      if (slot < reservoir.length) {
        reservoir[(int) slot] = sample;
      }
    }
    count++;
    if (sample > max) {
      max = sample;
    }
  }

  synchronized LatencySummary summary() {
    if (count == 0) {
      return LatencySummary.EMPTY;
    }
    int retained = (int) Math.min(count, reservoir.length);
    long[] sorted = Arrays.copyOf(reservoir, retained);
    Arrays.sort(sorted);
    return new LatencySummary(count, percentile(sorted, 0.50d), percentile(sorted, 0.99d), max);
  }

  private static long percentile(long[] sorted, double quantile) {
    int rank = (int) Math.ceil(quantile * sorted.length) - 1;
    return sorted[Math.max(0, Math.min(rank, sorted.length - 1))];
  }
}
