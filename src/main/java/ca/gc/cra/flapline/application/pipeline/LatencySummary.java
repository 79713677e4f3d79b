package ca.gc.cra.flapline.application.pipeline;

/**
 * Latency percentiles in microseconds.
 *
 * @param count number of recorded samples, including those not retained for percentile estimation
 * @param p50Micros median of the retained samples
 * @param p99Micros 99th percentile of the retained samples
 * @param maxMicros exact maximum over all samples
 * @since FLAPLINE 0.1
 */
public record LatencySummary(long count, long p50Micros, long p99Micros, long maxMicros) {
  /** Summary with no samples. */
  public static final LatencySummary EMPTY = new LatencySummary(0, 0, 0, 0);
}
