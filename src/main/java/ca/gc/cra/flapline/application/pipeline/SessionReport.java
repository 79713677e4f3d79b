package ca.gc.cra.flapline.application.pipeline;

import ca.gc.cra.flapline.infrastructure.exec.TeardownOutcome;
import java.time.Duration;

/**
 * Outcome of one {@link GameSessionUseCase#run()}.
 *
 * @param sessionId identifier placed in the {@code session} MDC key
 * @param ticks physics ticks executed
 * @param commandsSubmitted commands handed to the channel
 * @param commandsApplied commands applied by workers before join returned
 * @param commandsDropped commands rejected by a bounded channel
 * @param finalScore score of the bird when the loop ended
 * @param alive whether the bird was alive when the loop ended
 * @param endReason why the tick loop stopped
 * @param latency hand-off latency summary
 * @param teardown how the worker pool was released
 * @param elapsed wall time of the run
 * @since FLAPLINE 0.1
 */
public record SessionReport(
    String sessionId,
    long ticks,
    long commandsSubmitted,
    long commandsApplied,
    long commandsDropped,
    int finalScore,
    boolean alive,
    EndReason endReason,
    LatencySummary latency,
    TeardownOutcome teardown,
    Duration elapsed) {

  /**
   * Indicates whether every accepted command was applied and the pool joined cleanly.
   *
   * @return {@code true} when nothing was lost between producer and workers
   */
  public boolean fullyDrained() {
    return teardown == TeardownOutcome.JOINED_CLEANLY
        && commandsApplied == commandsSubmitted - commandsDropped;
  }

  /** Reason the tick loop ended. */
  public enum EndReason {
    /** The bird collided with a pipe, the floor, or the ceiling. */
    BIRD_DIED,
    /** The input source reported it has no further events. */
    INPUT_EXHAUSTED,
    /** The configured tick limit was reached. */
    MAX_TICKS,
    /** The producer thread was interrupted. */
    INTERRUPTED
  }
}
