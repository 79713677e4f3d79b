package ca.gc.cra.flapline.domain.command;

import java.util.Objects;

/**
 * Immutable unit of work handed from the input loop to the worker pool.
 *
 * <p>Ownership transfers to whichever worker removes the command from the channel; exactly one
 * worker ever observes a given instance.</p>
 *
 * @param playerId identifier of the issuing player (non-negative)
 * @param type action discriminator; defaults to {@link ActionType#NONE}
 * @param timestampNanos monotonic creation time used for hand-off latency measurement
 * @since FLAPLINE 0.1
 */
public record PlayerCommand(int playerId, ActionType type, long timestampNanos) {

  /**
   * Normalizes the action type and validates the player id.
   *
   * @throws IllegalArgumentException if {@code playerId} is negative
   */
  public PlayerCommand {
    if (playerId < 0) {
      throw new IllegalArgumentException("playerId must be >= 0 (was " + playerId + ")");
    }
    type = Objects.requireNonNullElse(type, ActionType.NONE);
  }

  /**
   * Creates a flap command for {@code playerId} stamped with {@code timestampNanos}.
   *
   * @param playerId issuing player
   * @param timestampNanos monotonic creation time
   * @return flap command
   */
  public static PlayerCommand flap(int playerId, long timestampNanos) {
    return new PlayerCommand(playerId, ActionType.FLAP, timestampNanos);
  }

  /**
   * Computes the age of this command relative to {@code nowNanos}.
   *
   * @param nowNanos monotonic timestamp taken from the same clock as {@link #timestampNanos()}
   * @return elapsed nanoseconds, never negative
   */
  public long ageNanos(long nowNanos) {
    return Math.max(0L, nowNanos - timestampNanos);
  }
}
