package ca.gc.cra.flapline.domain.game;

/**
 * Immutable snapshot of the bird.
 *
 * @param x fixed horizontal position in world units
 * @param y vertical position in world units (0 is the floor)
 * @param yVelocity vertical velocity in world units per second
 * @param alive {@code false} once a collision has been detected
 * @param score number of pipes passed
 * @since FLAPLINE 0.1
 */
public record BirdState(double x, double y, double yVelocity, boolean alive, int score) {
  /** Starting position used for new sessions. */
  public static final BirdState INITIAL = new BirdState(20d, 10d, 0d, true, 0);
}
