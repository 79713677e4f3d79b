package ca.gc.cra.flapline.domain.game;

/**
 * Immutable snapshot of a pipe pair.
 *
 * @param x left edge in world units
 * @param gapY centre of the gap
 * @param gapSize height of the gap
 * @param passed whether the bird has already scored this pipe
 * @since FLAPLINE 0.1
 */
public record PipeState(double x, double gapY, double gapSize, boolean passed) {

  /**
   * Returns the upper edge of the gap.
   *
   * @return gap top in world units
   */
  public double gapTop() {
    return gapY + gapSize / 2d;
  }

  /**
   * Returns the lower edge of the gap.
   *
   * @return gap bottom in world units
   */
  public double gapBottom() {
    return gapY - gapSize / 2d;
  }
}
