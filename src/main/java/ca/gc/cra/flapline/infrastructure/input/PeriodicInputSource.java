package ca.gc.cra.flapline.infrastructure.input;

import ca.gc.cra.flapline.application.port.InputSource;
import ca.gc.cra.flapline.domain.command.ActionType;
import ca.gc.cra.flapline.domain.game.GameState;
import java.util.List;

/**
 * Emits one flap every {@code interval} ticks; used for steady load generation.
 *
 * @since FLAPLINE 0.1
 */
public final class PeriodicInputSource implements InputSource {
  private static final List<ActionType> FLAP = List.of(ActionType.FLAP);

  private final long interval;
  private final long maxFlaps;
  private long emitted;

  /**
   * Creates a periodic source.
   *
   * @param interval ticks between flaps; the first flap fires on tick {@code interval}
   * @param maxFlaps flaps after which the source is exhausted; {@code 0} never exhausts
   * @throws IllegalArgumentException if {@code interval} is not positive or {@code maxFlaps} is negative
   */
  public PeriodicInputSource(long interval, long maxFlaps) {
    if (interval <= 0) {
      throw new IllegalArgumentException("interval must be > 0 (was " + interval + ")");
    }
    if (maxFlaps < 0) {
      throw new IllegalArgumentException("maxFlaps must be >= 0 (was " + maxFlaps + ")");
    }
    this.interval = interval;
    this.maxFlaps = maxFlaps;
  }

  @Override
  public List<ActionType> poll(long tick, GameState world) {
    if (isExhausted() || tick == 0 || tick % interval != 0) {
      return List.of();
    }
    emitted++;
    return FLAP;
  }

  @Override
  public boolean isExhausted() {
    return maxFlaps > 0 && emitted >= maxFlaps;
  }

  @Override
  public String name() {
    return "periodic";
  }
}
