package ca.gc.cra.flapline.infrastructure.input;

import ca.gc.cra.flapline.application.port.InputSource;
import ca.gc.cra.flapline.domain.command.ActionType;
import ca.gc.cra.flapline.domain.game.BirdState;
import ca.gc.cra.flapline.domain.game.GameState;
import ca.gc.cra.flapline.domain.game.PipeState;
import java.util.List;

/**
 * Self-playing input: flaps when the falling bird drops below the centre of the next gap.
 *
 * <p>A flap lifts the bird by roughly {@code FLAP_VELOCITY^2 / (2 * |GRAVITY|)} (2.8 units), so flapping one
 * unit below the target keeps the bird within the two units of clearance a gap leaves around its radius.</p>
 *
 * @since FLAPLINE 0.1
 */
public final class AutopilotInputSource implements InputSource {
  private static final List<ActionType> FLAP = List.of(ActionType.FLAP);
  private static final double FLAP_MARGIN = 1d;
  private static final double OPEN_SKY_TARGET = GameState.WORLD_HEIGHT / 2d;

  @Override
  public List<ActionType> poll(long tick, GameState world) {
    BirdState bird = world.birdState();
    if (!bird.alive() || bird.yVelocity() > 0d) {
      return List.of();
    }
    double target = targetHeight(bird, world.pipeStates());
    return bird.y() < target - FLAP_MARGIN ? FLAP : List.of();
  }

  @Override
  public String name() {
    return "autopilot";
  }

  static double targetHeight(BirdState bird, List<PipeState> pipes) {
    for (PipeState pipe : pipes) {
      if (pipe.x() + GameState.PIPE_WIDTH + GameState.BIRD_RADIUS >= bird.x()) {
        return pipe.gapY();
      }
    }
    return OPEN_SKY_TARGET;
  }
}
