package ca.gc.cra.flapline.application.port;

import ca.gc.cra.flapline.domain.command.ActionType;
import ca.gc.cra.flapline.domain.game.GameState;
import java.util.List;

/**
 * <strong>What:</strong> Port supplying the player input events observed during one tick of the game loop.
 * <p><strong>Why:</strong> Decouples the producer loop from the origin of its events (scripts, an autopilot,
 * load generators) so the session only decides when to hand commands off.</p>
 * <p><strong>Role:</strong> Implemented by adapters under {@code infrastructure.input}.</p>
 * <p><strong>Thread-safety:</strong> Polled from the single producer thread only.</p>
 * <p><strong>Performance:</strong> Called once per tick on the latency-sensitive path; must not block.</p>
 *
 * @since FLAPLINE 0.1
 */
public interface InputSource {
  /**
   * Returns the events observed during {@code tick}.
   *
   * @param tick zero-based tick number, strictly increasing between calls
   * @param world read-only view of the shared state; implementations may only call snapshot methods
   * @return events for the tick in arrival order; empty when nothing happened
   */
  List<ActionType> poll(long tick, GameState world);

  /**
   * Indicates whether the source will never produce another event.
   *
   * @return {@code true} once the session can end
   */
  default boolean isExhausted() {
    return false;
  }

  /**
   * Short identifier used in logs and reports.
   *
   * @return source name
   */
  String name();
}
