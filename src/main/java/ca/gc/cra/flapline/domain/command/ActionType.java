package ca.gc.cra.flapline.domain.command;

/**
 * Discriminator identifying the action carried by a {@link PlayerCommand}.
 *
 * @since FLAPLINE 0.1
 */
public enum ActionType {
  /** Impart the flap velocity to a live bird. */
  FLAP,
  /** No action; applied commands still contribute latency samples. */
  NONE
}
