package ca.gc.cra.flapline.domain.command;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class PlayerCommandTest {

  @Test
  void flapFactoryStampsTimestamp() {
    PlayerCommand command = PlayerCommand.flap(3, 1_000L);

    assertEquals(3, command.playerId());
    assertEquals(ActionType.FLAP, command.type());
    assertEquals(1_000L, command.timestampNanos());
  }

  @Test
  void missingTypeDefaultsToNone() {
    assertEquals(ActionType.NONE, new PlayerCommand(0, null, 0L).type());
  }

  @Test
  void negativePlayerIdIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> PlayerCommand.flap(-1, 0L));
  }

  @Test
  void ageNeverGoesNegative() {
    PlayerCommand command = PlayerCommand.flap(0, 5_000L);

    assertEquals(2_000L, command.ageNanos(7_000L));
    assertEquals(0L, command.ageNanos(4_000L));
  }
}
