package ca.gc.cra.flapline.infrastructure.input;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.flapline.domain.game.GameState;
import org.junit.jupiter.api.Test;

class PeriodicInputSourceTest {
  private final GameState world = new GameState(1L);

  @Test
  void flapsEveryIntervalStartingAfterTickZero() {
    PeriodicInputSource source = new PeriodicInputSource(3, 0);
    int flaps = 0;
    for (long tick = 0; tick < 10; tick++) {
      flaps += source.poll(tick, world).size();
    }

    assertEquals(3, flaps);
    assertFalse(source.isExhausted());
  }

  @Test
  void exhaustsAfterFlapLimit() {
    PeriodicInputSource source = new PeriodicInputSource(1, 2);

    assertEquals(1, source.poll(1, world).size());
    assertEquals(1, source.poll(2, world).size());
    assertTrue(source.isExhausted());
    assertTrue(source.poll(3, world).isEmpty());
  }

  @Test
  void rejectsInvalidInterval() {
    assertThrows(IllegalArgumentException.class, () -> new PeriodicInputSource(0, 0));
    assertThrows(IllegalArgumentException.class, () -> new PeriodicInputSource(1, -1));
  }
}
