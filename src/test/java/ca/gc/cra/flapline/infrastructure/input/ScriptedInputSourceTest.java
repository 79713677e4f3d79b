package ca.gc.cra.flapline.infrastructure.input;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.flapline.domain.command.ActionType;
import ca.gc.cra.flapline.domain.game.GameState;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ScriptedInputSourceTest {
  private final GameState world = new GameState(1L);

  @Test
  void flapsOnScriptedTicksOnly() {
    ScriptedInputSource source = ScriptedInputSource.parse("2, 5,5", 0);

    assertEquals(List.of(), source.poll(0, world));
    assertEquals(List.of(ActionType.FLAP), source.poll(2, world));
    assertEquals(List.of(ActionType.FLAP, ActionType.FLAP), source.poll(5, world));
    assertEquals(3, source.totalFlaps());
    assertEquals("script", source.name());
  }

  @Test
  void exhaustsAfterLastTickPlusTail() {
    ScriptedInputSource source = ScriptedInputSource.parse("3", 2);

    for (long tick = 0; tick <= 5; tick++) {
      assertFalse(source.isExhausted(), "tick " + tick);
      source.poll(tick, world);
    }
    assertTrue(source.isExhausted());
  }

  @Test
  void emptyScriptRunsForTheTailOnly() {
    ScriptedInputSource source = ScriptedInputSource.parse("  ", 1);

    assertFalse(source.isExhausted());
    source.poll(0, world);
    assertTrue(source.isExhausted());
    assertEquals(0, source.totalFlaps());
  }

  @Test
  void rejectsMalformedTicks() {
    assertThrows(IllegalArgumentException.class, () -> ScriptedInputSource.parse("1,x", 0));
    assertThrows(IllegalArgumentException.class, () -> ScriptedInputSource.parse("-4", 0));
    assertThrows(IllegalArgumentException.class, () -> new ScriptedInputSource(Map.of(1L, 1), -1));
  }

  @Test
  void rejectsTicksBeyondTheSessionCeiling() {
    IllegalArgumentException parsed = assertThrows(
        IllegalArgumentException.class, () -> ScriptedInputSource.parse("5,10000001", 0));
    assertEquals("script must be between 0 and 10000000 (was 10000001)", parsed.getMessage());
    assertThrows(IllegalArgumentException.class,
        () -> new ScriptedInputSource(Map.of(Long.MAX_VALUE, 1), 0));
    assertThrows(IllegalArgumentException.class, () -> new ScriptedInputSource(Map.of(3L, -1), 0));
  }

  @Test
  void hugeTailSaturatesInsteadOfWrapping() {
    ScriptedInputSource source = new ScriptedInputSource(Map.of(ScriptedInputSource.MAX_TICK, 1), Long.MAX_VALUE);

    source.poll(0, world);
    source.poll(ScriptedInputSource.MAX_TICK, world);

    assertFalse(source.isExhausted());
  }

  @Test
  void parseTicksKeepsScriptOrder() {
    assertEquals(List.of(9L, 2L, 2L), ScriptedInputSource.parseTicks("9, 2,,2"));
    assertEquals(List.of(), ScriptedInputSource.parseTicks(null));
  }
}
