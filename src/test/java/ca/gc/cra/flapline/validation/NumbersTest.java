package ca.gc.cra.flapline.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeAcceptsInclusiveBounds() {
    assertEquals(1L, Numbers.requireRange("workers", 1L, 1L, 64L));
    assertEquals(64, Numbers.requireRange("workers", 64, 1, 64));
  }

  @Test
  void requireRangeNamesTheSetting() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("tickHz", 0, 1, 1_000));
    assertEquals("tickHz must be between 1 and 1000 (was 0)", ex.getMessage());
  }

  @Test
  void blankNameFallsBackToValue() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange(" ", 5L, 0L, 1L));
    assertTrue(ex.getMessage().startsWith("value must be between"));
  }

  @Test
  void parseLongIgnoresUnderscoresAndWhitespace() {
    assertEquals(1_000_000L, Numbers.parseLong("commands", " 1_000_000 "));
    assertEquals(-3L, Numbers.parseLong("seed", "-3"));
  }

  @Test
  void parseLongRejectsGarbage() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.parseLong("maxTicks", "ten"));
    assertEquals("maxTicks must be an integer (was 'ten')", ex.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseLong("maxTicks", "  "));
  }

  @Test
  void parseLongListKeepsOrderAndDuplicates() {
    assertEquals(List.of(5L, 20L, 20L, 1L), Numbers.parseLongList("script", "5, 20,20,, 1", 0L, 100L));
    assertEquals(List.of(), Numbers.parseLongList("script", "  ", 0L, 100L));
    assertEquals(List.of(), Numbers.parseLongList("script", ",", 0L, 100L));
  }

  @Test
  void parseLongListChecksEveryElement() {
    IllegalArgumentException garbage = assertThrows(
        IllegalArgumentException.class, () -> Numbers.parseLongList("script", "5,abc,-3", 0L, 100L));
    assertEquals("script must be an integer (was 'abc')", garbage.getMessage());

    IllegalArgumentException range = assertThrows(
        IllegalArgumentException.class, () -> Numbers.parseLongList("script", "5,-3", 0L, 100L));
    assertEquals("script must be between 0 and 100 (was -3)", range.getMessage());
  }
}
