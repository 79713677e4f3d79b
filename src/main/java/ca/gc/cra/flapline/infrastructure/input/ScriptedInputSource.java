package ca.gc.cra.flapline.infrastructure.input;

import ca.gc.cra.flapline.application.port.InputSource;
import ca.gc.cra.flapline.domain.command.ActionType;
import ca.gc.cra.flapline.domain.game.GameState;
import ca.gc.cra.flapline.validation.Numbers;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Replays flaps at fixed tick numbers, then reports exhaustion after a configurable tail.
 *
 * <p>A tick listed twice produces two flaps on that tick. Not thread-safe; polled by the producer only.</p>
 *
 * @since FLAPLINE 0.1
 */
public final class ScriptedInputSource implements InputSource {
  /** Highest tick a script may name; matches the session tick ceiling. */
  public static final long MAX_TICK = 10_000_000L;

  private final NavigableMap<Long, Integer> flapsByTick;
  private final long lastTick;
  private long polledThrough = -1L;

  /**
   * Creates a scripted source.
   *
   * @param flapsByTick number of flaps keyed by tick; keys must lie in {@code [0, MAX_TICK]}
   * @param tailTicks ticks to keep running after the last scripted flap
   * @throws IllegalArgumentException if a tick is out of range, a count or {@code tailTicks} is negative
   */
  public ScriptedInputSource(Map<Long, Integer> flapsByTick, long tailTicks) {
    if (tailTicks < 0) {
      throw new IllegalArgumentException("tailTicks must be >= 0 (was " + tailTicks + ")");
    }
    TreeMap<Long, Integer> copy = new TreeMap<>();
    for (Map.Entry<Long, Integer> entry : flapsByTick.entrySet()) {
      Numbers.requireRange("script", entry.getKey(), 0L, MAX_TICK);
      if (entry.getValue() < 0) {
        throw new IllegalArgumentException("script flap counts must be non-negative: " + entry);
      }
      if (entry.getValue() > 0) {
        copy.put(entry.getKey(), entry.getValue());
      }
    }
    this.flapsByTick = Collections.unmodifiableNavigableMap(copy);
    long last = copy.isEmpty() ? -1L : copy.lastKey();
    this.lastTick = tailTicks > Long.MAX_VALUE - last ? Long.MAX_VALUE : last + tailTicks;
  }

  /**
   * Parses a comma-separated list of tick numbers such as {@code "5,20,20,41"}.
   *
   * @param script tick list; blank yields an empty script
   * @param tailTicks ticks to keep running after the last scripted flap
   * @return scripted source
   * @throws IllegalArgumentException if a token is not an integer in {@code [0, MAX_TICK]}
   */
  public static ScriptedInputSource parse(String script, long tailTicks) {
    TreeMap<Long, Integer> ticks = new TreeMap<>();
    for (long tick : parseTicks(script)) {
      ticks.merge(tick, 1, Integer::sum);
    }
    return new ScriptedInputSource(ticks, tailTicks);
  }

  /**
   * Validates a comma-separated tick list without building a source.
   *
   * @param script tick list; blank yields an empty list
   * @return ticks in script order, duplicates kept
   * @throws IllegalArgumentException if a token is not an integer in {@code [0, MAX_TICK]}
   */
  public static List<Long> parseTicks(String script) {
    return Numbers.parseLongList("script", script, 0L, MAX_TICK);
  }

  @Override
  public List<ActionType> poll(long tick, GameState world) {
    polledThrough = Math.max(polledThrough, tick);
    Integer count = flapsByTick.get(tick);
    if (count == null) {
      return List.of();
    }
    List<ActionType> events = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      events.add(ActionType.FLAP);
    }
    return events;
  }

  @Override
  public boolean isExhausted() {
    return polledThrough >= lastTick;
  }

  @Override
  public String name() {
    return "script";
  }

  /**
   * Returns the total number of scripted flaps.
   *
   * @return flap count
   */
  public int totalFlaps() {
    int total = 0;
    for (int count : flapsByTick.values()) {
      total += count;
    }
    return total;
  }
}
