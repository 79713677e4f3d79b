package ca.gc.cra.flapline.domain.game;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.flapline.domain.command.ActionType;
import ca.gc.cra.flapline.domain.command.PlayerCommand;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import org.junit.jupiter.api.Test;

class GameStateTest {
  private static final double DT = 1d / 60d;

  @Test
  void startsWithLiveBirdAndNoPipes() {
    GameState game = new GameState(42L);

    assertEquals(BirdState.INITIAL, game.birdState());
    assertTrue(game.pipeStates().isEmpty());
    assertEquals(0L, game.commandsApplied());
  }

  @Test
  void flapSetsUpwardVelocity() {
    GameState game = new GameState(42L);

    assertTrue(game.processCommand(PlayerCommand.flap(0, 0L)));
    assertEquals(GameState.FLAP_VELOCITY, game.birdState().yVelocity());
    assertFalse(game.processCommand(new PlayerCommand(0, ActionType.NONE, 0L)));
    assertEquals(2L, game.commandsApplied());
  }

  @Test
  void gravityPullsBirdDownAndFallSpeedIsClamped() {
    GameState game = new GameState(42L);
    game.updatePhysics(0.1d);

    BirdState bird = game.birdState();
    assertEquals(-4d, bird.yVelocity(), 1e-9);
    assertEquals(9.6d, bird.y(), 1e-9);

    GameState fast = new GameState(42L);
    fast.updatePhysics(2d);
    assertEquals(GameState.MAX_FALL_SPEED, fast.birdState().yVelocity(), 1e-9);
  }

  @Test
  void unflappedBirdHitsTheFloor() {
    GameState game = new GameState(42L);
    int ticks = 0;
    while (game.birdState().alive() && ticks < 600) {
      game.updatePhysics(DT);
      ticks++;
    }

    assertFalse(game.birdState().alive());
    assertTrue(ticks < 45, "free fall from y=10 should end within ~41 ticks, took " + ticks);
    assertEquals(0, game.birdState().score());
  }

  @Test
  void deadBirdIgnoresFlapsAndPhysics() {
    GameState game = new GameState(42L);
    game.updatePhysics(2d);
    BirdState dead = game.birdState();
    assertFalse(dead.alive());

    assertFalse(game.processCommand(PlayerCommand.flap(0, 0L)));
    game.updatePhysics(DT);
    assertEquals(dead, game.birdState());
  }

  @Test
  void firstPipeSpawnsAtRightEdgeAfterInterval() {
    GameState game = new GameState(7L);
    int ticks = 0;
    while (game.pipeStates().isEmpty() && ticks < 200) {
      hover(game);
      game.updatePhysics(DT);
      ticks++;
    }

    assertTrue(ticks >= 108 && ticks <= 109, "spawned after " + ticks + " ticks");
    List<PipeState> pipes = game.pipeStates();
    assertEquals(1, pipes.size());
    PipeState pipe = pipes.get(0);
    assertEquals(GameState.WORLD_WIDTH, pipe.x(), 1e-9);
    assertTrue(pipe.gapY() >= 5d && pipe.gapY() < 15d);
    assertEquals(GameState.GAP_SIZE, pipe.gapSize());
    assertEquals(pipe.gapY() + GameState.GAP_SIZE / 2d, pipe.gapTop(), 1e-9);
  }

  @Test
  void sameSeedProducesSameGaps() {
    List<Double> first = gapsFor(99L);

    assertEquals(2, first.size());
    assertEquals(first, gapsFor(99L));
  }

  @Test
  void passingAPipeScoresOnce() {
    GameState game = new GameState(42L);
    game.placePipe(21d, 10d, 30d);

    game.updatePhysics(0.1d);
    game.processCommand(PlayerCommand.flap(0, 0L));
    game.updatePhysics(0.1d);

    BirdState bird = game.birdState();
    assertTrue(bird.alive());
    assertEquals(1, bird.score());
    assertTrue(game.pipeStates().get(0).passed());
  }

  @Test
  void hittingAPipeOutsideTheGapKillsTheBird() {
    GameState game = new GameState(42L);
    game.placePipe(19d, 18d, 2d);

    game.updatePhysics(0.1d);

    assertFalse(game.birdState().alive());
  }

  @Test
  void pipesAreCulledOffScreen() {
    GameState game = new GameState(42L);
    game.placePipe(-9.5d, 10d, 30d);

    game.updatePhysics(0.05d);

    assertTrue(game.pipeStates().isEmpty());
  }

  @Test
  void rejectsNonPositiveOrNonFiniteStep() {
    GameState game = new GameState(42L);
    assertThrows(IllegalArgumentException.class, () -> game.updatePhysics(0d));
    assertThrows(IllegalArgumentException.class, () -> game.updatePhysics(-1d));
    assertThrows(IllegalArgumentException.class, () -> game.updatePhysics(Double.NaN));
    assertThrows(IllegalArgumentException.class, () -> game.updatePhysics(Double.POSITIVE_INFINITY));
  }

  @Test
  void concurrentCommandsAreAllCounted() throws Exception {
    GameState game = new GameState(42L);
    int threads = 4;
    int perThread = 2_500;
    CountDownLatch go = new CountDownLatch(1);
    List<Thread> workers = new ArrayList<>();
    for (int t = 0; t < threads; t++) {
      Thread worker = new Thread(() -> {
        try {
          go.await();
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          return;
        }
        for (int i = 0; i < perThread; i++) {
          game.processCommand(PlayerCommand.flap(0, 0L));
        }
      });
      worker.start();
      workers.add(worker);
    }
    go.countDown();
    for (int i = 0; i < 100; i++) {
      game.updatePhysics(0.001d);
    }
    for (Thread worker : workers) {
      worker.join(5_000);
    }

    assertEquals((long) threads * perThread, game.commandsApplied());
  }

  private static List<Double> gapsFor(long seed) {
    GameState game = new GameState(seed);
    List<Double> gaps = new ArrayList<>();
    int seen = 0;
    for (int i = 0; i < 300; i++) {
      hover(game);
      game.updatePhysics(DT);
      List<PipeState> pipes = game.pipeStates();
      for (int p = seen; p < pipes.size(); p++) {
        gaps.add(pipes.get(p).gapY());
      }
      seen = pipes.size();
    }
    assertTrue(game.birdState().alive());
    return gaps;
  }

  private static void hover(GameState game) {
    BirdState bird = game.birdState();
    if (bird.y() < 10d && bird.yVelocity() <= 0d) {
      game.processCommand(PlayerCommand.flap(0, 0L));
    }
  }
}
