package ca.gc.cra.flapline.domain.game;

import ca.gc.cra.flapline.domain.command.ActionType;
import ca.gc.cra.flapline.domain.command.PlayerCommand;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <strong>What:</strong> Shared, lock-guarded world state mutated by worker threads and the tick loop.
 * <p><strong>Why:</strong> Workers apply player commands while the producer advances physics; both sides go
 * through the same lock so every observer sees a consistent bird/pipe aggregate.</p>
 * <p><strong>Thread-safety:</strong> All public methods acquire a single {@link ReentrantLock}; snapshots are
 * immutable copies.</p>
 * <p><strong>Performance:</strong> Coarse-grained locking serializes command application and physics steps;
 * critical sections are O(pipes) and pipes are bounded by the spawn interval and cull distance.</p>
 *
 * @since FLAPLINE 0.1
 */
public final class GameState {
  /** World width; new pipes spawn at this x coordinate. */
  public static final double WORLD_WIDTH = 80d;
  /** World height; the ceiling sits at this y coordinate. */
  public static final double WORLD_HEIGHT = 20d;
  /** Horizontal pipe velocity (world units per second). */
  public static final double PIPE_SPEED = -15d;
  /** Vertical acceleration applied to the bird. */
  public static final double GRAVITY = -40d;
  /** Velocity imparted by a flap. */
  public static final double FLAP_VELOCITY = 15d;
  /** Most negative vertical velocity. */
  public static final double MAX_FALL_SPEED = -50d;
  /** Collision radius of the bird. */
  public static final double BIRD_RADIUS = 1d;
  /** Width of a pipe pair. */
  public static final double PIPE_WIDTH = 4d;
  /** Height of each gap. */
  public static final double GAP_SIZE = 6d;
  /** Seconds between pipe spawns. */
  public static final double SPAWN_INTERVAL_SECONDS = 1.8d;
  /** Pipes whose left edge falls below this x are culled. */
  public static final double CULL_X = -10d;

  private static final double GAP_MIN_Y = 5d;
  private static final double GAP_MAX_Y = 15d;

  private final ReentrantLock lock = new ReentrantLock();
  private final Random rng;
  private final List<Pipe> pipes = new ArrayList<>();

  private double birdX = BirdState.INITIAL.x();
  private double birdY = BirdState.INITIAL.y();
  private double birdVelocity = BirdState.INITIAL.yVelocity();
  private boolean alive = true;
  private int score;
  private double spawnTimer;
  private long commandsApplied;

  /**
   * Creates a world seeded from {@code seed} so pipe placement is reproducible.
   *
   * @param seed random seed for gap placement
   */
  public GameState(long seed) {
    this(new Random(seed));
  }

  /**
   * Creates a world drawing gap placement from {@code rng}.
   *
   * @param rng random source; must not be {@code null}
   */
  public GameState(Random rng) {
    this.rng = Objects.requireNonNull(rng, "rng");
  }

  /**
   * Applies a command to the bird. Flaps are ignored once the bird is dead.
   *
   * @param command command removed from the channel; must not be {@code null}
   * @return {@code true} when the command changed the bird's velocity
   */
  public boolean processCommand(PlayerCommand command) {
    Objects.requireNonNull(command, "command");
    lock.lock();
    try {
      commandsApplied++;
      if (command.type() == ActionType.FLAP && alive) {
        birdVelocity = FLAP_VELOCITY;
        return true;
      }
      return false;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Advances the world by {@code dt} seconds: gravity, pipe scroll and scoring, spawn/cull, collision.
   *
   * @param dt step in seconds; must be positive and finite
   */
  public void updatePhysics(double dt) {
    if (!(dt > 0d) || Double.isInfinite(dt)) {
      throw new IllegalArgumentException("dt must be positive and finite (was " + dt + ")");
    }
    lock.lock();
    try {
      if (!alive) {
        return;
      }
      birdVelocity = Math.max(birdVelocity + GRAVITY * dt, MAX_FALL_SPEED);
      birdY += birdVelocity * dt;

      for (Pipe pipe : pipes) {
        pipe.x += PIPE_SPEED * dt;
        if (!pipe.passed && pipe.x < birdX) {
          score++;
          pipe.passed = true;
        }
      }

      spawnPipe(dt);
      Iterator<Pipe> it = pipes.iterator();
      while (it.hasNext()) {
        if (it.next().x < CULL_X) {
          it.remove();
        }
      }

      if (collides()) {
        alive = false;
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns an immutable snapshot of the bird.
   *
   * @return current bird state
   */
  public BirdState birdState() {
    lock.lock();
    try {
      return new BirdState(birdX, birdY, birdVelocity, alive, score);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns immutable snapshots of the live pipes, ordered by spawn time.
   *
   * @return pipe snapshots
   */
  public List<PipeState> pipeStates() {
    lock.lock();
    try {
      List<PipeState> copy = new ArrayList<>(pipes.size());
      for (Pipe pipe : pipes) {
        copy.add(pipe.snapshot());
      }
      return List.copyOf(copy);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of commands applied so far, including ignored ones.
   *
   * @return applied command count
   */
  public long commandsApplied() {
    lock.lock();
    try {
      return commandsApplied;
    } finally {
      lock.unlock();
    }
  }

  void placePipe(double x, double gapY, double gapSize) {
    lock.lock();
    try {
      pipes.add(new Pipe(x, gapY, gapSize));
    } finally {
      lock.unlock();
    }
  }

  private void spawnPipe(double dt) {
    spawnTimer += dt;
    if (spawnTimer >= SPAWN_INTERVAL_SECONDS) {
      double gapY = GAP_MIN_Y + rng.nextDouble() * (GAP_MAX_Y - GAP_MIN_Y);
      pipes.add(new Pipe(WORLD_WIDTH, gapY, GAP_SIZE));
      spawnTimer = 0d;
    }
  }

  private boolean collides() {
    if (birdY <= BIRD_RADIUS || birdY >= WORLD_HEIGHT - BIRD_RADIUS) {
      return true;
    }
    for (Pipe pipe : pipes) {
      boolean overlapsX = birdX + BIRD_RADIUS > pipe.x && birdX - BIRD_RADIUS < pipe.x + PIPE_WIDTH;
      if (!overlapsX) {
        continue;
      }
      double halfGap = pipe.gapSize / 2d;
      if (birdY + BIRD_RADIUS > pipe.gapY + halfGap || birdY - BIRD_RADIUS < pipe.gapY - halfGap) {
        return true;
      }
    }
    return false;
  }

  private static final class Pipe {
    private double x;
    private final double gapY;
    private final double gapSize;
    private boolean passed;

    private Pipe(double x, double gapY, double gapSize) {
      this.x = x;
      this.gapY = gapY;
      this.gapSize = gapSize;
    }

    private PipeState snapshot() {
      return new PipeState(x, gapY, gapSize, passed);
    }
  }
}
