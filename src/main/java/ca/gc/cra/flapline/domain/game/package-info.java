/**
 * Shared world state mutated by worker threads and the tick loop.
 * <p><strong>Role:</strong> External collaborator of the command hand-off core; the core never depends on these types.</p>
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.flapline.domain.game.GameState} owns its own lock; snapshots are immutable records.</p>
 * <p><strong>Performance:</strong> Single coarse lock; an integrator may swap in finer locking without touching the core.</p>
 */
package ca.gc.cra.flapline.domain.game;
