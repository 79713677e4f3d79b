package ca.gc.cra.flapline.application.port;

import java.util.Optional;

/**
 * <strong>What:</strong> Order-preserving hand-off between one or more producers and a pool of consumers.
 * <p><strong>Why:</strong> Lets the latency-sensitive producer publish commands without waiting on worker
 * progress while giving consumers a blocking take with a single, unambiguous termination signal.</p>
 * <p><strong>Role:</strong> Port consumed by {@link CommandHandler} implementations and the worker pool;
 * implemented by {@code BlockingCommandChannel}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Accept values in FIFO order until {@link #stop()} is called.</li>
 *   <li>Hand each accepted value to exactly one taker.</li>
 *   <li>Release every blocked taker once stopped and drained.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All operations are safe for concurrent use by any number of threads.</p>
 * <p><strong>Lifecycle:</strong> Callers must stop the channel and join every consumer before releasing it.</p>
 *
 * @param <T> command value type
 * @since FLAPLINE 0.1
 */
public interface CommandChannel<T> {

  /**
   * Appends {@code value} and wakes one blocked taker. After {@link #stop()} the value is discarded
   * silently; producers racing the shutdown signal never see an error.
   *
   * @param value command to hand off; must not be {@code null}
   * @throws NullPointerException if {@code value} is {@code null}
   */
  void submit(T value);

  /**
   * Removes the head value, blocking until one is available or the channel is stopped and empty.
   *
   * @return the head value, or {@link Optional#empty()} once the channel is stopped and drained
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  Optional<T> take() throws InterruptedException;

  /**
   * Stops accepting values and wakes every blocked taker. Idempotent.
   */
  void stop();

  /**
   * Indicates whether {@link #stop()} has been called.
   *
   * @return {@code true} once stopped
   */
  boolean isStopped();

  /**
   * Returns the number of values currently pending.
   *
   * @return pending value count
   */
  int size();
}
