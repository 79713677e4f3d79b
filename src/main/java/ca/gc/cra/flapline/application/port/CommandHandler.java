package ca.gc.cra.flapline.application.port;

/**
 * <strong>What:</strong> Consumption loop executed once per worker thread.
 * <p><strong>Why:</strong> Keeps the worker pool independent of whatever shared state the commands are
 * applied to; the pool only knows it must run this loop to completion on each of its threads.</p>
 * <p><strong>Contract:</strong> Implementations call {@link CommandChannel#take()} until it returns empty,
 * applying each value through the target state's own synchronization. Each unit of work must be
 * finite; a loop that ignores the termination signal or blocks on unrelated work stalls
 * {@code WorkerPool.join()}.</p>
 * <p><strong>Thread-safety:</strong> A single instance is invoked concurrently by every worker thread.</p>
 *
 * @param <T> command value type
 * @since FLAPLINE 0.1
 */
@FunctionalInterface
public interface CommandHandler<T> {

  /**
   * Consumes {@code channel} until it reports stopped and drained.
   *
   * @param channel shared channel; never {@code null}
   * @throws Exception if applying a value fails; the pool logs the failure and retires the thread
   */
  void consume(CommandChannel<T> channel) throws Exception;
}
