package ca.gc.cra.flapline.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the named platform threads backing {@link WorkerPool}.
 */
public final class WorkerThreadFactories {
  static final String DEFAULT_PREFIX = "flapline-worker";

  private WorkerThreadFactories() {}

  /**
   * Builds a thread factory producing sequentially named worker threads.
   *
   * @param prefix thread-name prefix; blank falls back to {@code flapline-worker}
   * @param daemon whether threads are daemon threads
   * @param handler uncaught exception handler installed on each thread; {@code null} installs a no-op
   * @return thread factory naming threads {@code <prefix>-0}, {@code <prefix>-1}, ...
   */
  public static ThreadFactory newWorkerThreadFactory(
      String prefix, boolean daemon, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? DEFAULT_PREFIX : prefix.trim();
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
