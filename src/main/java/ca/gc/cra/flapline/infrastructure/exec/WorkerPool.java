package ca.gc.cra.flapline.infrastructure.exec;

import ca.gc.cra.flapline.application.port.CommandChannel;
import ca.gc.cra.flapline.application.port.CommandHandler;
import ca.gc.cra.flapline.application.port.MetricsPort;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Fixed set of worker threads, each running one {@link CommandHandler} invocation against a shared
 * {@link CommandChannel}.
 *
 * <p>Construction records configuration only; {@link #start()} launches exactly {@code threadCount}
 * threads. The owner must follow the shutdown order {@code channel.stop()} → {@link #join()} → release the
 * channel and anything the handler touches. Once {@link #join()} reports
 * {@link TeardownOutcome#JOINED_CLEANLY} no pool thread is alive.</p>
 *
 * <p>{@link #close()} without a prior join is a programming error in the owner. The pool never joins from
 * that path because the state the handlers touch may already be gone; it logs the misuse and detaches
 * the remaining threads, which then run to completion untracked.</p>
 *
 * <p>Worker failures are logged and counted; they retire the failing thread without affecting the others.</p>
 *
 * @param <T> command value type
 * @since FLAPLINE 0.1
 */
public final class WorkerPool<T> implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

  private static final int MAX_THREADS = 1_024;

  private final int threadCount;
  private final CommandChannel<T> channel;
  private final CommandHandler<T> handler;
  private final Settings settings;
  private final MetricsPort metrics;
  private final ThreadFactory threadFactory;
  private final AtomicInteger liveWorkers = new AtomicInteger();
  private final AtomicInteger failedWorkers = new AtomicInteger();

  private final Object lifecycle = new Object();
  private final List<Thread> threads = new ArrayList<>();
  private State state = State.NEW;
  private TeardownOutcome outcome;
  private int launchedWorkers;

  /**
   * Creates a pool with default thread naming and no metrics.
   *
   * @param threadCount number of workers, between 1 and 1024
   * @param channel channel shared by every worker
   * @param handler consumption loop executed once per worker
   */
  public WorkerPool(int threadCount, CommandChannel<T> channel, CommandHandler<T> handler) {
    this(threadCount, channel, handler, Settings.defaults(), MetricsPort.NO_OP);
  }

  /**
   * Creates a pool without starting any thread.
   *
   * @param threadCount number of workers, between 1 and 1024
   * @param channel channel shared by every worker
   * @param handler consumption loop executed once per worker
   * @param settings thread naming and daemon settings
   * @param metrics sink for {@code pool.*} counters
   * @throws IllegalArgumentException if {@code threadCount} is out of range
   */
  public WorkerPool(
      int threadCount,
      CommandChannel<T> channel,
      CommandHandler<T> handler,
      Settings settings,
      MetricsPort metrics) {
    this(threadCount, channel, handler, settings, metrics, null);
  }

  WorkerPool(
      int threadCount,
      CommandChannel<T> channel,
      CommandHandler<T> handler,
      Settings settings,
      MetricsPort metrics,
      ThreadFactory threadFactory) {
    if (threadCount <= 0 || threadCount > MAX_THREADS) {
      throw new IllegalArgumentException(
          "threadCount must be between 1 and " + MAX_THREADS + " (was " + threadCount + ")");
    }
    this.threadCount = threadCount;
    this.channel = Objects.requireNonNull(channel, "channel");
    this.handler = Objects.requireNonNull(handler, "handler");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.threadFactory = threadFactory != null
        ? threadFactory
        : WorkerThreadFactories.newWorkerThreadFactory(
            settings.threadPrefix(), settings.daemon(), this::handleWorkerCrash);
  }

  /**
   * Launches every worker thread.
   *
   * <p>If the platform refuses a thread, the failure is rethrown after the pool records how many workers did
   * launch; only those are tracked for {@link #join()}, and the pool stays started.</p>
   *
   * @throws IllegalStateException if the pool was already started, joined, or torn down
   */
  public void start() {
    synchronized (lifecycle) {
      if (state != State.NEW) {
        throw new IllegalStateException("Worker pool " + settings.threadPrefix() + " already " + state.label);
      }
      Map<String, String> context = MDC.getCopyOfContextMap();
      for (int i = 0; i < threadCount; i++) {
        threads.add(threadFactory.newThread(new Worker(context)));
      }
      state = State.RUNNING;
      for (int i = 0; i < threads.size(); i++) {
        liveWorkers.incrementAndGet();
        try {
          threads.get(i).start();
        } catch (RuntimeException | Error ex) {
          liveWorkers.decrementAndGet();
          threads.subList(i, threads.size()).clear();
          log.error("Worker pool {} launched only {} of {} workers", settings.threadPrefix(), i, threadCount, ex);
          metrics.increment("pool.start.failed");
          throw ex;
        }
        launchedWorkers = i + 1;
      }
    }
    log.debug("Started {} workers with prefix {}", threadCount, settings.threadPrefix());
  }

  /**
   * Waits for every launched worker to return from its handler.
   *
   * <p>Subsequent calls return the first call's outcome without blocking; a call racing an in-flight join
   * returns {@link TeardownOutcome#JOIN_IN_PROGRESS}. If the calling thread is interrupted while waiting,
   * the interrupt is logged, the threads not yet joined are detached, the interrupt status is restored,
   * and {@link TeardownOutcome#DETACHED_AFTER_JOIN_FAILURE} is returned.</p>
   *
   * @return how the workers were released
   */
  public TeardownOutcome join() {
    List<Thread> toJoin;
    synchronized (lifecycle) {
      switch (state) {
        case NEW -> {
          return finish(TeardownOutcome.NOT_STARTED);
        }
        case JOINING -> {
          return TeardownOutcome.JOIN_IN_PROGRESS;
        }
        case CLOSED -> {
          return outcome;
        }
        default -> {
          state = State.JOINING;
          toJoin = List.copyOf(threads);
        }
      }
    }

    TeardownOutcome result = TeardownOutcome.JOINED_CLEANLY;
    for (int i = 0; i < toJoin.size(); i++) {
      Thread worker = toJoin.get(i);
      try {
        worker.join();
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        int remaining = countAlive(toJoin.subList(i, toJoin.size()));
        log.warn("Interrupted while joining worker {}; detaching {} remaining workers", worker.getName(), remaining, ex);
        metrics.add("pool.teardown.detached", remaining);
        result = TeardownOutcome.DETACHED_AFTER_JOIN_FAILURE;
        break;
      }
    }

    synchronized (lifecycle) {
      return finish(result);
    }
  }

  /**
   * Releases the pool without waiting for its threads.
   *
   * <p>After a join this is a no-op reporting the join outcome. Without one, live workers are detached and an
   * error is logged; the method never blocks and never throws.</p>
   *
   * @return {@link TeardownOutcome#DETACHED_ON_MISUSE} when workers were detached, otherwise the recorded outcome
   */
  public TeardownOutcome teardown() {
    synchronized (lifecycle) {
      switch (state) {
        case NEW -> {
          return finish(TeardownOutcome.NOT_STARTED);
        }
        case JOINING -> {
          return TeardownOutcome.JOIN_IN_PROGRESS;
        }
        case CLOSED -> {
          return outcome;
        }
        default -> {
          int live = countAlive(threads);
          log.error(
              "Worker pool {} torn down without join(); detaching {} live of {} workers",
              settings.threadPrefix(),
              live,
              threadCount);
          metrics.add("pool.teardown.detached", live);
          return finish(TeardownOutcome.DETACHED_ON_MISUSE);
        }
      }
    }
  }

  /** Equivalent to {@link #teardown()}; lets owners use try-with-resources as a last-resort guard. */
  @Override
  public void close() {
    teardown();
  }

  /**
   * Returns the configured worker count.
   *
   * @return number of workers launched by {@link #start()}
   */
  public int threadCount() {
    return threadCount;
  }

  /**
   * Returns the number of workers whose thread actually started.
   *
   * @return launched worker count; below {@link #threadCount()} only after a failed {@link #start()}
   */
  public int launchedWorkers() {
    synchronized (lifecycle) {
      return launchedWorkers;
    }
  }

  /**
   * Returns the number of workers that have not yet returned from their handler.
   *
   * @return live worker count, including detached workers
   */
  public int liveWorkers() {
    return liveWorkers.get();
  }

  /**
   * Returns the number of workers whose handler ended with an exception.
   *
   * @return failed worker count
   */
  public int failedWorkers() {
    return failedWorkers.get();
  }

  /**
   * Indicates whether {@link #start()} has been called.
   *
   * @return {@code true} once started
   */
  public boolean isStarted() {
    synchronized (lifecycle) {
      return state != State.NEW && outcome != TeardownOutcome.NOT_STARTED;
    }
  }

  /**
   * Returns the recorded outcome once the pool has been joined or torn down.
   *
   * @return recorded outcome, empty while the pool is new, running, or joining
   */
  public Optional<TeardownOutcome> outcome() {
    synchronized (lifecycle) {
      return Optional.ofNullable(outcome);
    }
  }

  private TeardownOutcome finish(TeardownOutcome result) {
    threads.clear();
    state = State.CLOSED;
    outcome = result;
    return result;
  }

  private static int countAlive(List<Thread> candidates) {
    int alive = 0;
    for (Thread thread : candidates) {
      if (thread.isAlive()) {
        alive++;
      }
    }
    return alive;
  }

  private void handleWorkerCrash(Thread thread, Throwable throwable) {
    failedWorkers.incrementAndGet();
    metrics.increment("pool.worker.failed");
    log.error("Worker {} terminated by an uncaught throwable", thread.getName(), throwable);
  }

  private final class Worker implements Runnable {
    private final Map<String, String> context;

    private Worker(Map<String, String> context) {
      this.context = context;
    }

    @Override
    public void run() {
      if (context != null) {
        MDC.setContextMap(context);
      }
      String name = Thread.currentThread().getName();
      metrics.increment("pool.worker.started");
      log.debug("Worker {} consuming", name);
      try {
        handler.consume(channel);
        metrics.increment("pool.worker.finished");
        log.debug("Worker {} drained channel and exited", name);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        metrics.increment("pool.worker.interrupted");
        log.warn("Worker {} interrupted before the channel drained", name);
      } catch (Exception ex) {
        failedWorkers.incrementAndGet();
        metrics.increment("pool.worker.failed");
        log.error("Worker {} handler failed", name, ex);
      } finally {
        liveWorkers.decrementAndGet();
        MDC.clear();
      }
    }
  }

  private enum State {
    NEW("new"),
    RUNNING("started"),
    JOINING("joining"),
    CLOSED("closed");

    private final String label;

    State(String label) {
      this.label = label;
    }
  }

  /**
   * Worker thread settings.
   *
   * @param threadPrefix thread-name prefix; blank falls back to {@code flapline-worker}
   * @param daemon whether worker threads are daemon threads
   */
  public record Settings(String threadPrefix, boolean daemon) {
    /**
     * Normalizes the thread prefix.
     */
    public Settings {
      threadPrefix = (threadPrefix == null || threadPrefix.isBlank())
          ? WorkerThreadFactories.DEFAULT_PREFIX
          : threadPrefix.trim();
    }

    /**
     * Non-daemon workers named {@code flapline-worker-N}.
     *
     * @return default settings
     */
    public static Settings defaults() {
      return new Settings(WorkerThreadFactories.DEFAULT_PREFIX, false);
    }
  }
}
