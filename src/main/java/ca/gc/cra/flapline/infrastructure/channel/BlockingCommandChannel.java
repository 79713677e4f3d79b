package ca.gc.cra.flapline.infrastructure.channel;

import ca.gc.cra.flapline.application.port.CommandChannel;
import ca.gc.cra.flapline.application.port.MetricsPort;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lock/condition backed {@link CommandChannel} with a one-way stop signal.
 *
 * <p>The pending deque, the stop flag, and the {@code notEmpty} condition are guarded by one
 * {@link ReentrantLock}; the stop flag is only ever read under that lock, through the wait predicate
 * {@code stopped || !pending.isEmpty()}. {@link #submit(Object)} signals one taker, {@link #stop()} signals
 * all of them so every blocked worker observes the termination signal.</p>
 *
 * <p>The channel is unbounded unless a positive capacity is supplied. A bounded channel never blocks the
 * producer: a submission that finds the channel full is dropped and counted under
 * {@code channel.submit.dropped}.</p>
 *
 * @param <T> command value type
 * @since FLAPLINE 0.1
 */
public final class BlockingCommandChannel<T> implements CommandChannel<T> {
  private static final Logger log = LoggerFactory.getLogger(BlockingCommandChannel.class);

  /** Capacity value meaning "no limit". */
  public static final int UNBOUNDED = 0;

  private static final int DROP_LOG_THRESHOLD = 1_000;

  private final String name;
  private final int capacity;
  private final MetricsPort metrics;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final ArrayDeque<T> pending = new ArrayDeque<>();
  private final LongAdder accepted = new LongAdder();
  private final LongAdder dropped = new LongAdder();
  private final LongAdder rejectedAfterStop = new LongAdder();
  private final AtomicInteger dropLogLimiter = new AtomicInteger();

  private boolean stopped;

  /**
   * Creates an unbounded channel without metrics.
   *
   * @param name channel name used in diagnostics
   */
  public BlockingCommandChannel(String name) {
    this(name, UNBOUNDED, MetricsPort.NO_OP);
  }

  /**
   * Creates a channel with an optional capacity limit.
   *
   * @param name channel name used in diagnostics; must not be blank
   * @param capacity maximum pending values, or {@link #UNBOUNDED}
   * @param metrics metrics sink for submission counters and depth samples
   * @throws IllegalArgumentException if {@code capacity} is negative or {@code name} is blank
   */
  public BlockingCommandChannel(String name, int capacity, MetricsPort metrics) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank");
    }
    if (capacity < 0) {
      throw new IllegalArgumentException("capacity must be >= 0 (was " + capacity + ")");
    }
    this.name = name.trim();
    this.capacity = capacity;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void submit(T value) {
    Objects.requireNonNull(value, "value");
    SubmitResult result;
    int depth;
    lock.lock();
    try {
      if (stopped) {
        result = SubmitResult.AFTER_STOP;
      } else if (capacity != UNBOUNDED && pending.size() >= capacity) {
        result = SubmitResult.DROPPED;
      } else {
        pending.addLast(value);
        notEmpty.signal();
        result = SubmitResult.ACCEPTED;
      }
      depth = pending.size();
    } finally {
      lock.unlock();
    }

    switch (result) {
      case ACCEPTED -> {
        accepted.increment();
        metrics.increment("channel.submit.accepted");
        metrics.observe("channel.depth", depth);
      }
      case DROPPED -> {
        dropped.increment();
        metrics.increment("channel.submit.dropped");
        logDrop();
      }
      case AFTER_STOP -> {
        rejectedAfterStop.increment();
        metrics.increment("channel.submit.afterStop");
        log.debug("Channel {} discarded a submission after stop", name);
      }
    }
  }

  @Override
  public Optional<T> take() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (!stopped && pending.isEmpty()) {
        notEmpty.await();
      }
      // Stopped and drained is the only way out with nothing to return.
      if (pending.isEmpty()) {
        return Optional.empty();
      }
      return Optional.of(pending.pollFirst());
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void stop() {
    int remaining;
    lock.lock();
    try {
      if (stopped) {
        return;
      }
      stopped = true;
      notEmpty.signalAll();
      remaining = pending.size();
    } finally {
      lock.unlock();
    }
    log.debug("Channel {} stopped with {} values left to drain", name, remaining);
  }

  @Override
  public boolean isStopped() {
    lock.lock();
    try {
      return stopped;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int size() {
    lock.lock();
    try {
      return pending.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the configured capacity.
   *
   * @return capacity, or {@link #UNBOUNDED}
   */
  public int capacity() {
    return capacity;
  }

  /**
   * Returns the channel name.
   *
   * @return name used in diagnostics
   */
  public String name() {
    return name;
  }

  /**
   * Returns how many submissions were accepted.
   *
   * @return accepted submission count
   */
  public long acceptedCount() {
    return accepted.sum();
  }

  /**
   * Returns how many submissions were dropped because the channel was full.
   *
   * @return dropped submission count
   */
  public long droppedCount() {
    return dropped.sum();
  }

  /**
   * Returns how many submissions arrived after {@link #stop()} and were discarded.
   *
   * @return post-stop submission count
   */
  public long afterStopCount() {
    return rejectedAfterStop.sum();
  }

  private void logDrop() {
    int count = dropLogLimiter.incrementAndGet();
    if (count == 1 || count % DROP_LOG_THRESHOLD == 0) {
      log.warn("Channel {} full (capacity={}); dropped {} submissions so far", name, capacity, dropped.sum());
      if (count >= DROP_LOG_THRESHOLD * 100) {
        dropLogLimiter.set(0);
      }
    }
  }

  private enum SubmitResult {
    ACCEPTED,
    DROPPED,
    AFTER_STOP
  }
}
