package ca.gc.cra.flapline.application.port;

/**
 * <strong>What:</strong> Port supplying monotonic timestamps to the tick loop and command handlers.
 * <p><strong>Why:</strong> Command latency is the difference between two readings taken on different threads;
 * both sides must read the same monotonic source, and tests need to substitute a deterministic one.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent reads from the producer and
 * every worker.</p>
 *
 * @implNote The default implementation delegates to {@link System#nanoTime()}; values are only meaningful as
 * differences.
 * @since FLAPLINE 0.1
 * @see ca.gc.cra.flapline.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current monotonic time in nanoseconds.
   *
   * @return monotonic nanoseconds from an arbitrary origin
   */
  long nowNanos();

  /** Default {@link ClockPort} using {@link System#nanoTime()}. */
  ClockPort SYSTEM = System::nanoTime;
}
