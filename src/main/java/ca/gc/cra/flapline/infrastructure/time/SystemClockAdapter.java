package ca.gc.cra.flapline.infrastructure.time;

import ca.gc.cra.flapline.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by {@link System#nanoTime()}.
 *
 * @since FLAPLINE 0.1
 */
public final class SystemClockAdapter implements ClockPort {
  /**
   * Creates a system clock adapter.
   */
  public SystemClockAdapter() {}

  /**
   * Returns the JVM monotonic clock reading.
   *
   * @return monotonic nanoseconds
   */
  @Override
  public long nowNanos() {
    return System.nanoTime();
  }
}
