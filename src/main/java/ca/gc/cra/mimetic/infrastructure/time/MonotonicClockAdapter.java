package ca.gc.cra.mimetic.infrastructure.time;

import ca.gc.cra.mimetic.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by {@link System#nanoTime()}.
 *
 * @since 0.1.0
 */
public final class MonotonicClockAdapter implements ClockPort {
  private final long originNanos = System.nanoTime();

  /**
   * Returns milliseconds elapsed since this adapter was created.
   *
   * @return non-decreasing milliseconds
   * @implNote Anchoring at construction keeps values small and positive in logs.
   */
  @Override
  public long nowMillis() {
    return (System.nanoTime() - originNanos) / 1_000_000L;
  }
}
