package ca.gc.cra.mimetic.application.port;

/**
 * <strong>What:</strong> Port supplying monotonic millisecond timestamps to the mimicry pipeline.
 * <p><strong>Why:</strong> Frame timestamps, freshness windows and the emission rate gate all need a
 * clock that never jumps backwards and that tests can drive by hand.</p>
 * <p><strong>Role:</strong> Domain port consumed by pipeline components.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; the capture, dispatch,
 * fan-in and control threads all read the clock.</p>
 * <p><strong>Performance:</strong> Expected to be constant-time.</p>
 *
 * @implNote The default implementation derives milliseconds from {@link System#nanoTime()}; values
 * are only meaningful relative to each other.
 * @since 0.1.0
 * @see ca.gc.cra.mimetic.infrastructure.time.MonotonicClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current monotonic time in milliseconds.
   *
   * @return milliseconds since an arbitrary fixed origin
   */
  long nowMillis();

  /** Default {@link ClockPort} backed by {@link System#nanoTime()}. */
  ClockPort SYSTEM = () -> System.nanoTime() / 1_000_000L;
}
