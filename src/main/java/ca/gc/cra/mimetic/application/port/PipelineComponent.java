package ca.gc.cra.mimetic.application.port;

import java.time.Duration;

/**
 * Lifecycle shared by every long-running pipeline stage.
 *
 * <p>{@link #stop()} is idempotent, never blocks on the component's own work, and is safe before
 * {@link #start()} or from several threads at once. After {@code stop()}, worker threads observe the
 * request within one of their polling intervals.</p>
 *
 * @since 0.1.0
 */
public interface PipelineComponent {
  /** @return short name used in logs and thread names */
  String name();

  /**
   * Launches the component's worker thread(s).
   *
   * @throws IllegalStateException when already started or stopped
   */
  void start();

  /** Requests shutdown. */
  void stop();

  /**
   * Waits for worker threads to exit.
   *
   * @param timeout upper bound on the wait
   * @return {@code true} when every worker has exited (or none was started)
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  boolean join(Duration timeout) throws InterruptedException;
}
