package ca.gc.cra.mimetic.application.port;

import ca.gc.cra.mimetic.domain.detect.DetectorKind;
import ca.gc.cra.mimetic.domain.frame.Frame;

/**
 * <strong>What:</strong> Port over an external landmark detection model.
 * <p><strong>Why:</strong> Model internals and landmark geometry live outside the pipeline; only the
 * kind-tagged readings matter here.</p>
 * <p><strong>Role:</strong> Invoked fire-and-forget by {@code DetectionDispatch}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Accept frames without blocking the caller, dropping them under its own backpressure.</li>
 *   <li>Invoke the callback at most once per accepted frame, from any thread.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #detectAsync} is called from the dispatch worker only;
 * {@link #close()} from the shutdown path.</p>
 *
 * @since 0.1.0
 */
public interface LandmarkDetector extends AutoCloseable {
  /** @return detector family; fixed for the lifetime of the instance */
  DetectorKind kind();

  /**
   * Submits a frame for asynchronous detection.
   *
   * @param frame frame to analyse; owned by the detector once accepted
   * @param timestampMillis strictly increasing dispatch timestamp
   * @param callback completion hook
   * @return {@code true} when the frame was accepted, {@code false} when dropped
   */
  boolean detectAsync(Frame frame, long timestampMillis, DetectionCallback callback);

  /** Stops accepting frames and releases model resources. Idempotent. */
  @Override
  void close();
}
