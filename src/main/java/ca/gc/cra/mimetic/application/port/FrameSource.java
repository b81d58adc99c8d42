package ca.gc.cra.mimetic.application.port;

import ca.gc.cra.mimetic.domain.frame.Frame;
import ca.gc.cra.mimetic.domain.frame.FrameOptions;
import java.util.Optional;

/**
 * <strong>What:</strong> Latest-wins access to a continuously captured camera feed.
 * <p><strong>Why:</strong> The control loop only cares about the current visual state; queueing stale
 * frames would add latency.</p>
 * <p><strong>Thread-safety:</strong> {@link #latest(FrameOptions)} may be called from any thread while
 * the capture thread overwrites the slot.</p>
 *
 * @since 0.1.0
 */
public interface FrameSource extends PipelineComponent {
  /**
   * Returns the newest frame, transformed per {@code options}.
   *
   * @param options resize and mirror settings
   * @return independent copy of the newest frame, or empty when no frame has been captured yet
   */
  Optional<Frame> latest(FrameOptions options);
}
