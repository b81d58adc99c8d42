package ca.gc.cra.mimetic.application.port;

import ca.gc.cra.mimetic.domain.detect.DetectionResult;

/** Completion hook invoked at most once per frame accepted by a {@link LandmarkDetector}. */
@FunctionalInterface
public interface DetectionCallback {
  /**
   * Delivers a result. May run on any thread; implementations must not block.
   *
   * @param result kind-tagged detection result
   */
  void onResult(DetectionResult result);
}
