package ca.gc.cra.mimetic.application.pipeline;

import ca.gc.cra.mimetic.domain.motion.MotionSmoother;
import java.time.Duration;
import java.util.Objects;

/**
 * Control-loop and lifecycle tuning for a {@link MimicSession}.
 *
 * @param detectWidth upper bound for the width of frames sent to detectors
 * @param detectHeight upper bound for the height of frames sent to detectors
 * @param mirror flip detector frames horizontally
 * @param targetFps control loop rate
 * @param firstFrameTimeout how long {@link MimicSession#initialize()} waits for the camera
 * @param calibrationWindow maximum calibration duration
 * @param calibrationSamples calibration stops early once this many samples were collected
 * @param stopTimeout bound applied to each component join during shutdown
 * @param smoothing smoother gate and EMA parameters
 */
public record SessionSettings(
    int detectWidth,
    int detectHeight,
    boolean mirror,
    int targetFps,
    Duration firstFrameTimeout,
    Duration calibrationWindow,
    int calibrationSamples,
    Duration stopTimeout,
    MotionSmoother.Settings smoothing) {
  public static final int DEFAULT_DETECT_WIDTH = 320;
  public static final int DEFAULT_DETECT_HEIGHT = 180;
  public static final int DEFAULT_TARGET_FPS = 30;

  public SessionSettings {
    if (detectWidth <= 0 || detectHeight <= 0) {
      throw new IllegalArgumentException("detect size must be positive");
    }
    if (targetFps <= 0 || targetFps > 1000) {
      throw new IllegalArgumentException("targetFps must be within 1..1000 (was " + targetFps + ")");
    }
    requirePositive("firstFrameTimeout", firstFrameTimeout);
    requirePositive("calibrationWindow", calibrationWindow);
    requirePositive("stopTimeout", stopTimeout);
    if (calibrationSamples <= 0) {
      throw new IllegalArgumentException("calibrationSamples must be positive");
    }
    Objects.requireNonNull(smoothing, "smoothing");
  }

  /** @return 320x180 mirrored detection, 30 fps, 5 s first frame, 2 s or 10 sample calibration */
  public static SessionSettings defaults() {
    return new SessionSettings(
        DEFAULT_DETECT_WIDTH,
        DEFAULT_DETECT_HEIGHT,
        true,
        DEFAULT_TARGET_FPS,
        Duration.ofSeconds(5),
        Duration.ofSeconds(2),
        10,
        Duration.ofSeconds(2),
        MotionSmoother.Settings.defaults());
  }

  /** @return loop period derived from {@link #targetFps()} */
  public long framePeriodMillis() {
    return Math.max(1L, Math.round(1000.0 / targetFps));
  }

  private static void requirePositive(String name, Duration value) {
    Objects.requireNonNull(value, name);
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
  }
}
