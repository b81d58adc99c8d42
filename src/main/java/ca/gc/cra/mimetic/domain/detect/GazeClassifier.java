package ca.gc.cra.mimetic.domain.detect;

import java.util.OptionalDouble;

/**
 * Smooths raw horizontal iris ratios and buckets them into {@link GazeLabel}s.
 *
 * <p>Stateful: one instance per face detector. Not thread-safe; callers confine it to the detector's
 * callback path.</p>
 *
 * @since 0.1.0
 */
public final class GazeClassifier {
  public static final double DEFAULT_ALPHA = 0.5;
  public static final double DEFAULT_LEFT_THRESHOLD = 0.45;
  public static final double DEFAULT_RIGHT_THRESHOLD = 0.55;
  private static final double NEUTRAL_RATIO = 0.5;

  private final double alpha;
  private final double leftThreshold;
  private final double rightThreshold;
  private final boolean mirror;
  private double smoothed = Double.NaN;

  public GazeClassifier(double alpha, double leftThreshold, double rightThreshold, boolean mirror) {
    if (!(alpha > 0.0 && alpha <= 1.0)) {
      throw new IllegalArgumentException("alpha must be within (0, 1] (was " + alpha + ")");
    }
    if (!(leftThreshold >= 0.0 && leftThreshold <= rightThreshold && rightThreshold <= 1.0)) {
      throw new IllegalArgumentException(
          "thresholds must satisfy 0 <= left <= right <= 1 (was " + leftThreshold + ", " + rightThreshold + ")");
    }
    this.alpha = alpha;
    this.leftThreshold = leftThreshold;
    this.rightThreshold = rightThreshold;
    this.mirror = mirror;
  }

  /**
   * Creates a classifier with the stock smoothing factor and thresholds.
   *
   * @param mirror swap left/right to match a mirrored preview
   * @return classifier
   */
  public static GazeClassifier withDefaults(boolean mirror) {
    return new GazeClassifier(DEFAULT_ALPHA, DEFAULT_LEFT_THRESHOLD, DEFAULT_RIGHT_THRESHOLD, mirror);
  }

  /**
   * Folds a raw ratio into the running estimate.
   *
   * @param rawRatio iris ratio for this frame; empty when the iris was not found
   * @return smoothed gaze; {@link GazeLabel#CENTER} at the last known ratio when no iris was found
   */
  public Gaze update(OptionalDouble rawRatio) {
    if (rawRatio.isEmpty() || !Double.isFinite(rawRatio.getAsDouble())) {
      if (Double.isNaN(smoothed)) {
        smoothed = NEUTRAL_RATIO;
      }
      return new Gaze(GazeLabel.CENTER, smoothed);
    }
    double ratio = Math.max(0.0, Math.min(1.0, rawRatio.getAsDouble()));
    smoothed = Double.isNaN(smoothed) ? ratio : alpha * ratio + (1.0 - alpha) * smoothed;

    GazeLabel label;
    if (smoothed < leftThreshold) {
      label = GazeLabel.LEFT;
    } else if (smoothed > rightThreshold) {
      label = GazeLabel.RIGHT;
    } else {
      label = GazeLabel.CENTER;
    }
    return new Gaze(mirror ? label.mirrored() : label, smoothed);
  }
}
