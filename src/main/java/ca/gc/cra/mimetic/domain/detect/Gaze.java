package ca.gc.cra.mimetic.domain.detect;

import java.util.Objects;

/**
 * Gaze estimate attached to a face result.
 *
 * @param label coarse direction
 * @param ratio smoothed horizontal iris position in {@code [0, 1]}, 0 being the far left
 * @since 0.1.0
 */
public record Gaze(GazeLabel label, double ratio) {
  public Gaze {
    Objects.requireNonNull(label, "label");
    if (!Double.isFinite(ratio) || ratio < 0.0 || ratio > 1.0) {
      throw new IllegalArgumentException("gaze ratio must be within [0, 1] (was " + ratio + ")");
    }
  }
}
