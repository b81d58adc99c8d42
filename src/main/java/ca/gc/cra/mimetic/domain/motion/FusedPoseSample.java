package ca.gc.cra.mimetic.domain.motion;

import ca.gc.cra.mimetic.domain.detect.Gaze;
import java.util.Optional;

/**
 * Pose reading combining face and body results for (approximately) one instant.
 *
 * <p>Fields a contributing detector did not supply are {@link Double#NaN}; {@code gaze} may be
 * {@code null}.</p>
 *
 * @param timestampMillis strictly increasing publication timestamp
 * @param pitch head pitch in degrees
 * @param roll head roll in degrees
 * @param yaw head yaw in degrees
 * @param height normalized torso height
 * @param gaze gaze estimate or {@code null}
 * @since 0.1.0
 */
public record FusedPoseSample(
    long timestampMillis, double pitch, double roll, double yaw, double height, Gaze gaze) {

  /** @return {@code true} when all three head angles are known */
  public boolean hasAngles() {
    return !Double.isNaN(pitch) && !Double.isNaN(roll) && !Double.isNaN(yaw);
  }

  /** @return {@code true} when angles and height are known */
  public boolean complete() {
    return hasAngles() && !Double.isNaN(height);
  }

  public Optional<Gaze> gazeEstimate() {
    return Optional.ofNullable(gaze);
  }

  /**
   * Copy of this sample with a different timestamp.
   *
   * @param millis replacement timestamp
   * @return new sample
   */
  public FusedPoseSample withTimestamp(long millis) {
    return new FusedPoseSample(millis, pitch, roll, yaw, height, gaze);
  }
}
