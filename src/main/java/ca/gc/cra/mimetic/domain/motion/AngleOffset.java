package ca.gc.cra.mimetic.domain.motion;

/**
 * Calibration offset subtracted from raw head angles, in degrees.
 *
 * @param pitch neutral pitch
 * @param roll neutral roll
 * @param yaw neutral yaw
 * @since 0.1.0
 */
public record AngleOffset(double pitch, double roll, double yaw) {
  /** No correction. */
  public static final AngleOffset ZERO = new AngleOffset(0.0, 0.0, 0.0);

  public AngleOffset {
    if (!Double.isFinite(pitch) || !Double.isFinite(roll) || !Double.isFinite(yaw)) {
      throw new IllegalArgumentException("angle offsets must be finite");
    }
  }
}
