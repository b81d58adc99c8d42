package ca.gc.cra.mimetic.domain.detect;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Head orientation and gaze measured by a face detector. Non-finite angles are reported as absent.
 *
 * @param pitchDegrees head pitch
 * @param rollDegrees head roll
 * @param yawDegrees head yaw
 * @param gazeEstimate gaze, or {@code null} when not measured
 * @since 0.1.0
 */
public record FaceReadings(
    double pitchDegrees, double rollDegrees, double yawDegrees, Gaze gazeEstimate)
    implements LandmarkReadings {

  @Override
  public OptionalDouble pitch() {
    return finite(pitchDegrees);
  }

  @Override
  public OptionalDouble roll() {
    return finite(rollDegrees);
  }

  @Override
  public OptionalDouble yaw() {
    return finite(yawDegrees);
  }

  @Override
  public OptionalDouble height() {
    return OptionalDouble.empty();
  }

  @Override
  public Optional<Gaze> gaze() {
    return Optional.ofNullable(gazeEstimate);
  }

  static OptionalDouble finite(double value) {
    return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
  }
}
