package ca.gc.cra.mimetic.domain.detect;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Torso height measured by a body pose detector.
 *
 * @param heightValue normalized height, nominally 0..100; NaN when unknown
 * @since 0.1.0
 */
public record PoseReadings(double heightValue) implements LandmarkReadings {

  @Override
  public OptionalDouble pitch() {
    return OptionalDouble.empty();
  }

  @Override
  public OptionalDouble roll() {
    return OptionalDouble.empty();
  }

  @Override
  public OptionalDouble yaw() {
    return OptionalDouble.empty();
  }

  @Override
  public OptionalDouble height() {
    return FaceReadings.finite(heightValue);
  }

  @Override
  public Optional<Gaze> gaze() {
    return Optional.empty();
  }
}
