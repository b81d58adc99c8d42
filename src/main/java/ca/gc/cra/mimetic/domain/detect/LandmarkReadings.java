package ca.gc.cra.mimetic.domain.detect;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Accessor view over a detector's landmark output. Detectors supply only the quantities they
 * measure; everything else reports empty.
 *
 * <p>Angles are in degrees. Height is the detector's normalized torso height, nominally 0..100.</p>
 *
 * @since 0.1.0
 */
public interface LandmarkReadings {
  OptionalDouble pitch();

  OptionalDouble roll();

  OptionalDouble yaw();

  OptionalDouble height();

  Optional<Gaze> gaze();

  /** Readings for a frame in which nothing was detected. */
  LandmarkReadings EMPTY = new LandmarkReadings() {
    @Override public OptionalDouble pitch() {
      return OptionalDouble.empty();
    }

    @Override public OptionalDouble roll() {
      return OptionalDouble.empty();
    }

    @Override public OptionalDouble yaw() {
      return OptionalDouble.empty();
    }

    @Override public OptionalDouble height() {
      return OptionalDouble.empty();
    }

    @Override public Optional<Gaze> gaze() {
      return Optional.empty();
    }

    @Override public String toString() {
      return "LandmarkReadings.EMPTY";
    }
  };
}
