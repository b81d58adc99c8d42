package ca.gc.cra.mimetic.domain.detect;

import java.util.Objects;

/**
 * Output of one detector for one submitted frame.
 *
 * @param kind detector family that produced the result
 * @param timestampMillis dispatch timestamp of the frame the result belongs to
 * @param readings landmark-derived quantities
 * @since 0.1.0
 */
public record DetectionResult(DetectorKind kind, long timestampMillis, LandmarkReadings readings) {
  public DetectionResult {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(readings, "readings");
  }

  /**
   * Builds a result for a frame where the detector found nothing.
   *
   * @param kind detector family
   * @param timestampMillis frame timestamp
   * @return result carrying {@link LandmarkReadings#EMPTY}
   */
  public static DetectionResult empty(DetectorKind kind, long timestampMillis) {
    return new DetectionResult(kind, timestampMillis, LandmarkReadings.EMPTY);
  }
}
