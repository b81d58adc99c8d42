package ca.gc.cra.mimetic.infrastructure.detect;

import ca.gc.cra.mimetic.application.port.DetectionCallback;
import ca.gc.cra.mimetic.application.port.LandmarkDetector;
import ca.gc.cra.mimetic.domain.detect.DetectionResult;
import ca.gc.cra.mimetic.domain.detect.DetectorKind;
import ca.gc.cra.mimetic.domain.detect.FaceReadings;
import ca.gc.cra.mimetic.domain.detect.GazeClassifier;
import ca.gc.cra.mimetic.domain.detect.LandmarkReadings;
import ca.gc.cra.mimetic.domain.detect.PoseReadings;
import ca.gc.cra.mimetic.domain.frame.Frame;
import ca.gc.cra.mimetic.infrastructure.exec.ExecutorFactories;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic detector for demos and dry runs. Readings are slow sine waves of the frame timestamp,
 * so the same timestamp always yields the same head pose.
 */
public final class SyntheticLandmarkDetector implements LandmarkDetector {
  private static final Logger log = LoggerFactory.getLogger(SyntheticLandmarkDetector.class);

  private final DetectorKind kind;
  private final GazeClassifier gaze;
  private final ExecutorService pool;

  public SyntheticLandmarkDetector(DetectorKind kind, GazeClassifier gaze, int queueCapacity) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.gaze = kind == DetectorKind.FACE ? Objects.requireNonNull(gaze, "gaze") : null;
    this.pool = ExecutorFactories.newBoundedPool(1, queueCapacity, "mimetic-synthetic-" + kind.label(),
        (t, ex) -> log.error("synthetic {} detector failed", kind.label(), ex));
  }

  @Override
  public DetectorKind kind() {
    return kind;
  }

  @Override
  public boolean detectAsync(Frame frame, long timestampMillis, DetectionCallback callback) {
    Objects.requireNonNull(frame, "frame");
    Objects.requireNonNull(callback, "callback");
    try {
      pool.execute(() -> callback.onResult(new DetectionResult(kind, timestampMillis, readingsAt(timestampMillis))));
      return true;
    } catch (RejectedExecutionException ex) {
      return false;
    }
  }

  LandmarkReadings readingsAt(long timestampMillis) {
    double t = timestampMillis / 1000.0;
    if (kind == DetectorKind.POSE) {
      return new PoseReadings(50.0 + 20.0 * wave(t, 7.0));
    }
    double ratio = 0.5 + 0.2 * wave(t, 3.0);
    return new FaceReadings(
        12.0 * wave(t, 4.0),
        6.0 * wave(t, 6.0),
        25.0 * wave(t, 5.0),
        gaze.update(OptionalDouble.of(ratio)));
  }

  private static double wave(double seconds, double periodSeconds) {
    return Math.sin(2.0 * Math.PI * seconds / periodSeconds);
  }

  @Override
  public void close() {
    pool.shutdownNow();
  }
}
