package ca.gc.cra.mimetic.domain.detect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.OptionalDouble;
import org.junit.jupiter.api.Test;

class GazeClassifierTest {

  @Test
  void labelsFollowSmoothedRatio() {
    GazeClassifier classifier = new GazeClassifier(1.0, 0.45, 0.55, false);

    assertEquals(GazeLabel.LEFT, classifier.update(OptionalDouble.of(0.2)).label());
    assertEquals(GazeLabel.CENTER, classifier.update(OptionalDouble.of(0.5)).label());
    assertEquals(GazeLabel.RIGHT, classifier.update(OptionalDouble.of(0.9)).label());
  }

  @Test
  void mirroredClassifierSwapsSides() {
    GazeClassifier classifier = new GazeClassifier(1.0, 0.45, 0.55, true);

    assertEquals(GazeLabel.RIGHT, classifier.update(OptionalDouble.of(0.1)).label());
  }

  @Test
  void smoothingDampsASingleOutlier() {
    GazeClassifier classifier = new GazeClassifier(0.5, 0.45, 0.55, false);
    classifier.update(OptionalDouble.of(0.5));

    Gaze gaze = classifier.update(OptionalDouble.of(1.0));

    assertEquals(0.75, gaze.ratio(), 1e-9);
    assertEquals(GazeLabel.RIGHT, gaze.label());
  }

  @Test
  void missingRatioReportsCenterAndKeepsState() {
    GazeClassifier classifier = GazeClassifier.withDefaults(false);

    Gaze first = classifier.update(OptionalDouble.empty());
    classifier.update(OptionalDouble.of(0.1));
    Gaze held = classifier.update(OptionalDouble.of(Double.NaN));

    assertEquals(GazeLabel.CENTER, first.label());
    assertEquals(0.5, first.ratio(), 1e-9);
    assertEquals(GazeLabel.CENTER, held.label());
    assertEquals(0.3, held.ratio(), 1e-9);
  }

  @Test
  void rejectsInvertedThresholds() {
    assertThrows(IllegalArgumentException.class, () -> new GazeClassifier(0.5, 0.6, 0.4, false));
    assertThrows(IllegalArgumentException.class, () -> new GazeClassifier(0.0, 0.4, 0.6, false));
  }
}
