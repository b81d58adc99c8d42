package ca.gc.cra.mimetic.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.mimetic.domain.detect.DetectionResult;
import ca.gc.cra.mimetic.domain.detect.DetectorKind;
import ca.gc.cra.mimetic.domain.detect.PoseReadings;
import ca.gc.cra.mimetic.testing.ManualClock;
import ca.gc.cra.mimetic.testing.RecordingMetrics;
import ca.gc.cra.mimetic.testing.Waits;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class ResultFanInTest {
  private final ManualClock clock = new ManualClock(1_000L);
  private final RecordingMetrics metrics = new RecordingMetrics();
  private final CorrelationBuffer buffer =
      new CorrelationBuffer(CorrelationBuffer.Settings.defaults(), clock, metrics);

  private static DetectionResult pose(long ts, double height) {
    return new DetectionResult(DetectorKind.POSE, ts, new PoseReadings(height));
  }

  @Test
  void fullChannelDropsOldestResult() {
    ResultFanIn fanIn = new ResultFanIn(buffer, 2, metrics);

    fanIn.onResult(pose(1_000L, 1));
    fanIn.onResult(pose(1_001L, 2));
    fanIn.onResult(pose(1_002L, 3));
    fanIn.drain();

    assertEquals(1, metrics.count("fanin.pose.dropped"));
    assertEquals(2, buffer.snapshot().size());
    assertEquals(1_001L, buffer.snapshot().get(0).timestampMillis());
    assertEquals(3.0, buffer.latest().orElseThrow().height());
  }

  @Test
  void writerThreadMovesResultsIntoBuffer() throws Exception {
    ResultFanIn fanIn = new ResultFanIn(buffer, 4, metrics);
    fanIn.start();

    fanIn.onResult(pose(1_000L, 12));

    assertTrue(Waits.until(() -> buffer.latest().isPresent(), Duration.ofSeconds(2)));
    assertEquals(1, metrics.count("detect.pose.results"));
    fanIn.stop();
    assertTrue(fanIn.join(Duration.ofSeconds(1)));
  }

  @Test
  void resultsAfterStopAreIgnored() {
    ResultFanIn fanIn = new ResultFanIn(buffer, 4, metrics);
    fanIn.stop();

    fanIn.onResult(pose(1_000L, 12));
    fanIn.onResult(null);
    fanIn.drain();

    assertTrue(buffer.latest().isEmpty());
  }
}
