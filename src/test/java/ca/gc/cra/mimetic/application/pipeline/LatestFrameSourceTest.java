package ca.gc.cra.mimetic.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.mimetic.domain.frame.Frame;
import ca.gc.cra.mimetic.domain.frame.FrameOptions;
import ca.gc.cra.mimetic.testing.FakeCameraDevice;
import ca.gc.cra.mimetic.testing.ManualClock;
import ca.gc.cra.mimetic.testing.RecordingMetrics;
import ca.gc.cra.mimetic.testing.Waits;
import java.io.UncheckedIOException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class LatestFrameSourceTest {
  private final ManualClock clock = new ManualClock(42L);
  private final RecordingMetrics metrics = new RecordingMetrics();

  @Test
  void readersGetTransformedCopiesStampedWithCaptureTime() throws Exception {
    FakeCameraDevice device = FakeCameraDevice.producing(8, 6);
    LatestFrameSource source = new LatestFrameSource(device, clock, metrics);
    assertTrue(source.latest(FrameOptions.NATIVE).isEmpty());

    source.start();
    assertTrue(Waits.until(() -> source.latest(FrameOptions.NATIVE).isPresent(), Duration.ofSeconds(2)));

    Frame small = source.latest(new FrameOptions(4, 3, true)).orElseThrow();
    assertEquals(4, small.width());
    assertEquals(3, small.height());
    assertEquals(42L, small.capturedAtMillis());
    assertTrue(metrics.count("frames.captured") >= 1);

    source.stop();
    assertTrue(source.join(Duration.ofSeconds(1)));
    assertEquals(1, device.closes());
  }

  @Test
  void openFailureClosesDeviceAndPropagates() {
    FakeCameraDevice device = FakeCameraDevice.failingOpen();
    LatestFrameSource source = new LatestFrameSource(device, clock, metrics);

    assertThrows(UncheckedIOException.class, source::start);
    assertEquals(1, device.closes());
  }
}
