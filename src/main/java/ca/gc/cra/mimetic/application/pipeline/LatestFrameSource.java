package ca.gc.cra.mimetic.application.pipeline;

import ca.gc.cra.mimetic.application.port.CameraDevice;
import ca.gc.cra.mimetic.application.port.ClockPort;
import ca.gc.cra.mimetic.application.port.FrameSource;
import ca.gc.cra.mimetic.application.port.MetricsPort;
import ca.gc.cra.mimetic.domain.frame.Frame;
import ca.gc.cra.mimetic.domain.frame.FrameOps;
import ca.gc.cra.mimetic.domain.frame.FrameOptions;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link FrameSource} keeping only the most recent camera frame.
 *
 * <p>A capture thread reads the device continuously and overwrites a single slot; frames that are not
 * read before the next one arrives are lost. Readers get transformed copies and never alias the slot.
 * The device is opened synchronously by {@link #start()} and closed by the capture thread on exit.</p>
 *
 * <p>Metrics: {@code frames.captured}, {@code frames.capture.error}.</p>
 */
public final class LatestFrameSource extends ManagedWorker implements FrameSource {
  private static final Logger log = LoggerFactory.getLogger(LatestFrameSource.class);
  private static final long ERROR_BACKOFF_MILLIS = 50L;
  private static final int ERROR_LOG_EVERY = 100;

  private final CameraDevice device;
  private final ClockPort clock;
  private final AtomicReference<Frame> slot = new AtomicReference<>();
  private long consecutiveErrors;

  public LatestFrameSource(CameraDevice device, ClockPort clock, MetricsPort metrics) {
    super("capture", metrics);
    this.device = Objects.requireNonNull(device, "device");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Optional<Frame> latest(FrameOptions options) {
    Objects.requireNonNull(options, "options");
    Frame current = slot.get();
    if (current == null) {
      return Optional.empty();
    }
    return Optional.of(FrameOps.apply(current, options));
  }

  @Override
  protected void beforeStart() {
    try {
      device.open();
      log.info("Opened camera device {}", device.describe());
    } catch (IOException ex) {
      device.close();
      throw new UncheckedIOException("Unable to open camera device " + device.describe(), ex);
    }
  }

  @Override
  protected void runLoop() throws InterruptedException {
    while (running()) {
      try {
        Optional<Frame> next = device.read();
        if (next.isPresent()) {
          slot.set(next.get().withCapturedAt(clock.nowMillis()));
          metrics.increment("frames.captured");
          consecutiveErrors = 0;
        }
      } catch (IOException | RuntimeException ex) {
        metrics.increment("frames.capture.error");
        if (consecutiveErrors++ % ERROR_LOG_EVERY == 0) {
          log.warn("Camera read failed on {} ({} consecutive): {}",
              device.describe(), consecutiveErrors, ex.getMessage());
        }
        TimeUnit.MILLISECONDS.sleep(ERROR_BACKOFF_MILLIS);
      }
    }
  }

  @Override
  protected void afterLoop() {
    device.close();
    log.info("Closed camera device {}", device.describe());
  }
}
