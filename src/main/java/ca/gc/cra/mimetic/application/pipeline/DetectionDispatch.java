package ca.gc.cra.mimetic.application.pipeline;

import ca.gc.cra.mimetic.application.port.ClockPort;
import ca.gc.cra.mimetic.application.port.DetectionCallback;
import ca.gc.cra.mimetic.application.port.LandmarkDetector;
import ca.gc.cra.mimetic.application.port.MetricsPort;
import ca.gc.cra.mimetic.domain.frame.Frame;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stamps frames and hands them to every landmark detector.
 *
 * <p>{@link #submit(Frame)} never blocks: when the hand-off queue is full the frame is dropped. The
 * dispatch worker calls {@link LandmarkDetector#detectAsync} on each detector in turn; detectors own
 * their execution and answer through the shared {@link DetectionCallback}. A detector that rejects or
 * throws is counted and skipped, the others still see the frame.</p>
 *
 * <p>Metrics: {@code dispatch.frames.submitted}, {@code dispatch.frames.dropped},
 * {@code detect.<kind>.dropped}, {@code detect.<kind>.error}.</p>
 */
public final class DetectionDispatch extends ManagedWorker {
  private static final Logger log = LoggerFactory.getLogger(DetectionDispatch.class);
  /** Default hand-off queue capacity. */
  public static final int DEFAULT_QUEUE_CAPACITY = 8;
  private static final long POLL_MILLIS = 25L;

  private final List<LandmarkDetector> detectors;
  private final DetectionCallback callback;
  private final ClockPort clock;
  private final BlockingQueue<Stamped> queue;
  private final AtomicLong lastTimestamp = new AtomicLong(Long.MIN_VALUE);
  private final AtomicBoolean detectorsClosed = new AtomicBoolean();

  public DetectionDispatch(
      List<LandmarkDetector> detectors,
      DetectionCallback callback,
      int queueCapacity,
      ClockPort clock,
      MetricsPort metrics) {
    super("dispatch", metrics);
    Objects.requireNonNull(detectors, "detectors");
    if (detectors.isEmpty()) {
      throw new IllegalArgumentException("at least one detector is required");
    }
    if (queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be positive");
    }
    this.detectors = List.copyOf(detectors);
    this.callback = Objects.requireNonNull(callback, "callback");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.queue = new ArrayBlockingQueue<>(queueCapacity);
  }

  /**
   * Offers a frame for detection without blocking.
   *
   * @param frame frame to analyse
   * @return {@code true} when the frame was queued; {@code false} when dropped or stopped
   */
  public boolean submit(Frame frame) {
    Objects.requireNonNull(frame, "frame");
    if (!running()) {
      return false;
    }
    long timestamp = nextTimestamp();
    if (queue.offer(new Stamped(frame, timestamp))) {
      metrics.increment("dispatch.frames.submitted");
      return true;
    }
    metrics.increment("dispatch.frames.dropped");
    log.debug("Detection queue full; dropped frame ts={}", timestamp);
    return false;
  }

  /** @return last timestamp handed out, or {@link Long#MIN_VALUE} before the first submit */
  public long lastTimestamp() {
    return lastTimestamp.get();
  }

  /** @return frames waiting for the dispatch worker */
  public int pending() {
    return queue.size();
  }

  private long nextTimestamp() {
    long now = clock.nowMillis();
    while (true) {
      long last = lastTimestamp.get();
      long next = last == Long.MIN_VALUE || now > last ? now : last + 1;
      if (lastTimestamp.compareAndSet(last, next)) {
        return next;
      }
    }
  }

  @Override
  protected void runLoop() throws InterruptedException {
    while (running()) {
      Stamped next = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
      if (next == null || !running()) {
        continue;
      }
      for (LandmarkDetector detector : detectors) {
        String kind = detector.kind().label();
        try {
          if (!detector.detectAsync(next.frame(), next.timestamp(), callback)) {
            metrics.increment("detect." + kind + ".dropped");
          }
        } catch (RuntimeException ex) {
          metrics.increment("detect." + kind + ".error");
          log.warn("{} detector rejected frame ts={}: {}", kind, next.timestamp(), ex.getMessage());
        }
      }
    }
  }

  @Override
  protected void onStopRequested(boolean started) {
    queue.clear();
    if (!started) {
      closeDetectors();
    }
  }

  @Override
  protected void afterLoop() {
    queue.clear();
    closeDetectors();
  }

  private void closeDetectors() {
    if (!detectorsClosed.compareAndSet(false, true)) {
      return;
    }
    for (LandmarkDetector detector : detectors) {
      try {
        detector.close();
      } catch (RuntimeException ex) {
        log.warn("Failed to close {} detector", detector.kind().label(), ex);
      }
    }
  }

  private record Stamped(Frame frame, long timestamp) {}
}
