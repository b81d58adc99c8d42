package ca.gc.cra.mimetic.application.pipeline;

import ca.gc.cra.mimetic.application.port.DetectionCallback;
import ca.gc.cra.mimetic.application.port.MetricsPort;
import ca.gc.cra.mimetic.domain.detect.DetectionResult;
import ca.gc.cra.mimetic.domain.detect.DetectorKind;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Message-passing bridge between detector threads and the {@link CorrelationBuffer}.
 *
 * <p>Detector callbacks only enqueue into a bounded per-kind channel; when a channel is full its
 * oldest result is discarded. A single writer thread drains the channels into the buffer, so the buffer
 * is never touched by detector threads.</p>
 *
 * <p>Metrics: {@code detect.<kind>.results}, {@code fanin.<kind>.dropped}.</p>
 */
public final class ResultFanIn extends ManagedWorker implements DetectionCallback {
  /** Default per-kind channel capacity. */
  public static final int DEFAULT_CHANNEL_CAPACITY = 16;
  private static final long WAIT_MILLIS = 25L;

  private final CorrelationBuffer buffer;
  private final Map<DetectorKind, BlockingQueue<DetectionResult>> channels =
      new EnumMap<>(DetectorKind.class);
  private final Semaphore signal = new Semaphore(0);

  public ResultFanIn(CorrelationBuffer buffer, int channelCapacity, MetricsPort metrics) {
    super("fanin", metrics);
    this.buffer = Objects.requireNonNull(buffer, "buffer");
    if (channelCapacity <= 0) {
      throw new IllegalArgumentException("channelCapacity must be positive");
    }
    for (DetectorKind kind : DetectorKind.values()) {
      channels.put(kind, new ArrayBlockingQueue<>(channelCapacity));
    }
  }

  /** Called from detector threads; never blocks. Results arriving after stop are ignored. */
  @Override
  public void onResult(DetectionResult result) {
    if (result == null || !running()) {
      return;
    }
    BlockingQueue<DetectionResult> channel = channels.get(result.kind());
    while (!channel.offer(result)) {
      if (channel.poll() != null) {
        metrics.increment("fanin." + result.kind().label() + ".dropped");
      }
    }
    signal.release();
  }

  @Override
  protected void runLoop() throws InterruptedException {
    while (running()) {
      if (signal.tryAcquire(WAIT_MILLIS, TimeUnit.MILLISECONDS)) {
        signal.drainPermits();
        drain();
      }
    }
  }

  /** Moves every queued result into the buffer on the calling thread. */
  void drain() {
    for (Map.Entry<DetectorKind, BlockingQueue<DetectionResult>> entry : channels.entrySet()) {
      DetectionResult result;
      while ((result = entry.getValue().poll()) != null) {
        buffer.add(entry.getKey(), result, result.timestampMillis());
        metrics.increment("detect." + entry.getKey().label() + ".results");
      }
    }
  }

  @Override
  protected void onStopRequested(boolean started) {
    channels.values().forEach(BlockingQueue::clear);
    signal.release();
  }
}
