package ca.gc.cra.mimetic.application.pipeline;

import ca.gc.cra.mimetic.application.port.ActuatorClient;
import ca.gc.cra.mimetic.application.port.ClockPort;
import ca.gc.cra.mimetic.application.port.MetricsPort;
import ca.gc.cra.mimetic.domain.motion.ActuatorPayload;
import ca.gc.cra.mimetic.logging.Logs;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rate-limited, lossy sender for one actuator endpoint.
 *
 * <p>{@link #send(ActuatorPayload)} is a non-blocking offer. The worker keeps at least
 * {@code minInterval} between successful posts, waiting in short slices so a stop request is seen
 * promptly. Failed posts are logged and counted but never retried; a newer payload supersedes them.</p>
 *
 * <p>Metrics: {@code actuator.<slot>.sent}, {@code actuator.<slot>.dropped},
 * {@code actuator.<slot>.error}, {@code actuator.<slot>.latencyNanos}.</p>
 */
public final class ActuatorDispatcher extends ManagedWorker {
  private static final Logger log = LoggerFactory.getLogger(ActuatorDispatcher.class);
  /** Default queue capacity. */
  public static final int DEFAULT_QUEUE_CAPACITY = 32;
  /** Default spacing between successful posts. */
  public static final Duration DEFAULT_MIN_INTERVAL = Duration.ofMillis(100);
  private static final long POLL_MILLIS = 100L;
  private static final long SLEEP_SLICE_MILLIS = 20L;
  private static final int DROP_WARN_EVERY = 50;
  private static final int ERROR_BODY_LIMIT = 256;
  private static final Envelope POISON = new Envelope(null, 0L);

  private final String slot;
  private final ActuatorClient client;
  private final ClockPort clock;
  private final long minIntervalMillis;
  private final int capacity;
  private final BlockingQueue<Envelope> queue;
  private final AtomicLong dropped = new AtomicLong();
  private long lastSuccessMillis = Long.MIN_VALUE;

  public ActuatorDispatcher(
      String slot,
      ActuatorClient client,
      int queueCapacity,
      Duration minInterval,
      ClockPort clock,
      MetricsPort metrics) {
    super("actuator-" + Objects.requireNonNull(slot, "slot"), metrics);
    if (queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be positive");
    }
    Objects.requireNonNull(minInterval, "minInterval");
    if (minInterval.isNegative()) {
      throw new IllegalArgumentException("minInterval must not be negative");
    }
    this.slot = slot;
    this.client = Objects.requireNonNull(client, "client");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.minIntervalMillis = minInterval.toMillis();
    this.capacity = queueCapacity;
    this.queue = new ArrayBlockingQueue<>(queueCapacity + 1);
  }

  /**
   * Queues a payload without blocking.
   *
   * @param payload command to post
   * @return {@code true} if accepted; {@code false} when the queue is full or the sender is stopped
   */
  public boolean send(ActuatorPayload payload) {
    Objects.requireNonNull(payload, "payload");
    if (!running()) {
      return false;
    }
    if (queue.size() < capacity && queue.offer(new Envelope(payload, clock.nowMillis()))) {
      return true;
    }
    metrics.increment(metricKey("dropped"));
    long total = dropped.incrementAndGet();
    if (total == 1 || total % DROP_WARN_EVERY == 0) {
      log.warn("Actuator {} queue full; dropped {} payload(s) so far", slot, total);
    }
    return false;
  }

  public String slot() {
    return slot;
  }

  /** @return payloads waiting to be posted */
  public int pending() {
    int size = queue.size();
    return queue.contains(POISON) ? size - 1 : size;
  }

  public int capacity() {
    return capacity;
  }

  /** @return payloads dropped because the queue was full */
  public long droppedCount() {
    return dropped.get();
  }

  @Override
  protected void runLoop() throws InterruptedException {
    while (running()) {
      Envelope next = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
      if (next == null) {
        continue;
      }
      if (next == POISON || !running()) {
        return;
      }
      if (!awaitInterval()) {
        return;
      }
      post(next);
    }
  }

  private boolean awaitInterval() throws InterruptedException {
    if (lastSuccessMillis == Long.MIN_VALUE) {
      return running();
    }
    long wait;
    while ((wait = lastSuccessMillis + minIntervalMillis - clock.nowMillis()) > 0) {
      if (!running()) {
        return false;
      }
      TimeUnit.MILLISECONDS.sleep(Math.min(wait, SLEEP_SLICE_MILLIS));
    }
    return running();
  }

  private void post(Envelope envelope) throws InterruptedException {
    long started = System.nanoTime();
    try {
      client.post(envelope.payload());
      lastSuccessMillis = clock.nowMillis();
      metrics.increment(metricKey("sent"));
      metrics.observe(metricKey("latencyNanos"), System.nanoTime() - started);
      log.debug("Actuator {} accepted payload queued {} ms ago",
          slot, clock.nowMillis() - envelope.enqueuedAtMillis());
    } catch (IOException | RuntimeException ex) {
      metrics.increment(metricKey("error"));
      log.warn("Actuator {} post to {} failed: {}",
          slot, client.endpoint(), Logs.truncate(String.valueOf(ex.getMessage()), ERROR_BODY_LIMIT));
    }
  }

  @Override
  protected void onStopRequested(boolean started) {
    queue.clear();
    queue.offer(POISON);
    if (!started) {
      closeClient();
    }
  }

  @Override
  protected void afterLoop() {
    queue.clear();
    closeClient();
  }

  private void closeClient() {
    try {
      client.close();
    } catch (Exception ex) {
      log.warn("Failed to close actuator client for {}", slot, ex);
    }
  }

  private String metricKey(String suffix) {
    return "actuator." + slot + "." + suffix;
  }

  private record Envelope(ActuatorPayload payload, long enqueuedAtMillis) {}
}
