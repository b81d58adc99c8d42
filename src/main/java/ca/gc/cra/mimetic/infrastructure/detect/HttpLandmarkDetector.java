package ca.gc.cra.mimetic.infrastructure.detect;

import ca.gc.cra.mimetic.application.port.DetectionCallback;
import ca.gc.cra.mimetic.application.port.LandmarkDetector;
import ca.gc.cra.mimetic.application.port.MetricsPort;
import ca.gc.cra.mimetic.domain.detect.DetectionResult;
import ca.gc.cra.mimetic.domain.detect.DetectorKind;
import ca.gc.cra.mimetic.domain.detect.GazeClassifier;
import ca.gc.cra.mimetic.domain.detect.LandmarkReadings;
import ca.gc.cra.mimetic.domain.frame.Frame;
import ca.gc.cra.mimetic.infrastructure.camera.FrameImages;
import ca.gc.cra.mimetic.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.mimetic.logging.Logs;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link LandmarkDetector} backed by a remote landmark service.
 *
 * <p>Each frame is JPEG-encoded and posted to {@code <endpoint>} on a bounded worker pool; a saturated
 * pool rejects the frame. A successful reply is delivered to the callback exactly once. Transport or
 * parse failures are logged, counted under {@code detect.<kind>.error}, and produce no callback.</p>
 *
 * <p>Face replies carry a raw gaze ratio that is smoothed and labelled by a {@link GazeClassifier}.</p>
 */
public final class HttpLandmarkDetector implements LandmarkDetector {
  private static final Logger log = LoggerFactory.getLogger(HttpLandmarkDetector.class);
  private static final int ERROR_BODY_LIMIT = 256;
  private static final int ERROR_LOG_EVERY = 100;

  private final DetectorKind kind;
  private final URI endpoint;
  private final HttpClient client;
  private final Duration timeout;
  private final GazeClassifier gaze;
  private final MetricsPort metrics;
  private final ExecutorService pool;
  private final LandmarkReplyParser parser = new LandmarkReplyParser();
  private final AtomicLong failures = new AtomicLong();

  /**
   * Creates a detector.
   *
   * @param kind detector family
   * @param endpoint full service URI, e.g. {@code http://127.0.0.1:8700/landmarks/face}
   * @param client shared HTTP client
   * @param timeout per-request timeout
   * @param workers concurrent requests
   * @param queueCapacity frames waiting for a worker before new ones are rejected
   * @param gaze gaze classifier for face replies; ignored for pose
   * @param metrics metrics sink
   */
  public HttpLandmarkDetector(
      DetectorKind kind,
      URI endpoint,
      HttpClient client,
      Duration timeout,
      int workers,
      int queueCapacity,
      GazeClassifier gaze,
      MetricsPort metrics) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.client = Objects.requireNonNull(client, "client");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    this.gaze = kind == DetectorKind.FACE ? gaze : null;
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.pool = ExecutorFactories.newBoundedPool(
        workers, queueCapacity, "mimetic-detect-" + kind.label(),
        (t, ex) -> log.error("{} detector worker {} failed", kind.label(), t.getName(), ex));
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
      pool.execute(() -> detect(frame, timestampMillis, callback));
      return true;
    } catch (RejectedExecutionException ex) {
      return false;
    }
  }

  private void detect(Frame frame, long timestampMillis, DetectionCallback callback) {
    long started = System.nanoTime();
    LandmarkReadings readings;
    try {
      HttpRequest request = HttpRequest.newBuilder(endpoint)
          .timeout(timeout)
          .header("Content-Type", "image/jpeg")
          .POST(HttpRequest.BodyPublishers.ofByteArray(FrameImages.toJpeg(frame)))
          .build();
      HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
      if (response.statusCode() / 100 != 2) {
        throw new IOException("HTTP " + response.statusCode() + ": "
            + Logs.truncate(new String(response.body(), StandardCharsets.UTF_8), ERROR_BODY_LIMIT));
      }
      readings = parser.parse(kind, response.body(), gaze);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return;
    } catch (IOException | RuntimeException ex) {
      metrics.increment("detect." + kind.label() + ".error");
      long total = failures.incrementAndGet();
      if (total == 1 || total % ERROR_LOG_EVERY == 0) {
        log.warn("{} detection via {} failed ({} total): {}", kind.label(), endpoint, total, ex.getMessage());
      }
      return;
    }
    metrics.observe("detect." + kind.label() + ".latencyNanos", System.nanoTime() - started);
    callback.onResult(new DetectionResult(kind, timestampMillis, readings));
  }

  @Override
  public void close() {
    pool.shutdownNow();
    try {
      if (!pool.awaitTermination(timeout.toMillis() + 500, TimeUnit.MILLISECONDS)) {
        log.error("{} detector pool did not terminate", kind.label());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  @Override
  public String toString() {
    return "HttpLandmarkDetector[" + kind.label() + " -> " + endpoint + "]";
  }
}
