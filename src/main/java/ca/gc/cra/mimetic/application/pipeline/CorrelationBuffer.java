package ca.gc.cra.mimetic.application.pipeline;

import ca.gc.cra.mimetic.application.port.ClockPort;
import ca.gc.cra.mimetic.application.port.MetricsPort;
import ca.gc.cra.mimetic.domain.detect.DetectionResult;
import ca.gc.cra.mimetic.domain.detect.DetectorKind;
import ca.gc.cra.mimetic.domain.detect.Gaze;
import ca.gc.cra.mimetic.domain.detect.LandmarkReadings;
import ca.gc.cra.mimetic.domain.motion.FusedPoseSample;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reconciles independently arriving face and pose results into {@link FusedPoseSample}s.
 *
 * <p>One lock guards both the pending state and the ring of published samples; it is held only for
 * constant-time work and never across detector or network calls. Published timestamps are strictly
 * increasing: a non-increasing timestamp is bumped to {@code last + 1} before storage. The ring keeps
 * the most recent {@code capacity} samples and evicts the oldest first.</p>
 *
 * <p>Field ownership when fusing: angles and gaze come from the face result, height from the pose
 * result. Anything the contributing results do not carry stays {@link Double#NaN}.</p>
 *
 * <p>Under {@link PairingPolicy#LATEST} a result whose validity window has already closed when it
 * arrives is neither stored nor published.</p>
 *
 * <p>Metrics: {@code fusion.samples.published}, {@code fusion.pending.evicted},
 * {@code fusion.timestamp.bumped}, {@code fusion.result.stale}.</p>
 */
public final class CorrelationBuffer {
  private static final Logger log = LoggerFactory.getLogger(CorrelationBuffer.class);

  private final Settings settings;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Object lock = new Object();
  private final ArrayDeque<FusedPoseSample> ring;
  private final Map<DetectorKind, Latest> latestByKind = new EnumMap<>(DetectorKind.class);
  private final NavigableMap<Long, Pending> pending = new TreeMap<>();
  private long lastTimestamp = Long.MIN_VALUE;
  private long lastPublishedAt = Long.MIN_VALUE;

  public CorrelationBuffer(Settings settings, ClockPort clock, MetricsPort metrics) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.ring = new ArrayDeque<>(settings.capacity());
  }

  /**
   * Stores a detector result and publishes a fused sample when the pairing policy allows.
   *
   * @param kind detector family of {@code result}
   * @param result detector output
   * @param timestamp frame timestamp the result belongs to
   * @throws IllegalArgumentException when {@code kind} disagrees with the result's own kind
   */
  public void add(DetectorKind kind, DetectionResult result, long timestamp) {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(result, "result");
    if (result.kind() != kind) {
      throw new IllegalArgumentException("result kind " + result.kind() + " does not match " + kind);
    }
    long now = clock.nowMillis();
    synchronized (lock) {
      if (settings.policy() == PairingPolicy.STRICT) {
        addStrict(kind, result, timestamp, now);
      } else {
        addLatest(kind, result, timestamp, now);
      }
    }
  }

  /** @return most recent fused sample, or empty when none has been published */
  public Optional<FusedPoseSample> latest() {
    synchronized (lock) {
      return Optional.ofNullable(ring.peekLast());
    }
  }

  /**
   * Reports whether a sample was published recently.
   *
   * @param maxAge freshness window
   * @return {@code true} iff a fused sample was published less than {@code maxAge} ago
   */
  public boolean isFresh(Duration maxAge) {
    long now = clock.nowMillis();
    synchronized (lock) {
      return lastPublishedAt != Long.MIN_VALUE && now - lastPublishedAt < maxAge.toMillis();
    }
  }

  /** @return copy of the ring, oldest first */
  public List<FusedPoseSample> snapshot() {
    synchronized (lock) {
      return List.copyOf(ring);
    }
  }

  /** @return number of results waiting for a partner (strict pairing only) */
  public int pendingCount() {
    synchronized (lock) {
      return pending.size();
    }
  }

  /** Drops pending entries, per-kind state and the ring. Timestamp ordering is preserved. */
  public void clear() {
    synchronized (lock) {
      ring.clear();
      pending.clear();
      latestByKind.clear();
      lastPublishedAt = Long.MIN_VALUE;
    }
  }

  private void addLatest(DetectorKind kind, DetectionResult result, long timestamp, long now) {
    long validUntil = timestamp + settings.timeout(kind).toMillis();
    if (validUntil < now) {
      metrics.increment("fusion.result.stale");
      log.debug("Ignoring stale {} result (validUntil={}, now={})", kind.label(), validUntil, now);
      return;
    }
    latestByKind.put(kind, new Latest(result, validUntil));
    Latest other = latestByKind.get(kind.other());
    DetectionResult partner = null;
    if (other != null) {
      if (other.validUntil() >= now) {
        partner = other.result();
      } else {
        latestByKind.remove(kind.other());
        log.debug("Dropping stale {} result (validUntil={}, now={})", kind.other().label(), other.validUntil(), now);
      }
    }
    DetectionResult face = kind == DetectorKind.FACE ? result : partner;
    DetectionResult pose = kind == DetectorKind.POSE ? result : partner;
    publish(fuse(timestamp, face, pose), now);
  }

  private void addStrict(DetectorKind kind, DetectionResult result, long timestamp, long now) {
    evictExpired(now);
    long tolerance = settings.pairTolerance().toMillis();
    Map.Entry<Long, Pending> match = null;
    for (Map.Entry<Long, Pending> entry
        : pending.subMap(timestamp - tolerance, true, timestamp + tolerance, true).entrySet()) {
      Pending candidate = entry.getValue();
      if (candidate.get(kind) == null && candidate.get(kind.other()) != null
          && (match == null
              || Math.abs(entry.getKey() - timestamp) < Math.abs(match.getKey() - timestamp))) {
        match = entry;
      }
    }
    if (match != null) {
      pending.remove(match.getKey());
      DetectionResult partner = match.getValue().get(kind.other());
      DetectionResult face = kind == DetectorKind.FACE ? result : partner;
      DetectionResult pose = kind == DetectorKind.POSE ? result : partner;
      publish(fuse(Math.max(timestamp, match.getKey()), face, pose), now);
      return;
    }
    pending.computeIfAbsent(timestamp, ts -> new Pending()).put(kind, result);
    while (pending.size() > settings.capacity() * 4) {
      pending.pollFirstEntry();
      metrics.increment("fusion.pending.evicted");
    }
  }

  private void evictExpired(long now) {
    long maxDelay = settings.maxDelay().toMillis();
    Iterator<Map.Entry<Long, Pending>> it = pending.entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<Long, Pending> entry = it.next();
      if (now - entry.getKey() <= maxDelay) {
        break;
      }
      it.remove();
      metrics.increment("fusion.pending.evicted");
    }
  }

  private void publish(FusedPoseSample sample, long now) {
    long ts = sample.timestampMillis();
    if (lastTimestamp != Long.MIN_VALUE && ts <= lastTimestamp) {
      ts = lastTimestamp + 1;
      metrics.increment("fusion.timestamp.bumped");
    }
    lastTimestamp = ts;
    if (ring.size() == settings.capacity()) {
      ring.pollFirst();
    }
    ring.addLast(ts == sample.timestampMillis() ? sample : sample.withTimestamp(ts));
    lastPublishedAt = now;
    metrics.increment("fusion.samples.published");
  }

  private static FusedPoseSample fuse(long timestamp, DetectionResult face, DetectionResult pose) {
    LandmarkReadings faceReadings = face == null ? LandmarkReadings.EMPTY : face.readings();
    LandmarkReadings poseReadings = pose == null ? LandmarkReadings.EMPTY : pose.readings();
    Gaze gaze = faceReadings.gaze().orElse(null);
    return new FusedPoseSample(
        timestamp,
        faceReadings.pitch().orElse(Double.NaN),
        faceReadings.roll().orElse(Double.NaN),
        faceReadings.yaw().orElse(Double.NaN),
        poseReadings.height().orElse(Double.NaN),
        gaze);
  }

  private record Latest(DetectionResult result, long validUntil) {}

  private static final class Pending {
    private final EnumMap<DetectorKind, DetectionResult> results = new EnumMap<>(DetectorKind.class);

    DetectionResult get(DetectorKind kind) {
      return results.get(kind);
    }

    void put(DetectorKind kind, DetectionResult result) {
      results.put(kind, result);
    }
  }

  /**
   * Buffer tuning.
   *
   * @param policy pairing policy
   * @param capacity fused ring capacity
   * @param faceTimeout validity of a face result under {@link PairingPolicy#LATEST}
   * @param poseTimeout validity of a pose result under {@link PairingPolicy#LATEST}
   * @param pairTolerance timestamp window for {@link PairingPolicy#STRICT} matches
   * @param maxDelay age after which unmatched {@link PairingPolicy#STRICT} entries are discarded
   */
  public record Settings(
      PairingPolicy policy,
      int capacity,
      Duration faceTimeout,
      Duration poseTimeout,
      Duration pairTolerance,
      Duration maxDelay) {
    public Settings {
      Objects.requireNonNull(policy, "policy");
      if (capacity <= 0) {
        throw new IllegalArgumentException("capacity must be positive (was " + capacity + ")");
      }
      requireNonNegative("faceTimeout", faceTimeout);
      requireNonNegative("poseTimeout", poseTimeout);
      requireNonNegative("pairTolerance", pairTolerance);
      requireNonNegative("maxDelay", maxDelay);
    }

    /** @return independent-latest fusion, ring of 30, 200 ms windows, exact-match strict tolerance */
    public static Settings defaults() {
      return new Settings(
          PairingPolicy.LATEST,
          30,
          Duration.ofMillis(200),
          Duration.ofMillis(200),
          Duration.ZERO,
          Duration.ofMillis(200));
    }

    Duration timeout(DetectorKind kind) {
      return kind == DetectorKind.FACE ? faceTimeout : poseTimeout;
    }

    private static void requireNonNegative(String name, Duration value) {
      Objects.requireNonNull(value, name);
      if (value.isNegative()) {
        throw new IllegalArgumentException(name + " must not be negative");
      }
    }
  }

  @Override
  public String toString() {
    List<Long> timestamps = new ArrayList<>();
    synchronized (lock) {
      ring.forEach(sample -> timestamps.add(sample.timestampMillis()));
    }
    return "CorrelationBuffer[policy=" + settings.policy() + ", ring=" + timestamps + "]";
  }
}
