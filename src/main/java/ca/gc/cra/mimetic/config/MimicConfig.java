package ca.gc.cra.mimetic.config;

import ca.gc.cra.mimetic.application.pipeline.ActuatorDispatcher;
import ca.gc.cra.mimetic.application.pipeline.CorrelationBuffer;
import ca.gc.cra.mimetic.application.pipeline.PairingPolicy;
import ca.gc.cra.mimetic.application.pipeline.SessionSettings;
import ca.gc.cra.mimetic.domain.detect.GazeClassifier;
import ca.gc.cra.mimetic.domain.motion.Channel;
import ca.gc.cra.mimetic.domain.motion.MotionSmoother;
import ca.gc.cra.mimetic.infrastructure.actuator.HttpActuatorClient;
import ca.gc.cra.mimetic.validation.Net;
import ca.gc.cra.mimetic.validation.Numbers;
import ca.gc.cra.mimetic.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Validated configuration for a MIMETIC session.
 *
 * @param source camera source
 * @param frameWidth capture width for generated or replayed frames
 * @param frameHeight capture height for generated or replayed frames
 * @param captureFps camera rate
 * @param detector detector backend
 * @param detectorEndpoint landmark service {@code host:port}; {@code null} for synthetic detection
 * @param detectorQueue frames each detector may hold before rejecting new ones
 * @param detectorWorkers concurrent requests per HTTP detector
 * @param detectorTimeout per-request landmark service timeout
 * @param gazeLeftThreshold smoothed gaze ratio below which the label is LEFT
 * @param gazeRightThreshold smoothed gaze ratio above which the label is RIGHT
 * @param fusion correlation buffer tuning
 * @param session control loop tuning
 * @param actuators actuator slots, ordered by name
 * @param sendQueueCapacity per-slot payload queue capacity
 * @param sendMinInterval spacing between successful posts per slot
 * @param sendTimeout actuator request timeout
 * @param calibrate run calibration before the control loop
 * @param poseLog NDJSON pose log file; {@code null} disables logging
 * @param runFor stop automatically after this long; {@link Duration#ZERO} runs until interrupted
 * @since 0.1.0
 */
public record MimicConfig(
    CameraSource source,
    int frameWidth,
    int frameHeight,
    int captureFps,
    DetectorMode detector,
    String detectorEndpoint,
    int detectorQueue,
    int detectorWorkers,
    Duration detectorTimeout,
    double gazeLeftThreshold,
    double gazeRightThreshold,
    CorrelationBuffer.Settings fusion,
    SessionSettings session,
    List<ActuatorSlotConfig> actuators,
    int sendQueueCapacity,
    Duration sendMinInterval,
    Duration sendTimeout,
    boolean calibrate,
    Path poseLog,
    Duration runFor) {

  private static final String ACTUATOR_PREFIX = "actuator.";
  private static final int MAX_FRAME_DIMENSION = 4_096;
  private static final int MAX_FPS = 240;
  private static final int MAX_QUEUE = 4_096;
  private static final int MAX_WORKERS = 32;
  private static final long MAX_WINDOW_MILLIS = 60_000L;

  public MimicConfig {
    Objects.requireNonNull(source, "source");
    Numbers.requireRange("frameWidth", frameWidth, 1, MAX_FRAME_DIMENSION);
    Numbers.requireRange("frameHeight", frameHeight, 1, MAX_FRAME_DIMENSION);
    Numbers.requireRange("captureFps", captureFps, 1, MAX_FPS);
    Objects.requireNonNull(detector, "detector");
    if (detector == DetectorMode.HTTP) {
      detectorEndpoint = Net.validateHostPort(detectorEndpoint);
    } else if (detectorEndpoint != null && detectorEndpoint.isBlank()) {
      detectorEndpoint = null;
    }
    Numbers.requireRange("detectorQueue", detectorQueue, 1, MAX_QUEUE);
    Numbers.requireRange("detectorWorkers", detectorWorkers, 1, MAX_WORKERS);
    Objects.requireNonNull(detectorTimeout, "detectorTimeout");
    Numbers.requireRange("gaze.leftThreshold", gazeLeftThreshold, 0.0, 1.0);
    Numbers.requireRange("gaze.rightThreshold", gazeRightThreshold, gazeLeftThreshold, 1.0);
    Objects.requireNonNull(fusion, "fusion");
    Objects.requireNonNull(session, "session");
    actuators = List.copyOf(Objects.requireNonNull(actuators, "actuators"));
    Numbers.requireRange("sendQueueCapacity", sendQueueCapacity, 1, MAX_QUEUE);
    Objects.requireNonNull(sendMinInterval, "sendMinInterval");
    Objects.requireNonNull(sendTimeout, "sendTimeout");
    runFor = Objects.requireNonNullElse(runFor, Duration.ZERO);
    if (runFor.isNegative()) {
      throw new IllegalArgumentException("runForMs must not be negative");
    }
  }

  /** @return configuration built from {@link DefaultsForMode} for {@code run} */
  public static MimicConfig defaults() {
    return fromMap(DefaultsForMode.asFlatMap("run"));
  }

  /**
   * Parses a flat {@code key=value} map. Keys absent from the map fall back to built-in defaults.
   *
   * @param args merged configuration; may be {@code null}
   * @return validated configuration
   * @throws IllegalArgumentException when a value is missing or invalid
   */
  public static MimicConfig fromMap(Map<String, String> args) {
    Map<String, String> kv = args == null ? Map.of() : new HashMap<>(args);
    SessionSettings sessionDefaults = SessionSettings.defaults();
    CorrelationBuffer.Settings fusionDefaults = CorrelationBuffer.Settings.defaults();

    CameraSource source = CameraSource.parse(kv.get("source"));
    int frameWidth = parseBoundedInt(kv, "frameWidth", 640, 1, MAX_FRAME_DIMENSION);
    int frameHeight = parseBoundedInt(kv, "frameHeight", 480, 1, MAX_FRAME_DIMENSION);
    int captureFps = parseBoundedInt(kv, "captureFps", 30, 1, MAX_FPS);

    DetectorMode detector = DetectorMode.fromString(kv.getOrDefault("detector", "synthetic"));
    String detectorEndpoint = blankToNull(kv.get("detectorEndpoint"));
    if (detector == DetectorMode.HTTP && detectorEndpoint == null) {
      throw new IllegalArgumentException("detectorEndpoint is required when detector=http");
    }
    int detectorQueue = parseBoundedInt(kv, "detectorQueue", 2, 1, MAX_QUEUE);
    int detectorWorkers = parseBoundedInt(kv, "detectorWorkers", 1, 1, MAX_WORKERS);
    Duration detectorTimeout = parseMillis(kv, "detectorTimeoutMs", 1_000, 1, MAX_WINDOW_MILLIS);
    double gazeLeft = parseDouble(kv, "gaze.leftThreshold", GazeClassifier.DEFAULT_LEFT_THRESHOLD, 0.0, 1.0);
    double gazeRight = parseDouble(kv, "gaze.rightThreshold", GazeClassifier.DEFAULT_RIGHT_THRESHOLD, 0.0, 1.0);

    CorrelationBuffer.Settings fusion = new CorrelationBuffer.Settings(
        PairingPolicy.fromString(kv.getOrDefault("pairing", fusionDefaults.policy().name())),
        parseBoundedInt(kv, "ringCapacity", fusionDefaults.capacity(), 1, MAX_QUEUE),
        parseMillis(kv, "faceTimeoutMs", fusionDefaults.faceTimeout().toMillis(), 0, MAX_WINDOW_MILLIS),
        parseMillis(kv, "poseTimeoutMs", fusionDefaults.poseTimeout().toMillis(), 0, MAX_WINDOW_MILLIS),
        parseMillis(kv, "pairToleranceMs", fusionDefaults.pairTolerance().toMillis(), 0, MAX_WINDOW_MILLIS),
        parseMillis(kv, "maxDelayMs", fusionDefaults.maxDelay().toMillis(), 0, MAX_WINDOW_MILLIS));

    Map<Channel, Double> alphas = new EnumMap<>(Channel.class);
    for (Channel channel : Channel.values()) {
      alphas.put(channel, parseDouble(kv, "alpha." + channel.key(), channel.defaultAlpha(), 0.0, 1.0));
    }
    MotionSmoother.Settings smoothing = new MotionSmoother.Settings(
        alphas,
        parseDouble(kv, "sendRate", MotionSmoother.DEFAULT_RATE_HZ, 0.1, 1_000.0),
        parseDouble(kv, "threshold", MotionSmoother.DEFAULT_THRESHOLD, 0.0, 1_000.0),
        parseBoundedInt(kv, "minDurationMs", MotionSmoother.DEFAULT_MIN_DURATION_MS, 1, 60_000),
        parseBoundedInt(kv, "maxDurationMs", MotionSmoother.DEFAULT_MAX_DURATION_MS, 1, 60_000));

    SessionSettings session = new SessionSettings(
        parseBoundedInt(kv, "detectWidth", sessionDefaults.detectWidth(), 1, MAX_FRAME_DIMENSION),
        parseBoundedInt(kv, "detectHeight", sessionDefaults.detectHeight(), 1, MAX_FRAME_DIMENSION),
        parseBoolean(kv.get("mirror"), sessionDefaults.mirror()),
        parseBoundedInt(kv, "targetFps", sessionDefaults.targetFps(), 1, MAX_FPS),
        parseMillis(kv, "firstFrameTimeoutMs", sessionDefaults.firstFrameTimeout().toMillis(), 1, MAX_WINDOW_MILLIS),
        parseMillis(kv, "calibrationMs", sessionDefaults.calibrationWindow().toMillis(), 1, MAX_WINDOW_MILLIS),
        parseBoundedInt(kv, "calibrationSamples", sessionDefaults.calibrationSamples(), 1, 10_000),
        parseMillis(kv, "stopTimeoutMs", sessionDefaults.stopTimeout().toMillis(), 1, MAX_WINDOW_MILLIS),
        smoothing);

    List<ActuatorSlotConfig> actuators = parseActuators(kv);
    int sendQueueCapacity = parseBoundedInt(
        kv, "sendQueueCapacity", ActuatorDispatcher.DEFAULT_QUEUE_CAPACITY, 1, MAX_QUEUE);
    Duration sendMinInterval = parseMillis(
        kv, "sendMinIntervalMs", ActuatorDispatcher.DEFAULT_MIN_INTERVAL.toMillis(), 0, MAX_WINDOW_MILLIS);
    Duration sendTimeout = parseMillis(
        kv, "sendTimeoutMs", HttpActuatorClient.DEFAULT_TIMEOUT.toMillis(), 1, MAX_WINDOW_MILLIS);

    boolean calibrate = parseBoolean(kv.get("calibrate"), false);
    Path poseLog = parseOptionalPath("poseLog", kv.get("poseLog")).orElse(null);
    Duration runFor = parseMillis(kv, "runForMs", 0, 0, Long.MAX_VALUE / 2);

    return new MimicConfig(
        source,
        frameWidth,
        frameHeight,
        captureFps,
        detector,
        detectorEndpoint,
        detectorQueue,
        detectorWorkers,
        detectorTimeout,
        gazeLeft,
        gazeRight,
        fusion,
        session,
        actuators,
        sendQueueCapacity,
        sendMinInterval,
        sendTimeout,
        calibrate,
        poseLog,
        runFor);
  }

  /** @return pose log path when enabled */
  public Optional<Path> poseLogPath() {
    return Optional.ofNullable(poseLog);
  }

  /** @return slots whose {@code enabled} flag is set */
  public List<ActuatorSlotConfig> enabledActuators() {
    return actuators.stream().filter(ActuatorSlotConfig::enabled).toList();
  }

  private static List<ActuatorSlotConfig> parseActuators(Map<String, String> kv) {
    Map<String, String> endpoints = new TreeMap<>();
    Map<String, String> enabled = new TreeMap<>();
    for (Map.Entry<String, String> entry : kv.entrySet()) {
      String key = entry.getKey();
      if (key == null || !key.startsWith(ACTUATOR_PREFIX)) {
        continue;
      }
      String rest = key.substring(ACTUATOR_PREFIX.length());
      int dot = rest.lastIndexOf('.');
      if (dot <= 0) {
        throw new IllegalArgumentException("actuator keys must be actuator.<name>.endpoint|enabled (was " + key + ")");
      }
      String name = Strings.requireIdentifier("actuator name", rest.substring(0, dot));
      switch (rest.substring(dot + 1)) {
        case "endpoint" -> endpoints.put(name, entry.getValue());
        case "enabled" -> enabled.put(name, entry.getValue());
        default -> throw new IllegalArgumentException("unknown actuator setting: " + key);
      }
    }
    for (String name : enabled.keySet()) {
      if (!endpoints.containsKey(name)) {
        throw new IllegalArgumentException("actuator." + name + ".endpoint is required");
      }
    }
    List<ActuatorSlotConfig> slots = new ArrayList<>();
    for (Map.Entry<String, String> entry : endpoints.entrySet()) {
      String endpoint = blankToNull(entry.getValue());
      if (endpoint == null) {
        // A blank endpoint removes a slot inherited from defaults or YAML.
        continue;
      }
      slots.add(new ActuatorSlotConfig(entry.getKey(), endpoint, parseBoolean(enabled.get(entry.getKey()), true)));
    }
    return slots;
  }

  private static int parseBoundedInt(Map<String, String> kv, String key, int defaultValue, int min, int max) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      Numbers.requireRange(key, defaultValue, min, max);
      return defaultValue;
    }
    try {
      int parsed = Integer.parseInt(raw.trim());
      Numbers.requireRange(key, parsed, min, max);
      return parsed;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer between " + min + " and " + max, ex);
    }
  }

  private static Duration parseMillis(Map<String, String> kv, String key, long defaultValue, long min, long max) {
    String raw = kv.get(key);
    long value = raw == null || raw.isBlank() ? defaultValue : Numbers.parseLong(key, raw);
    return Duration.ofMillis(Numbers.requireRange(key, value, min, max));
  }

  private static double parseDouble(Map<String, String> kv, String key, double defaultValue, double min, double max) {
    String raw = kv.get(key);
    double value = raw == null || raw.isBlank() ? defaultValue : Numbers.parseDouble(key, raw);
    return Numbers.requireRange(key, value, min, max);
  }

  private static boolean parseBoolean(String value, boolean fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    return Boolean.parseBoolean(value.trim());
  }

  private static Optional<Path> parseOptionalPath(String name, String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Path.of(value.trim()).toAbsolutePath().normalize());
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
