package ca.gc.cra.mimetic.config;

import ca.gc.cra.mimetic.application.pipeline.ActuatorDispatcher;
import ca.gc.cra.mimetic.application.pipeline.CorrelationBuffer;
import ca.gc.cra.mimetic.application.pipeline.SessionSettings;
import ca.gc.cra.mimetic.domain.detect.GazeClassifier;
import ca.gc.cra.mimetic.domain.motion.Channel;
import ca.gc.cra.mimetic.domain.motion.MotionSmoother;
import ca.gc.cra.mimetic.infrastructure.actuator.HttpActuatorClient;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each CLI mode.
 *
 * <p>The defaults are the single source of truth for optional YAML keys; every key a mode understands
 * appears here with its default value.</p>
 */
public final class DefaultsForMode {
  /** Default actuator slot name. */
  public static final String DEFAULT_SLOT = "mimetic";
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode ({@code run} or {@code calibrate})
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "run" -> buildRunDefaults();
      case "calibrate" -> buildCalibrateDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    SessionSettings session = SessionSettings.defaults();
    CorrelationBuffer.Settings fusion = CorrelationBuffer.Settings.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    map.put("source", "synthetic");
    map.put("frameWidth", "640");
    map.put("frameHeight", "480");
    map.put("captureFps", "30");
    map.put("mirror", Boolean.toString(session.mirror()));
    map.put("detectWidth", Integer.toString(session.detectWidth()));
    map.put("detectHeight", Integer.toString(session.detectHeight()));
    map.put("detector", "synthetic");
    map.put("detectorEndpoint", "");
    map.put("detectorQueue", "2");
    map.put("detectorWorkers", "1");
    map.put("detectorTimeoutMs", "1000");
    map.put("gaze.leftThreshold", Double.toString(GazeClassifier.DEFAULT_LEFT_THRESHOLD));
    map.put("gaze.rightThreshold", Double.toString(GazeClassifier.DEFAULT_RIGHT_THRESHOLD));
    map.put("pairing", fusion.policy().name().toLowerCase(Locale.ROOT));
    map.put("ringCapacity", Integer.toString(fusion.capacity()));
    map.put("faceTimeoutMs", Long.toString(fusion.faceTimeout().toMillis()));
    map.put("poseTimeoutMs", Long.toString(fusion.poseTimeout().toMillis()));
    map.put("pairToleranceMs", Long.toString(fusion.pairTolerance().toMillis()));
    map.put("maxDelayMs", Long.toString(fusion.maxDelay().toMillis()));
    map.put("firstFrameTimeoutMs", Long.toString(session.firstFrameTimeout().toMillis()));
    map.put("calibrationMs", Long.toString(session.calibrationWindow().toMillis()));
    map.put("calibrationSamples", Integer.toString(session.calibrationSamples()));
    map.put("stopTimeoutMs", Long.toString(session.stopTimeout().toMillis()));
    map.put("actuator." + DEFAULT_SLOT + ".endpoint", "127.0.0.1:8000");
    map.put("actuator." + DEFAULT_SLOT + ".enabled", "true");
    map.put("sendQueueCapacity", Integer.toString(ActuatorDispatcher.DEFAULT_QUEUE_CAPACITY));
    map.put("sendMinIntervalMs", Long.toString(ActuatorDispatcher.DEFAULT_MIN_INTERVAL.toMillis()));
    map.put("sendTimeoutMs", Long.toString(HttpActuatorClient.DEFAULT_TIMEOUT.toMillis()));
    map.put("dryRun", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildRunDefaults() {
    SessionSettings session = SessionSettings.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("targetFps", Integer.toString(session.targetFps()));
    for (Channel channel : Channel.values()) {
      map.put("alpha." + channel.key(), Double.toString(channel.defaultAlpha()));
    }
    map.put("sendRate", Double.toString(MotionSmoother.DEFAULT_RATE_HZ));
    map.put("threshold", Double.toString(MotionSmoother.DEFAULT_THRESHOLD));
    map.put("minDurationMs", Integer.toString(MotionSmoother.DEFAULT_MIN_DURATION_MS));
    map.put("maxDurationMs", Integer.toString(MotionSmoother.DEFAULT_MAX_DURATION_MS));
    map.put("calibrate", "false");
    map.put("poseLog", "");
    map.put("runForMs", "0");
    return map;
  }

  private static Map<String, String> buildCalibrateDefaults() {
    return new LinkedHashMap<>();
  }
}
