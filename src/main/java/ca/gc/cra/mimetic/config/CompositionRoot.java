package ca.gc.cra.mimetic.config;

import ca.gc.cra.mimetic.application.pipeline.ActuatorDispatcher;
import ca.gc.cra.mimetic.application.pipeline.CorrelationBuffer;
import ca.gc.cra.mimetic.application.pipeline.DetectionDispatch;
import ca.gc.cra.mimetic.application.pipeline.LatestFrameSource;
import ca.gc.cra.mimetic.application.pipeline.MimicSession;
import ca.gc.cra.mimetic.application.pipeline.OutputSlotTable;
import ca.gc.cra.mimetic.application.pipeline.ResultFanIn;
import ca.gc.cra.mimetic.application.port.ActuatorClient;
import ca.gc.cra.mimetic.application.port.CameraDevice;
import ca.gc.cra.mimetic.application.port.ClockPort;
import ca.gc.cra.mimetic.application.port.LandmarkDetector;
import ca.gc.cra.mimetic.application.port.MetricsPort;
import ca.gc.cra.mimetic.application.port.PoseRecorder;
import ca.gc.cra.mimetic.domain.detect.DetectorKind;
import ca.gc.cra.mimetic.domain.detect.GazeClassifier;
import ca.gc.cra.mimetic.infrastructure.actuator.HttpActuatorClient;
import ca.gc.cra.mimetic.infrastructure.camera.ImageSequenceCameraDevice;
import ca.gc.cra.mimetic.infrastructure.camera.SyntheticCameraDevice;
import ca.gc.cra.mimetic.infrastructure.detect.HttpLandmarkDetector;
import ca.gc.cra.mimetic.infrastructure.detect.SyntheticLandmarkDetector;
import ca.gc.cra.mimetic.infrastructure.poselog.NdjsonPoseRecorder;
import ca.gc.cra.mimetic.validation.Net;
import ca.gc.cra.mimetic.validation.Paths;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires a {@link MimicConfig} into a runnable {@link MimicSession}.
 * <p><strong>Why:</strong> Keeps adapter selection (camera, detectors, actuators, pose log) in one place so the
 * pipeline classes only see ports.</p>
 * <p><strong>Thread-safety:</strong> Build on one thread during startup; the returned session owns every
 * component it was given.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  private static final int FANIN_CHANNEL_CAPACITY = 16;

  private final MimicConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private HttpClient httpClient;

  public CompositionRoot(MimicConfig config, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** @return camera device for {@link MimicConfig#source()} */
  public CameraDevice cameraDevice() {
    CameraSource source = config.source();
    return switch (source.kind()) {
      case SYNTHETIC -> new SyntheticCameraDevice(config.frameWidth(), config.frameHeight(), config.captureFps());
      case IMAGES -> new ImageSequenceCameraDevice(
          Paths.validateReadableDir(source.directory()),
          config.frameWidth(),
          config.frameHeight(),
          config.captureFps());
    };
  }

  /** @return one detector per {@link DetectorKind}, face first */
  public List<LandmarkDetector> detectors() {
    List<LandmarkDetector> detectors = new ArrayList<>(DetectorKind.values().length);
    for (DetectorKind kind : DetectorKind.values()) {
      detectors.add(detector(kind));
    }
    return detectors;
  }

  private LandmarkDetector detector(DetectorKind kind) {
    GazeClassifier gaze = new GazeClassifier(
        GazeClassifier.DEFAULT_ALPHA,
        config.gazeLeftThreshold(),
        config.gazeRightThreshold(),
        config.session().mirror());
    return switch (config.detector()) {
      case SYNTHETIC -> new SyntheticLandmarkDetector(kind, gaze, config.detectorQueue());
      case HTTP -> {
        URI endpoint = Net.httpUri(config.detectorEndpoint(), "/landmarks/" + kind.label());
        yield new HttpLandmarkDetector(
            kind,
            endpoint,
            httpClient(),
            config.detectorTimeout(),
            config.detectorWorkers(),
            config.detectorQueue(),
            gaze,
            metrics);
      }
    };
  }

  /**
   * Creates the HTTP client for one actuator slot.
   *
   * @param slot slot configuration
   * @return client posting to the slot's {@code /position} endpoint
   */
  public ActuatorClient actuatorClient(ActuatorSlotConfig slot) {
    return new HttpActuatorClient(slot.positionUri(), httpClient(), config.sendTimeout());
  }

  /**
   * Opens the pose log when configured.
   *
   * @return NDJSON recorder or {@link PoseRecorder#NO_OP}
   * @throws IOException when the log file cannot be opened
   */
  public PoseRecorder poseRecorder() throws IOException {
    if (config.poseLogPath().isEmpty()) {
      return PoseRecorder.NO_OP;
    }
    return new NdjsonPoseRecorder(Paths.validateWritableFile(config.poseLog(), true, true));
  }

  /** @return actuator slots registered from {@link MimicConfig#actuators()} */
  public OutputSlotTable outputSlots() {
    OutputSlotTable slots = new OutputSlotTable();
    for (ActuatorSlotConfig slot : config.actuators()) {
      ActuatorDispatcher dispatcher = new ActuatorDispatcher(
          slot.name(),
          actuatorClient(slot),
          config.sendQueueCapacity(),
          config.sendMinInterval(),
          clock,
          metrics);
      slots.register(dispatcher, slot.enabled());
    }
    if (config.enabledActuators().isEmpty()) {
      log.warn("No enabled actuator slots; payloads will be computed but not sent");
    }
    return slots;
  }

  /**
   * Builds a session wired to the configured adapters. Nothing is started.
   *
   * @return new session
   * @throws IOException when the pose log cannot be opened
   */
  public MimicSession buildSession() throws IOException {
    PoseRecorder recorder = poseRecorder();
    CorrelationBuffer buffer = new CorrelationBuffer(config.fusion(), clock, metrics);
    ResultFanIn fanIn = new ResultFanIn(buffer, FANIN_CHANNEL_CAPACITY, metrics);
    DetectionDispatch dispatch = new DetectionDispatch(
        detectors(), fanIn, DetectionDispatch.DEFAULT_QUEUE_CAPACITY, clock, metrics);
    LatestFrameSource frames = new LatestFrameSource(cameraDevice(), clock, metrics);
    log.info("Session wiring: source={}, detector={}, pairing={}, slots={}",
        config.source(), config.detector(), config.fusion().policy(), config.actuators().size());
    return new MimicSession(
        config.session(),
        frames,
        dispatch,
        fanIn,
        buffer,
        outputSlots(),
        recorder,
        clock,
        metrics);
  }

  private HttpClient httpClient() {
    if (httpClient == null) {
      httpClient = HttpClient.newBuilder()
          .connectTimeout(config.sendTimeout())
          .version(HttpClient.Version.HTTP_1_1)
          .build();
    }
    return httpClient;
  }
}
