package ca.gc.cra.mimetic.application.pipeline;

import ca.gc.cra.mimetic.application.port.ClockPort;
import ca.gc.cra.mimetic.application.port.FrameSource;
import ca.gc.cra.mimetic.application.port.MetricsPort;
import ca.gc.cra.mimetic.application.port.PipelineComponent;
import ca.gc.cra.mimetic.application.port.PoseRecorder;
import ca.gc.cra.mimetic.domain.frame.Frame;
import ca.gc.cra.mimetic.domain.frame.FrameOptions;
import ca.gc.cra.mimetic.domain.motion.ActuatorPayload;
import ca.gc.cra.mimetic.domain.motion.AngleOffset;
import ca.gc.cra.mimetic.domain.motion.Channel;
import ca.gc.cra.mimetic.domain.motion.EmitDecision;
import ca.gc.cra.mimetic.domain.motion.FusedPoseSample;
import ca.gc.cra.mimetic.domain.motion.MotionSmoother;
import ca.gc.cra.mimetic.domain.motion.PoseRecord;
import java.io.IOException;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the pipeline components and runs the control loop.
 *
 * <p>Lifecycle: {@link #initialize()}, optionally {@link #calibrate()}, {@link #start()}, then
 * {@link #stop()}. Each loop iteration reads the newest downsized frame, submits it for detection,
 * takes the newest fused sample, and (when the sample is new and complete) corrects, clamps and
 * smooths it. Payloads go to every enabled actuator slot only when the smoother's gate opens.</p>
 *
 * <p>The loop never blocks on detectors or actuators. A failure inside one iteration is logged and
 * counted; the loop continues. {@link #stop()} bounds every join by {@code stopTimeout}.</p>
 *
 * <p>Metrics: {@code session.samples.processed}, {@code session.sample.incomplete},
 * {@code session.payloads.emitted}, {@code session.loop.overrun}, {@code session.loop.error},
 * {@code session.loop.latencyNanos}, {@code session.poselog.error}.</p>
 */
public final class MimicSession {
  private static final Logger log = LoggerFactory.getLogger(MimicSession.class);
  /** Corrected angles are clamped to this magnitude before smoothing. */
  public static final double ANGLE_LIMIT_DEGREES = 30.0;
  private static final long IDLE_SLEEP_MILLIS = 10L;
  private static final List<Channel> GATED_CHANNELS =
      List.of(Channel.PITCH, Channel.ROLL, Channel.YAW, Channel.HEIGHT);

  private final SessionSettings settings;
  private final FrameSource frames;
  private final DetectionDispatch dispatch;
  private final ResultFanIn fanIn;
  private final CorrelationBuffer buffer;
  private final OutputSlotTable slots;
  private final PoseRecorder recorder;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final MotionSmoother smoother;
  private final ControlLoop loop;
  private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.IDLE);
  private final CountDownLatch stopped = new CountDownLatch(1);

  private volatile FrameOptions detectOptions = FrameOptions.NATIVE;
  private volatile AngleOffset offset = AngleOffset.ZERO;
  private volatile double fps;
  private long lastSubmittedCapture = Long.MIN_VALUE;
  private long lastProcessedTimestamp = Long.MIN_VALUE;
  private boolean recorderFailed;

  public MimicSession(
      SessionSettings settings,
      FrameSource frames,
      DetectionDispatch dispatch,
      ResultFanIn fanIn,
      CorrelationBuffer buffer,
      OutputSlotTable slots,
      PoseRecorder recorder,
      ClockPort clock,
      MetricsPort metrics) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.frames = Objects.requireNonNull(frames, "frames");
    this.dispatch = Objects.requireNonNull(dispatch, "dispatch");
    this.fanIn = Objects.requireNonNull(fanIn, "fanIn");
    this.buffer = Objects.requireNonNull(buffer, "buffer");
    this.slots = Objects.requireNonNull(slots, "slots");
    this.recorder = Objects.requireNonNullElse(recorder, PoseRecorder.NO_OP);
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.smoother = new MotionSmoother(settings.smoothing(), clock.nowMillis());
    this.loop = new ControlLoop(this.metrics);
  }

  public SessionState state() {
    return state.get();
  }

  /** @return offset subtracted from raw angles; {@link AngleOffset#ZERO} until calibrated */
  public AngleOffset offset() {
    return offset;
  }

  /** @return options used when fetching frames for detection; set by {@link #initialize()} */
  public FrameOptions detectOptions() {
    return detectOptions;
  }

  /** @return control loop rate measured over the last iteration */
  public double fps() {
    return fps;
  }

  /**
   * Starts capture, waits for the first frame, then starts detection, fan-in and actuator slots.
   *
   * @throws InitializationException when the camera fails to open or yields no frame in time
   * @throws InterruptedException if interrupted while waiting for the first frame
   */
  public void initialize() throws InitializationException, InterruptedException {
    transition(SessionState.IDLE, SessionState.INITIALIZING);
    try {
      frames.start();
    } catch (RuntimeException ex) {
      stop();
      throw new InitializationException("Camera failed to start: " + ex.getMessage(), ex);
    }
    Frame first = awaitFirstFrame();
    if (first == null) {
      stop();
      throw new InitializationException(
          "No camera frame within " + settings.firstFrameTimeout().toMillis() + " ms");
    }
    log.info("Camera resolution {}x{}", first.width(), first.height());
    detectOptions = new FrameOptions(
        Math.min(settings.detectWidth(), first.width()),
        Math.min(settings.detectHeight(), first.height()),
        settings.mirror());
    try {
      fanIn.start();
      dispatch.start();
      slots.startAll();
    } catch (RuntimeException ex) {
      stop();
      throw new InitializationException("Pipeline failed to start: " + ex.getMessage(), ex);
    }
    log.info("Pipeline ready: detect frames {}x{}, {} actuator slot(s), {} enabled",
        detectOptions.width(), detectOptions.height(), slots.names().size(), slots.enabledCount());
  }

  private Frame awaitFirstFrame() throws InterruptedException {
    long deadline = clock.nowMillis() + settings.firstFrameTimeout().toMillis();
    while (true) {
      Optional<Frame> frame = frames.latest(FrameOptions.NATIVE);
      if (frame.isPresent()) {
        return frame.get();
      }
      if (clock.nowMillis() >= deadline) {
        return null;
      }
      TimeUnit.MILLISECONDS.sleep(IDLE_SLEEP_MILLIS);
    }
  }

  /**
   * Measures the resting head orientation.
   *
   * <p>Blocks for at most {@code calibrationWindow}, or until {@code calibrationSamples} distinct
   * fused samples carrying all three angles were collected. The mean becomes the session offset.</p>
   *
   * @return measured offset
   * @throws InitializationException when no usable sample arrived
   * @throws InterruptedException if interrupted while sampling
   */
  public AngleOffset calibrate() throws InitializationException, InterruptedException {
    transition(SessionState.INITIALIZING, SessionState.CALIBRATING);
    log.info("Calibrating for up to {} ms; keep a neutral pose",
        settings.calibrationWindow().toMillis());
    long deadline = clock.nowMillis() + settings.calibrationWindow().toMillis();
    Set<Long> seen = new HashSet<>();
    double pitch = 0.0;
    double roll = 0.0;
    double yaw = 0.0;
    while (clock.nowMillis() < deadline && seen.size() < settings.calibrationSamples()) {
      submitLatestFrame();
      Optional<FusedPoseSample> latest = buffer.latest();
      if (latest.isPresent() && latest.get().hasAngles() && seen.add(latest.get().timestampMillis())) {
        FusedPoseSample sample = latest.get();
        pitch += sample.pitch();
        roll += sample.roll();
        yaw += sample.yaw();
      }
      TimeUnit.MILLISECONDS.sleep(IDLE_SLEEP_MILLIS);
    }
    int count = seen.size();
    if (count == 0) {
      throw new InitializationException("Calibration collected no face samples");
    }
    AngleOffset measured = new AngleOffset(pitch / count, roll / count, yaw / count);
    offset = measured;
    log.info("Calibrated from {} samples: pitch={} roll={} yaw={}", count,
        measured.pitch(), measured.roll(), measured.yaw());
    return measured;
  }

  /**
   * Starts the control loop thread.
   *
   * @throws IllegalStateException unless the session is initialized (and optionally calibrated)
   */
  public void start() {
    SessionState current = state.get();
    if ((current != SessionState.INITIALIZING && current != SessionState.CALIBRATING)
        || !state.compareAndSet(current, SessionState.RUNNING)) {
      throw new IllegalStateException("Cannot start session in state " + current);
    }
    loop.start();
    log.info("Control loop running at {} fps", settings.targetFps());
  }

  /**
   * Stops every component, each join bounded by {@code stopTimeout}. Idempotent; a component that
   * does not stop in time is logged and the rest are still stopped.
   */
  public void stop() {
    SessionState previous = state.getAndUpdate(
        s -> s == SessionState.STOPPING || s == SessionState.STOPPED ? s : SessionState.STOPPING);
    if (previous == SessionState.STOPPING || previous == SessionState.STOPPED) {
      return;
    }
    log.info("Stopping session (was {})", previous);
    Duration timeout = settings.stopTimeout();
    try {
      stopAndJoin(loop, timeout);
      stopAndJoin(frames, timeout);
      stopAndJoin(dispatch, timeout);
      stopAndJoin(fanIn, timeout);
      slots.stopAll();
      List<String> stuck = slots.joinAll(timeout);
      if (!stuck.isEmpty()) {
        log.error("Actuator slot(s) {} did not stop within {} ms", stuck, timeout.toMillis());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while stopping; remaining components were asked to stop");
      frames.stop();
      dispatch.stop();
      fanIn.stop();
      slots.stopAll();
    } finally {
      closeRecorder();
      state.set(SessionState.STOPPED);
      stopped.countDown();
      log.info("Session stopped");
    }
  }

  /**
   * Waits for {@link #stop()} to complete.
   *
   * @param timeout maximum wait
   * @return {@code true} if the session stopped
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitStopped(Duration timeout) throws InterruptedException {
    return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  private void stopAndJoin(PipelineComponent component, Duration timeout) throws InterruptedException {
    component.stop();
    if (!component.join(timeout)) {
      log.error("{} did not stop within {} ms", component.name(), timeout.toMillis());
    }
  }

  private void closeRecorder() {
    try {
      recorder.close();
    } catch (IOException ex) {
      log.warn("Failed to close pose log: {}", ex.getMessage());
    }
  }

  private void transition(SessionState from, SessionState to) {
    if (!state.compareAndSet(from, to)) {
      throw new IllegalStateException("Expected session state " + from + " but was " + state.get());
    }
  }

  private void submitLatestFrame() {
    Optional<Frame> frame = frames.latest(detectOptions);
    if (frame.isPresent() && frame.get().capturedAtMillis() != lastSubmittedCapture) {
      lastSubmittedCapture = frame.get().capturedAtMillis();
      dispatch.submit(frame.get());
    }
  }

  /** @return {@code false} when no sample exists yet and the caller should idle briefly */
  private boolean iterate() {
    submitLatestFrame();
    Optional<FusedPoseSample> latest = buffer.latest();
    if (latest.isEmpty()) {
      return false;
    }
    FusedPoseSample sample = latest.get();
    if (sample.timestampMillis() <= lastProcessedTimestamp) {
      return true;
    }
    lastProcessedTimestamp = sample.timestampMillis();
    if (!sample.complete()) {
      metrics.increment("session.sample.incomplete");
      return true;
    }
    processSample(sample, clock.nowMillis());
    return true;
  }

  /**
   * Corrects, smooths and gates one fused sample; emits to the slots when due.
   *
   * @param sample complete fused sample
   * @param nowMillis current time on the session clock
   * @return payload built for the sample, whether or not it was sent
   */
  ActuatorPayload processSample(FusedPoseSample sample, long nowMillis) {
    AngleOffset correction = offset;
    double pitch = clampAngle(sample.pitch() - correction.pitch());
    double roll = clampAngle(sample.roll() - correction.roll());
    double yaw = clampAngle(sample.yaw() - correction.yaw());
    smoother.smooth(Channel.PITCH, pitch);
    smoother.smooth(Channel.ROLL, roll);
    smoother.smooth(Channel.YAW, yaw);
    smoother.smooth(Channel.HEIGHT, sample.height());
    smoother.smooth(Channel.EARS, sample.height());
    EmitDecision decision = smoother.shouldEmit(GATED_CHANNELS, nowMillis);

    ActuatorPayload payload = new ActuatorPayload(
        Math.toRadians(units(Channel.PITCH)),
        Math.toRadians(units(Channel.ROLL)),
        Math.toRadians(units(Channel.YAW)),
        units(Channel.HEIGHT),
        units(Channel.EARS),
        decision.emit() ? decision.durationMs() : ActuatorPayload.DEFAULT_DURATION_MS);
    metrics.increment("session.samples.processed");
    if (decision.emit()) {
      int accepted = slots.broadcast(payload);
      metrics.increment("session.payloads.emitted");
      log.debug("Emitted payload to {} slot(s): {}", accepted, payload);
    }
    record(new PoseRecord(sample.timestampMillis(), pitch, roll, yaw, payload, sample.height(),
        sample.gaze(), fps, decision.emit()));
    return payload;
  }

  private double units(Channel channel) {
    return channel.toActuatorUnits(smoother.smoothed(channel));
  }

  private void record(PoseRecord poseRecord) {
    try {
      recorder.record(poseRecord);
    } catch (IOException ex) {
      metrics.increment("session.poselog.error");
      if (!recorderFailed) {
        recorderFailed = true;
        log.warn("Pose log write failed; further failures are only counted: {}", ex.getMessage());
      }
    }
  }

  private static double clampAngle(double value) {
    return Math.max(-ANGLE_LIMIT_DEGREES, Math.min(ANGLE_LIMIT_DEGREES, value));
  }

  private final class ControlLoop extends ManagedWorker {
    ControlLoop(MetricsPort metrics) {
      super("session", metrics);
    }

    @Override
    protected void runLoop() throws InterruptedException {
      long period = settings.framePeriodMillis();
      long previousStart = Long.MIN_VALUE;
      while (running()) {
        long started = clock.nowMillis();
        long startedNanos = System.nanoTime();
        if (previousStart != Long.MIN_VALUE && started > previousStart) {
          fps = 1000.0 / (started - previousStart);
        }
        previousStart = started;
        boolean paced;
        try {
          paced = iterate();
        } catch (RuntimeException ex) {
          metrics.increment("session.loop.error");
          log.warn("Control loop iteration failed", ex);
          paced = true;
        }
        metrics.observe("session.loop.latencyNanos", System.nanoTime() - startedNanos);
        if (!paced) {
          TimeUnit.MILLISECONDS.sleep(IDLE_SLEEP_MILLIS);
          continue;
        }
        long remaining = period - (clock.nowMillis() - started);
        if (remaining > 0) {
          TimeUnit.MILLISECONDS.sleep(remaining);
        } else {
          metrics.increment("session.loop.overrun");
        }
      }
    }
  }
}
