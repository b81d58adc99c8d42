package ca.gc.cra.mimetic.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.mimetic.application.port.ClockPort;
import ca.gc.cra.mimetic.domain.detect.DetectionResult;
import ca.gc.cra.mimetic.domain.detect.DetectorKind;
import ca.gc.cra.mimetic.domain.detect.FaceReadings;
import ca.gc.cra.mimetic.domain.detect.PoseReadings;
import ca.gc.cra.mimetic.domain.frame.Frame;
import ca.gc.cra.mimetic.domain.motion.ActuatorPayload;
import ca.gc.cra.mimetic.domain.motion.FusedPoseSample;
import ca.gc.cra.mimetic.domain.motion.MotionSmoother;
import ca.gc.cra.mimetic.testing.FakeCameraDevice;
import ca.gc.cra.mimetic.testing.ManualClock;
import ca.gc.cra.mimetic.testing.RecordingActuatorClient;
import ca.gc.cra.mimetic.testing.RecordingMetrics;
import ca.gc.cra.mimetic.testing.RecordingPoseRecorder;
import ca.gc.cra.mimetic.testing.ScriptedDetector;
import ca.gc.cra.mimetic.testing.Waits;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class PipelineConcurrencyTest {
  private static final Frame FRAME = new Frame(2, 2, new byte[12], 0L);
  private static final ActuatorPayload PAYLOAD = new ActuatorPayload(0.1, 0.2, 0.3, 3.0, 2.0, 100);
  private static final SessionSettings FAST = new SessionSettings(
      320, 180, true, 50,
      Duration.ofMillis(500),
      Duration.ofSeconds(2),
      5,
      Duration.ofSeconds(1),
      MotionSmoother.Settings.defaults());

  private final RecordingMetrics metrics = new RecordingMetrics();
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(MimicSession.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
  }

  @Test
  void concurrentAddsKeepRingOrderedAndBounded() throws Exception {
    ManualClock clock = new ManualClock(1_000L);
    CorrelationBuffer buffer = new CorrelationBuffer(
        new CorrelationBuffer.Settings(PairingPolicy.LATEST, 16, Duration.ofMillis(200),
            Duration.ofMillis(200), Duration.ZERO, Duration.ofMillis(200)),
        clock, metrics);
    int threads = 8;
    int perThread = 5_000;

    ExecutorService executor = Executors.newFixedThreadPool(threads);
    for (int t = 0; t < threads; t++) {
      boolean faces = t % 2 == 0;
      executor.submit(() -> {
        for (int i = 0; i < perThread; i++) {
          long ts = 1_000L + i;
          if (faces) {
            buffer.add(DetectorKind.FACE, face(ts), ts);
          } else {
            buffer.add(DetectorKind.POSE, pose(ts), ts);
          }
        }
      });
    }
    executor.shutdown();
    assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS), "executor not drained");

    List<FusedPoseSample> ring = buffer.snapshot();
    assertEquals(16, ring.size());
    for (int i = 1; i < ring.size(); i++) {
      assertTrue(ring.get(i).timestampMillis() > ring.get(i - 1).timestampMillis());
    }
    assertEquals(threads * perThread, metrics.count("fusion.samples.published"));
  }

  @Test
  void detectorThreadsFeedingFanInAccountForEveryResult() throws Exception {
    ManualClock clock = new ManualClock(1_000L);
    CorrelationBuffer buffer = new CorrelationBuffer(CorrelationBuffer.Settings.defaults(), clock, metrics);
    ResultFanIn fanIn = new ResultFanIn(buffer, 4, metrics);
    fanIn.start();
    int perThread = 2_000;

    ExecutorService executor = Executors.newFixedThreadPool(4);
    for (int t = 0; t < 4; t++) {
      boolean faces = t < 2;
      executor.submit(() -> {
        for (int i = 0; i < perThread; i++) {
          long ts = 1_000L + i;
          fanIn.onResult(faces ? face(ts) : pose(ts));
        }
      });
    }
    executor.shutdown();
    assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS), "executor not drained");

    int expectedPerKind = 2 * perThread;
    assertTrue(Waits.until(
        () -> metrics.count("detect.face.results") + metrics.count("fanin.face.dropped") == expectedPerKind
            && metrics.count("detect.pose.results") + metrics.count("fanin.pose.dropped") == expectedPerKind,
        Duration.ofSeconds(5)));
    fanIn.stop();
    assertTrue(fanIn.join(Duration.ofSeconds(1)));

    List<FusedPoseSample> ring = buffer.snapshot();
    assertFalse(ring.isEmpty());
    assertTrue(ring.size() <= 30);
    for (int i = 1; i < ring.size(); i++) {
      assertTrue(ring.get(i).timestampMillis() > ring.get(i - 1).timestampMillis());
    }
    assertEquals(metrics.count("detect.face.results") + metrics.count("detect.pose.results"),
        metrics.count("fusion.samples.published"));
  }

  @Test
  void concurrentSubmitsReceiveDistinctTimestamps() throws Exception {
    ManualClock clock = new ManualClock(5_000L);
    ScriptedDetector detector = ScriptedDetector.pose(10);
    List<DetectionResult> results = new CopyOnWriteArrayList<>();
    DetectionDispatch dispatch = new DetectionDispatch(List.of(detector), results::add, 2_000, clock, metrics);
    AtomicInteger accepted = new AtomicInteger();

    ExecutorService executor = Executors.newFixedThreadPool(4);
    for (int t = 0; t < 4; t++) {
      executor.submit(() -> {
        for (int i = 0; i < 500; i++) {
          if (dispatch.submit(FRAME)) {
            accepted.incrementAndGet();
          }
        }
      });
    }
    executor.shutdown();
    assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS), "executor not drained");
    dispatch.start();

    assertEquals(2_000, accepted.get());
    assertTrue(Waits.until(() -> detector.timestamps().size() == 2_000, Duration.ofSeconds(5)));
    assertEquals(2_000, new HashSet<>(detector.timestamps()).size());
    dispatch.stop();
    assertTrue(dispatch.join(Duration.ofSeconds(1)));
  }

  @Test
  void stopFromManyThreadsClosesDispatcherResourcesOnce() throws Exception {
    RecordingActuatorClient client = new RecordingActuatorClient();
    ActuatorDispatcher actuator =
        new ActuatorDispatcher("left", client, 8, Duration.ofMillis(10), ClockPort.SYSTEM, metrics);
    ScriptedDetector detector = ScriptedDetector.pose(10);
    DetectionDispatch dispatch =
        new DetectionDispatch(List.of(detector), result -> {}, 4, ClockPort.SYSTEM, metrics);
    actuator.start();
    dispatch.start();
    actuator.send(PAYLOAD);
    dispatch.submit(FRAME);

    runTogether(8, () -> {
      actuator.stop();
      dispatch.stop();
    });

    assertTrue(actuator.join(Duration.ofSeconds(1)));
    assertTrue(dispatch.join(Duration.ofSeconds(1)));
    assertEquals(1, client.closes());
    assertEquals(1, detector.closes());
    assertFalse(actuator.send(PAYLOAD));
    assertFalse(dispatch.submit(FRAME));
  }

  @Test
  void stopRacingStartLeavesNoWorkerAndClosesClientOnce() throws Exception {
    for (int round = 0; round < 50; round++) {
      RecordingActuatorClient client = new RecordingActuatorClient();
      ActuatorDispatcher actuator =
          new ActuatorDispatcher("race", client, 4, Duration.ZERO, ClockPort.SYSTEM, metrics);
      CountDownLatch gate = new CountDownLatch(1);
      ExecutorService executor = Executors.newFixedThreadPool(2);
      executor.submit(() -> {
        gate.await();
        try {
          actuator.start();
        } catch (IllegalStateException alreadyStopped) {
          // stop won the race
        }
        return null;
      });
      executor.submit(() -> {
        gate.await();
        actuator.stop();
        return null;
      });
      gate.countDown();
      executor.shutdown();
      assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS), "round " + round + " hung");

      assertTrue(actuator.join(Duration.ofSeconds(1)), "worker alive after round " + round);
      assertEquals(1, client.closes(), "client closes in round " + round);
      assertFalse(actuator.send(PAYLOAD));
    }
  }

  @Test
  void sessionStopFromManyThreadsShutsDownOnce() throws Exception {
    FakeCameraDevice camera = FakeCameraDevice.producing(32, 24);
    RecordingActuatorClient client = new RecordingActuatorClient();
    RecordingPoseRecorder recorder = new RecordingPoseRecorder();
    MimicSession session = session(camera, client, recorder);
    session.initialize();
    session.start();
    assertTrue(Waits.until(() -> !client.payloads().isEmpty(), Duration.ofSeconds(3)));

    long started = System.nanoTime();
    runTogether(8, session::stop);
    long elapsedMillis = (System.nanoTime() - started) / 1_000_000L;

    assertTrue(elapsedMillis < 3_000, "stop took " + elapsedMillis + " ms");
    assertTrue(session.awaitStopped(Duration.ofSeconds(2)));
    assertEquals(SessionState.STOPPED, session.state());
    assertEquals(1, camera.closes());
    assertEquals(1, client.closes());
    assertTrue(recorder.closed());
    long stoppedLogs = appender.list.stream()
        .filter(e -> e.getFormattedMessage().equals("Session stopped"))
        .count();
    assertEquals(1, stoppedLogs);
  }

  @Test
  void sessionStopRacingStartAlwaysEndsStopped() throws Exception {
    for (int round = 0; round < 10; round++) {
      RecordingActuatorClient client = new RecordingActuatorClient();
      MimicSession session = session(FakeCameraDevice.producing(16, 12), client, new RecordingPoseRecorder());
      session.initialize();
      CountDownLatch gate = new CountDownLatch(1);
      ExecutorService executor = Executors.newFixedThreadPool(2);
      executor.submit(() -> {
        gate.await();
        try {
          session.start();
        } catch (IllegalStateException lateStart) {
          // stop won the race
        }
        return null;
      });
      executor.submit(() -> {
        gate.await();
        session.stop();
        return null;
      });
      gate.countDown();
      executor.shutdown();
      assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS), "round " + round + " hung");

      assertTrue(session.awaitStopped(Duration.ofSeconds(2)));
      assertEquals(SessionState.STOPPED, session.state());
      int posted = client.payloads().size();
      Thread.sleep(60);
      assertEquals(posted, client.payloads().size(), "actuator still posting after round " + round);
    }
  }

  private MimicSession session(
      FakeCameraDevice camera, RecordingActuatorClient client, RecordingPoseRecorder recorder) {
    ClockPort clock = ClockPort.SYSTEM;
    CorrelationBuffer buffer = new CorrelationBuffer(CorrelationBuffer.Settings.defaults(), clock, metrics);
    ResultFanIn fanIn = new ResultFanIn(buffer, 8, metrics);
    DetectionDispatch dispatch = new DetectionDispatch(
        List.of(ScriptedDetector.face(20, 0, 0), ScriptedDetector.pose(60)), fanIn, 4, clock, metrics);
    ActuatorDispatcher actuator =
        new ActuatorDispatcher("robot", client, 8, Duration.ofMillis(10), clock, metrics);
    OutputSlotTable slots = new OutputSlotTable().register(actuator, true);
    return new MimicSession(FAST, new LatestFrameSource(camera, clock, metrics), dispatch, fanIn,
        buffer, slots, recorder, clock, metrics);
  }

  private static void runTogether(int threads, Runnable action) throws InterruptedException {
    CountDownLatch gate = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    for (int i = 0; i < threads; i++) {
      executor.submit(() -> {
        gate.await();
        action.run();
        return null;
      });
    }
    gate.countDown();
    executor.shutdown();
    assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS), "callers did not return");
  }

  private static DetectionResult face(long ts) {
    return new DetectionResult(DetectorKind.FACE, ts, new FaceReadings(1.0, 2.0, 3.0, null));
  }

  private static DetectionResult pose(long ts) {
    return new DetectionResult(DetectorKind.POSE, ts, new PoseReadings(50.0));
  }
}
