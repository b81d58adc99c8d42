package ca.gc.cra.mimetic.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.mimetic.application.pipeline.MimicSession;
import ca.gc.cra.mimetic.application.pipeline.OutputSlotTable;
import ca.gc.cra.mimetic.application.pipeline.SessionState;
import ca.gc.cra.mimetic.application.port.LandmarkDetector;
import ca.gc.cra.mimetic.application.port.MetricsPort;
import ca.gc.cra.mimetic.application.port.PoseRecorder;
import ca.gc.cra.mimetic.domain.detect.DetectorKind;
import ca.gc.cra.mimetic.infrastructure.actuator.HttpActuatorClient;
import ca.gc.cra.mimetic.infrastructure.camera.ImageSequenceCameraDevice;
import ca.gc.cra.mimetic.infrastructure.camera.SyntheticCameraDevice;
import ca.gc.cra.mimetic.infrastructure.detect.HttpLandmarkDetector;
import ca.gc.cra.mimetic.infrastructure.detect.SyntheticLandmarkDetector;
import ca.gc.cra.mimetic.infrastructure.poselog.NdjsonPoseRecorder;
import ca.gc.cra.mimetic.testing.ManualClock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {
  @TempDir Path tempDir;

  private static CompositionRoot root(String... keyValues) {
    Map<String, String> map = new HashMap<>(DefaultsForMode.asFlatMap("run"));
    for (int i = 0; i < keyValues.length; i += 2) {
      map.put(keyValues[i], keyValues[i + 1]);
    }
    return new CompositionRoot(MimicConfig.fromMap(map), MetricsPort.NO_OP, new ManualClock(0L));
  }

  @Test
  void syntheticDefaultsWireSyntheticAdapters() throws Exception {
    CompositionRoot root = root();

    assertInstanceOf(SyntheticCameraDevice.class, root.cameraDevice());
    List<LandmarkDetector> detectors = root.detectors();
    try {
      assertEquals(List.of(DetectorKind.FACE, DetectorKind.POSE),
          detectors.stream().map(LandmarkDetector::kind).toList());
      assertInstanceOf(SyntheticLandmarkDetector.class, detectors.get(0));
    } finally {
      for (LandmarkDetector detector : detectors) {
        detector.close();
      }
    }
    assertSame(PoseRecorder.NO_OP, root.poseRecorder());
  }

  @Test
  void httpDetectorAndImageSourceWireRealAdapters() throws Exception {
    Path frames = Files.createDirectory(tempDir.resolve("frames"));
    CompositionRoot root = root(
        "detector", "http", "detectorEndpoint", "127.0.0.1:8700", "source", "images:" + frames);

    assertInstanceOf(ImageSequenceCameraDevice.class, root.cameraDevice());
    List<LandmarkDetector> detectors = root.detectors();
    try {
      assertInstanceOf(HttpLandmarkDetector.class, detectors.get(1));
    } finally {
      for (LandmarkDetector detector : detectors) {
        detector.close();
      }
    }
  }

  @Test
  void missingImageDirectoryIsRejected() {
    CompositionRoot root = root("source", "images:" + tempDir.resolve("absent"));

    assertThrows(IllegalArgumentException.class, root::cameraDevice);
  }

  @Test
  void actuatorClientTargetsPositionPath() {
    CompositionRoot root = root();

    HttpActuatorClient client =
        (HttpActuatorClient) root.actuatorClient(new ActuatorSlotConfig("left", "10.1.2.3:9000", true));

    assertEquals("http://10.1.2.3:9000/position", client.endpoint());
  }

  @Test
  void outputSlotsHonourEnabledFlag() {
    CompositionRoot root = root(
        "actuator.left.endpoint", "10.0.0.1:8000",
        "actuator.left.enabled", "false");

    OutputSlotTable slots = root.outputSlots();
    try {
      assertEquals(List.of("left", "mimetic"), slots.names());
      assertFalse(slots.isEnabled("left"));
      assertTrue(slots.isEnabled("mimetic"));
      assertEquals(1, slots.enabledCount());
    } finally {
      slots.stopAll();
    }
  }

  @Test
  void buildSessionOpensPoseLog() throws Exception {
    Path log = tempDir.resolve("logs/poses.ndjson");
    CompositionRoot root = root("poseLog", log.toString());

    try (PoseRecorder recorder = root.poseRecorder()) {
      assertInstanceOf(NdjsonPoseRecorder.class, recorder);
    }
    MimicSession session = root.buildSession();
    try {
      assertEquals(SessionState.IDLE, session.state());
      assertTrue(Files.exists(log));
    } finally {
      session.stop();
    }
  }
}
