package ca.gc.cra.mimetic.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.mimetic.application.pipeline.PairingPolicy;
import ca.gc.cra.mimetic.domain.motion.Channel;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MimicConfigTest {

  private static Map<String, String> runDefaultsWith(String... keyValues) {
    Map<String, String> map = new HashMap<>(DefaultsForMode.asFlatMap("run"));
    for (int i = 0; i < keyValues.length; i += 2) {
      map.put(keyValues[i], keyValues[i + 1]);
    }
    return map;
  }

  @Test
  void defaultsMatchDocumentedValues() {
    MimicConfig config = MimicConfig.defaults();

    assertEquals(CameraSource.synthetic(), config.source());
    assertEquals(DetectorMode.SYNTHETIC, config.detector());
    assertNull(config.detectorEndpoint());
    assertEquals(Duration.ofSeconds(1), config.detectorTimeout());
    assertEquals(PairingPolicy.LATEST, config.fusion().policy());
    assertEquals(320, config.session().detectWidth());
    assertEquals(180, config.session().detectHeight());
    assertEquals(0.3, config.session().smoothing().alpha(Channel.PITCH));
    assertEquals(List.of(new ActuatorSlotConfig("mimetic", "127.0.0.1:8000", true)), config.actuators());
    assertFalse(config.calibrate());
    assertTrue(config.poseLogPath().isEmpty());
    assertEquals(Duration.ZERO, config.runFor());
  }

  @Test
  void parsesOverridesAcrossSections() {
    MimicConfig config = MimicConfig.fromMap(runDefaultsWith(
        "detector", "http",
        "detectorEndpoint", "localhost:8700",
        "pairing", "strict",
        "pairToleranceMs", "15",
        "alpha.z", "0.6",
        "sendRate", "4",
        "targetFps", "12",
        "mirror", "false",
        "calibrate", "true",
        "runForMs", "2500"));

    assertEquals(DetectorMode.HTTP, config.detector());
    assertEquals("localhost:8700", config.detectorEndpoint());
    assertEquals(PairingPolicy.STRICT, config.fusion().policy());
    assertEquals(Duration.ofMillis(15), config.fusion().pairTolerance());
    assertEquals(0.6, config.session().smoothing().alpha(Channel.YAW));
    assertEquals(4.0, config.session().smoothing().rateHz());
    assertEquals(12, config.session().targetFps());
    assertFalse(config.session().mirror());
    assertTrue(config.calibrate());
    assertEquals(Duration.ofMillis(2500), config.runFor());
  }

  @Test
  void actuatorSlotsAreParsedSortedAndRemovable() {
    MimicConfig config = MimicConfig.fromMap(runDefaultsWith(
        "actuator.mimetic.endpoint", "",
        "actuator.right.endpoint", "10.0.0.2:8000",
        "actuator.left.endpoint", "10.0.0.1:8000",
        "actuator.left.enabled", "false"));

    assertEquals(List.of("left", "right"),
        config.actuators().stream().map(ActuatorSlotConfig::name).toList());
    assertFalse(config.actuators().get(0).enabled());
    assertEquals(List.of("right"),
        config.enabledActuators().stream().map(ActuatorSlotConfig::name).toList());
  }

  @Test
  void rejectsMalformedActuatorKeys() {
    assertThrows(IllegalArgumentException.class,
        () -> MimicConfig.fromMap(runDefaultsWith("actuator.left.port", "8000")));
    assertThrows(IllegalArgumentException.class,
        () -> MimicConfig.fromMap(runDefaultsWith("actuator.ghost.enabled", "true")));
    assertThrows(IllegalArgumentException.class,
        () -> MimicConfig.fromMap(runDefaultsWith("actuator.left.endpoint", "no-port")));
  }

  @Test
  void rejectsOutOfRangeNumbers() {
    assertThrows(IllegalArgumentException.class, () -> MimicConfig.fromMap(runDefaultsWith("targetFps", "0")));
    assertThrows(IllegalArgumentException.class, () -> MimicConfig.fromMap(runDefaultsWith("alpha.x", "1.5")));
    assertThrows(IllegalArgumentException.class, () -> MimicConfig.fromMap(runDefaultsWith("frameWidth", "wide")));
    assertThrows(IllegalArgumentException.class, () -> MimicConfig.fromMap(runDefaultsWith("runForMs", "-1")));
    assertThrows(IllegalArgumentException.class,
        () -> MimicConfig.fromMap(runDefaultsWith("gaze.leftThreshold", "0.7", "gaze.rightThreshold", "0.6")));
  }

  @Test
  void httpDetectorWithoutEndpointFails() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> MimicConfig.fromMap(runDefaultsWith("detector", "http")));
    assertTrue(ex.getMessage().contains("detectorEndpoint"));
  }
}
