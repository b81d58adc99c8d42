package ca.gc.cra.mimetic.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void runDefaultsCarrySmoothingAndDefaultSlot() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("run");

    assertEquals("synthetic", defaults.get("source"));
    assertEquals("latest", defaults.get("pairing"));
    assertEquals("none", defaults.get("metricsExporter"));
    assertEquals("0.3", defaults.get("alpha.x"));
    assertEquals("0.1", defaults.get("alpha.z"));
    assertEquals("10.0", defaults.get("sendRate"));
    assertEquals("127.0.0.1:8000", defaults.get("actuator.mimetic.endpoint"));
    assertEquals("false", defaults.get("dryRun"));
  }

  @Test
  void calibrateDefaultsOmitRunOnlyKeys() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap(" Calibrate ");

    assertTrue(defaults.containsKey("calibrationMs"));
    assertFalse(defaults.containsKey("sendRate"));
    assertFalse(defaults.containsKey("runForMs"));
  }

  @Test
  void defaultsProduceValidConfig() {
    MimicConfig config = MimicConfig.fromMap(DefaultsForMode.asFlatMap("run"));

    assertEquals(DetectorMode.SYNTHETIC, config.detector());
    assertEquals(1, config.enabledActuators().size());
  }

  @Test
  void unsupportedModeThrows() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
