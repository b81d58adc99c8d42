package ca.gc.cra.mimetic.domain.motion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ChannelTest {

  @Test
  void anglesMapOntoZeroToSixUnits() {
    assertEquals(3.0, Channel.PITCH.toActuatorUnits(0.0), 1e-9);
    assertEquals(0.0, Channel.PITCH.toActuatorUnits(-150.0), 1e-9);
    assertEquals(6.0, Channel.ROLL.toActuatorUnits(150.0), 1e-9);
  }

  @Test
  void yawUsesItsNarrowerRange() {
    assertEquals(0.0, Channel.YAW.toActuatorUnits(-40.0), 1e-9);
    assertEquals(2.4, Channel.YAW.toActuatorUnits(40.0), 1e-9);
  }

  @Test
  void outOfRangeValuesAreClamped() {
    assertEquals(6.0, Channel.HEIGHT.toActuatorUnits(250.0), 1e-9);
    assertEquals(0.0, Channel.EARS.toActuatorUnits(10.0), 1e-9);
  }

  @Test
  void lookupByConfigurationKey() {
    assertEquals(Channel.EARS, Channel.fromKey("E"));
    assertEquals(Channel.HEIGHT, Channel.fromKey(" h "));
    assertThrows(IllegalArgumentException.class, () -> Channel.fromKey("q"));
  }

  @Test
  void fusedSampleCompletenessRequiresAnglesAndHeight() {
    FusedPoseSample anglesOnly = new FusedPoseSample(1L, 1.0, 2.0, 3.0, Double.NaN, null);
    FusedPoseSample full = new FusedPoseSample(1L, 1.0, 2.0, 3.0, 40.0, null);

    assertTrue(anglesOnly.hasAngles());
    assertFalse(anglesOnly.complete());
    assertTrue(full.complete());
    assertEquals(9L, full.withTimestamp(9L).timestampMillis());
  }

  @Test
  void payloadRejectsNonFiniteValues() {
    assertThrows(IllegalArgumentException.class,
        () -> new ActuatorPayload(Double.NaN, 0, 0, 0, 0, 100));
    assertThrows(IllegalArgumentException.class,
        () -> new ActuatorPayload(0, 0, 0, 0, 0, 0));
    assertEquals(-1, new ActuatorPayload(0, 0, 0, 0, 0, 100).az());
  }
}
