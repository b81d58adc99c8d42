package ca.gc.cra.mimetic.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void parsesKeyValuePairsInOrder() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {
        "source=images:/tmp/frames", " actuator.left.endpoint = 10.0.0.1:8000 ", "", "poseLog="});

    assertEquals(List.of("source", "actuator.left.endpoint", "poseLog"), List.copyOf(map.keySet()));
    assertEquals("images:/tmp/frames", map.get("source"));
    assertEquals("10.0.0.1:8000", map.get("actuator.left.endpoint"));
    assertEquals("", map.get("poseLog"));
  }

  @Test
  void valueMayContainEquals() {
    assertEquals("service.version=2,team=lab",
        CliArgsParser.toMap(new String[] {"otelResourceAttributes=service.version=2,team=lab"})
            .get("otelResourceAttributes"));
  }

  @Test
  void rejectsMalformedTokens() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"verbose"}));
    assertEquals("expected key=value but got 'verbose'", ex.getMessage());
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"9lives=1"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"poseLog=a\nb"}));
  }

  @Test
  void rejectsDuplicateKeys() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"targetFps=10", "targetFps=20"}));
    assertTrue(ex.getMessage().contains("option given more than once"));
  }

  @Test
  void nullArgsYieldEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }
}
