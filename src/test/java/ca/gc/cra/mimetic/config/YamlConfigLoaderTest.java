package ca.gc.cra.mimetic.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndModeSections() throws IOException {
    Path yaml = tempDir.resolve("mimetic.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
          targetFps: 20
        run:
          targetFps: 25
          sendRate: 12.5
        calibrate:
          calibrationMs: 9000
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "run").orElseThrow();

    assertEquals("none", map.get("metricsExporter"));
    assertEquals("25", map.get("targetFps"));
    assertEquals("12.5", map.get("sendRate"));
    assertFalse(map.containsKey("calibrationMs"));
  }

  @Test
  void loadFlattensNestedMaps() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        common:
          actuator:
            left:
              endpoint: 10.0.0.5:8000
              enabled: false
        run:
          alpha:
            x: 0.5
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "run").orElseThrow();
    assertEquals("10.0.0.5:8000", map.get("actuator.left.endpoint"));
    assertEquals("false", map.get("actuator.left.enabled"));
    assertEquals("0.5", map.get("alpha.x"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    Optional<Map<String, String>> result = YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "run");

    assertFalse(result.isPresent());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertTrue(YamlConfigLoader.load(yaml, "run").orElseThrow().isEmpty());
  }

  @Test
  void invalidStructuresThrow() throws IOException {
    Path list = tempDir.resolve("list.yaml");
    Files.writeString(list, "- run\n- calibrate\n");
    Path unknown = tempDir.resolve("unknown.yaml");
    Files.writeString(unknown, "capture:\n  iface: en0\n");
    Path sequence = tempDir.resolve("sequence.yaml");
    Files.writeString(sequence, "run:\n  actuators: [a, b]\n");
    Path broken = tempDir.resolve("broken.yaml");
    Files.writeString(broken, "run: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(list, "run"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(unknown, "run"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(sequence, "run"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(broken, "run"));
  }
}
