package ca.gc.cra.mimetic.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfigCliUtilsTest {

  @Test
  void extractConfigPathRemovesKey() {
    Map<String, String> args = new HashMap<>(Map.of("config", " mimetic.yaml ", "targetFps", "20"));

    assertEquals("mimetic.yaml", ConfigCliUtils.extractConfigPath(args));
    assertFalse(args.containsKey("config"));
    assertNull(ConfigCliUtils.extractConfigPath(args));
  }

  @Test
  void parseBooleanAcceptsCommonSpellings() {
    assertTrue(ConfigCliUtils.parseBoolean(Map.of("dryRun", "YES"), "dryRun"));
    assertTrue(ConfigCliUtils.parseBoolean(Map.of("dryRun", "1"), "dryRun"));
    assertFalse(ConfigCliUtils.parseBoolean(Map.of("dryRun", "no"), "dryRun"));
    assertFalse(ConfigCliUtils.parseBoolean(Map.of("dryRun", " "), "dryRun"));
    assertFalse(ConfigCliUtils.parseBoolean(Map.of(), "dryRun"));
    assertThrows(IllegalArgumentException.class,
        () -> ConfigCliUtils.parseBoolean(Map.of("dryRun", "maybe"), "dryRun"));
  }
}
