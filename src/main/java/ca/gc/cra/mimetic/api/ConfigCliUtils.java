package ca.gc.cra.mimetic.api;

import java.util.Locale;
import java.util.Map;

/** Small helpers shared by the commands when mixing switches with map-based configuration. */
final class ConfigCliUtils {
  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config=PATH} option so it is not mistaken for a session key.
   *
   * @param args mutable CLI map
   * @return trimmed path, or {@code null} when absent or blank
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return false;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was " + value + ")");
    };
  }
}
