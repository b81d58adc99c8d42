package ca.gc.cra.mimetic.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} tokens into an ordered map. Keys may be dotted ({@code alpha.yaw}) so slot
 * settings such as {@code actuator.left.endpoint=10.0.0.5:8000} can be given on the command line.
 */
public final class CliArgsParser {
  private static final Pattern KEY = Pattern.compile("^[A-Za-z][A-Za-z0-9_-]*(\\.[A-Za-z0-9_-]+)*$");
  private static final int MAX_VALUE_LENGTH = 4_096;

  private CliArgsParser() {}

  /**
   * Parses tokens; later duplicates of a key are rejected.
   *
   * @param args tokens of the form {@code key=value}; {@code null} yields an empty map
   * @return mutable map in argument order
   * @throws IllegalArgumentException for malformed tokens, bad keys, control characters or duplicates
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String token = raw.trim();
      int eq = token.indexOf('=');
      if (eq <= 0) {
        throw new IllegalArgumentException("expected key=value but got '" + token + "'");
      }
      String key = token.substring(0, eq).trim();
      String value = token.substring(eq + 1).trim();
      if (!KEY.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid option name: " + key);
      }
      checkValue(key, value);
      if (map.putIfAbsent(key, value) != null) {
        throw new IllegalArgumentException("option given more than once: " + key);
      }
    }
    return map;
  }

  private static void checkValue(String key, String value) {
    if (value.length() > MAX_VALUE_LENGTH) {
      throw new IllegalArgumentException(key + " is longer than " + MAX_VALUE_LENGTH + " characters");
    }
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        throw new IllegalArgumentException(key + " must not contain control characters");
      }
    }
  }
}
