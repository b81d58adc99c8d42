package ca.gc.cra.mimetic.config;

import java.util.Locale;

/** Landmark detector backend. */
public enum DetectorMode {
  /** Remote landmark service over HTTP. */
  HTTP,
  /** Built-in deterministic motion generator. */
  SYNTHETIC;

  /**
   * Parses a configuration value.
   *
   * @param value {@code http} or {@code synthetic}, case-insensitive
   * @return detector mode
   * @throws IllegalArgumentException if the value is not recognized
   */
  public static DetectorMode fromString(String value) {
    String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "http" -> HTTP;
      case "synthetic", "demo" -> SYNTHETIC;
      default -> throw new IllegalArgumentException(
          "detector must be one of http or synthetic (was " + value + ")");
    };
  }
}
