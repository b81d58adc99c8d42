package ca.gc.cra.mimetic.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Where frames come from: {@code synthetic} or {@code images:DIR}.
 *
 * @param kind source family
 * @param directory image directory for {@link Kind#IMAGES}; {@code null} otherwise
 */
public record CameraSource(Kind kind, Path directory) {
  private static final String IMAGES_PREFIX = "images:";

  /** Camera device families. */
  public enum Kind {
    SYNTHETIC,
    IMAGES
  }

  public CameraSource {
    Objects.requireNonNull(kind, "kind");
    if (kind == Kind.IMAGES && directory == null) {
      throw new IllegalArgumentException("images source requires a directory");
    }
    if (kind == Kind.SYNTHETIC) {
      directory = null;
    }
  }

  public static CameraSource synthetic() {
    return new CameraSource(Kind.SYNTHETIC, null);
  }

  /**
   * Parses {@code synthetic} or {@code images:DIR}.
   *
   * @param value raw configuration value
   * @return camera source
   * @throws IllegalArgumentException for unknown forms or invalid paths
   */
  public static CameraSource parse(String value) {
    String trimmed = value == null ? "" : value.trim();
    if (trimmed.isEmpty() || trimmed.equalsIgnoreCase("synthetic")) {
      return synthetic();
    }
    if (trimmed.regionMatches(true, 0, IMAGES_PREFIX, 0, IMAGES_PREFIX.length())) {
      String dir = trimmed.substring(IMAGES_PREFIX.length()).trim();
      if (dir.isEmpty()) {
        throw new IllegalArgumentException("source images: requires a directory");
      }
      try {
        return new CameraSource(Kind.IMAGES, Path.of(dir).toAbsolutePath().normalize());
      } catch (InvalidPathException ex) {
        throw new IllegalArgumentException("source directory is not a valid path: " + dir, ex);
      }
    }
    throw new IllegalArgumentException("source must be synthetic or images:DIR (was " + value + ")");
  }

  public Optional<Path> imageDirectory() {
    return Optional.ofNullable(directory);
  }

  @Override
  public String toString() {
    return kind == Kind.IMAGES ? IMAGES_PREFIX + directory : "synthetic";
  }
}
