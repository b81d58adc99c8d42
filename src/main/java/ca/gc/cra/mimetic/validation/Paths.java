package ca.gc.cra.mimetic.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * Filesystem validation for image replay directories and pose log files.
 *
 * <p>Errors surface as {@link IllegalArgumentException} with the offending path so the CLI can print
 * them alongside usage text.</p>
 *
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates a directory the process must read from.
   *
   * @param path candidate directory
   * @return canonical directory path
   * @throws IllegalArgumentException if the directory is missing or unreadable
   */
  public static Path validateReadableDir(Path path) {
    Path normalized = normalize(path);
    if (!Files.isDirectory(normalized)) {
      throw new IllegalArgumentException("not a directory: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException("directory is not readable: " + normalized);
    }
    try {
      return normalized.toRealPath();
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to resolve directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Validates a file the process will create or overwrite, optionally creating its parent directories.
   *
   * @param path candidate file path
   * @param createParents create missing parent directories
   * @param allowOverwrite accept an existing regular file
   * @return absolute normalized path
   * @throws IllegalArgumentException if the parent is not writable, the path is a directory, or the file
   *     exists and {@code allowOverwrite} is false
   */
  public static Path validateWritableFile(Path path, boolean createParents, boolean allowOverwrite) {
    Path normalized = normalize(path);
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("path is a directory: " + normalized);
    }
    if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS) && !allowOverwrite) {
      throw new IllegalArgumentException(
          "file " + normalized + " already exists");
    }
    Path parent = normalized.getParent();
    if (parent == null) {
      throw new IllegalArgumentException("path has no parent to validate: " + normalized);
    }
    try {
      if (!Files.exists(parent) && createParents) {
        Files.createDirectories(parent);
      }
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to create directory " + parent + ": " + ex.getMessage(), ex);
    }
    if (!Files.isDirectory(parent)) {
      throw new IllegalArgumentException("parent directory is missing: " + parent);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException("parent directory is not writable: " + parent);
    }
    return normalized;
  }

  private static Path normalize(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0 || Strings.containsControl(raw)) {
      throw new IllegalArgumentException("path must not contain control characters");
    }
    return path.toAbsolutePath().normalize();
  }
}
