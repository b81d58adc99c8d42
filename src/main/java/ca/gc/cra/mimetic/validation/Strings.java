package ca.gc.cra.mimetic.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings used by configuration and CLI layers.
 * <p><strong>Why:</strong> Rejects blank or control-character values before they reach HTTP endpoints,
 * thread names or file paths.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[A-Za-z0-9_-]{1,32}$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name parameter name for diagnostics
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a short identifier such as an output slot name, usable in metric keys and thread names.
   *
   * @param name parameter name for diagnostics
   * @param value candidate identifier
   * @return trimmed identifier matching {@code [A-Za-z0-9_-]{1,32}}
   * @throws IllegalArgumentException when the identifier has unsupported characters or length
   */
  public static String requireIdentifier(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    if (!IDENTIFIER_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must be 1-32 letters, digits, underscores, or hyphens"));
    }
    return sanitized;
  }

  /**
   * Ensures a value contains only printable ASCII characters and is at most {@code maxLength} characters long.
   *
   * @param name parameter name for diagnostics
   * @param value candidate string
   * @param maxLength maximum permitted length in characters
   * @return validated value
   * @throws IllegalArgumentException if the value is too long or contains non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
