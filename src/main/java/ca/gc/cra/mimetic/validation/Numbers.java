package ca.gc.cra.mimetic.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by CLI and configuration parsing.
 * <p><strong>Why:</strong> Guards against invalid frame rates, queue capacities, smoothing factors and
 * timeouts before pipeline components allocate threads or queues.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException}
 * when validation fails.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a value falls within an inclusive range.
   *
   * @param name parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a finite value falls within an inclusive range.
   *
   * @param name parameter name included in diagnostics
   * @param value candidate value; NaN and infinities are rejected
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} is not finite or lies outside {@code [min, max]}
   */
  public static double requireRange(String name, double value, double min, double max) {
    if (!Double.isFinite(value) || value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal value from configuration text.
   *
   * @param name parameter name included in diagnostics
   * @param raw text to parse
   * @return parsed value
   * @throws IllegalArgumentException when the text is not a number
   */
  public static double parseDouble(String name, String raw) {
    try {
      return Double.parseDouble(Strings.requireNonBlank(name, raw));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be numeric (was " + raw + ")", ex);
    }
  }

  /**
   * Parses an integer value from configuration text.
   *
   * @param name parameter name included in diagnostics
   * @param raw text to parse
   * @return parsed value
   * @throws IllegalArgumentException when the text is not an integer
   */
  public static long parseLong(String name, String raw) {
    try {
      return Long.parseLong(Strings.requireNonBlank(name, raw));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was " + raw + ")", ex);
    }
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
