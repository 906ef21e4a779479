package ca.gc.cra.guardrails.validation;

/**
 * <strong>What:</strong> Numeric validation helpers for engine configuration.
 * <p><strong>Why:</strong> Rejects breaker thresholds, timeouts, and capacity limits that would disable or
 * destabilize the engine before any component is built.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value
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
   * Int variant of {@link #requireRange(String, long, long, long)}.
   */
  public static int requireRange(String name, int value, int min, int max) {
    return (int) requireRange(name, (long) value, min, max);
  }

  /**
   * Parses a configuration value that may be a {@link Number} or a numeric string.
   *
   * @param name parameter name for diagnostics
   * @param raw raw value; {@code null} yields {@code defaultValue}
   * @param defaultValue fallback when {@code raw} is absent
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is neither a number nor a numeric string
   */
  public static long parseLong(String name, Object raw, long defaultValue) {
    if (raw == null) {
      return defaultValue;
    }
    if (raw instanceof Number number) {
      return number.longValue();
    }
    String text = raw.toString().trim();
    if (text.isEmpty()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(text);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was " + text + ")", ex);
    }
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
