package ca.gc.cra.guardrails.validation;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for persona names and textual configuration values.
 * <p><strong>Why:</strong> Persona names become map keys and cache-key segments, so they must be printable and
 * free of separators.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities; safe for concurrent access.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^([A-Za-z0-9._-]+)$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
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
   * Validates a persona name or similar identifier.
   *
   * @param name logical parameter name included in exception messages
   * @param identifier candidate identifier; must be non-null
   * @return trimmed identifier matching {@code [A-Za-z0-9._-]+}
   * @throws NullPointerException if {@code identifier} is {@code null}
   * @throws IllegalArgumentException if the identifier is blank or contains unsupported characters
   */
  public static String requireIdentifier(String name, String identifier) {
    String sanitized = requireNonBlank(name, identifier);
    if (!IDENTIFIER_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen"));
    }
    return sanitized;
  }

  /**
   * Validates that a value is one of the allowed options, ignoring case.
   *
   * @param name logical parameter name
   * @param value candidate value
   * @param allowed accepted values in lower case
   * @return the lower-cased value
   * @throws IllegalArgumentException if the value is not one of {@code allowed}
   */
  public static String requireOneOf(String name, String value, String... allowed) {
    String normalized = requireNonBlank(name, value).toLowerCase(Locale.ROOT);
    for (String option : allowed) {
      if (option.equals(normalized)) {
        return normalized;
      }
    }
    throw new IllegalArgumentException(message(name, "must be one of " + String.join(", ", allowed)
        + " (was " + value + ")"));
  }

  private static boolean containsControl(CharSequence value) {
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
