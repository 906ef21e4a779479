package ca.gc.cra.guardrails.domain.guardrail;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * <strong>What:</strong> Per-persona configuration handed to a single guardrail.
 * <p><strong>Why:</strong> Guardrails read thresholds, toggles, messages, and detector lists from free-form keys so
 * personas can tune them without code changes.</p>
 * <p><strong>Thread-safety:</strong> Immutable apart from an internal cache of compiled patterns, which is a
 * concurrent map.</p>
 *
 * @implNote Numeric getters accept any {@link Number} or a numeric string, matching what YAML loaders produce.
 * @since 0.1.0
 */
public final class GuardrailConfig {
  /** Configuration used when a persona says nothing about a guardrail. */
  public static final GuardrailConfig ENABLED = new GuardrailConfig(true, Map.of());
  /** Configuration that switches a guardrail off. */
  public static final GuardrailConfig DISABLED = new GuardrailConfig(false, Map.of());

  private final boolean enabled;
  private final Map<String, Object> options;
  private final Map<String, List<Pattern>> compiledPatterns = new ConcurrentHashMap<>();

  /**
   * Creates a configuration.
   *
   * @param enabled whether the guardrail runs for the persona
   * @param options guardrail-specific keys; copied, {@code null} values dropped
   */
  public GuardrailConfig(boolean enabled, Map<String, ?> options) {
    this.enabled = enabled;
    Map<String, Object> copy = new LinkedHashMap<>();
    if (options != null) {
      options.forEach((key, value) -> {
        if (key != null && value != null && !"enabled".equals(key)) {
          copy.put(key, value);
        }
      });
    }
    this.options = Map.copyOf(copy);
  }

  /**
   * Builds a configuration from a raw map whose optional {@code enabled} entry is a boolean.
   *
   * @param raw raw configuration such as a YAML mapping; {@code null} yields {@link #ENABLED}
   * @return configuration
   * @throws IllegalArgumentException when {@code enabled} is present but not a boolean
   */
  public static GuardrailConfig fromMap(Map<String, ?> raw) {
    if (raw == null || raw.isEmpty()) {
      return ENABLED;
    }
    Object flag = raw.get("enabled");
    boolean enabled;
    if (flag == null) {
      enabled = true;
    } else if (flag instanceof Boolean bool) {
      enabled = bool;
    } else if (flag instanceof String str && (str.equalsIgnoreCase("true") || str.equalsIgnoreCase("false"))) {
      enabled = Boolean.parseBoolean(str);
    } else {
      throw new IllegalArgumentException("enabled must be a boolean (was " + flag + ")");
    }
    return new GuardrailConfig(enabled, raw);
  }

  public boolean enabled() {
    return enabled;
  }

  /**
   * Returns the raw options, excluding {@code enabled}.
   *
   * @return immutable options
   */
  public Map<String, Object> options() {
    return options;
  }

  public boolean has(String key) {
    return options.containsKey(key);
  }

  public Optional<String> string(String key) {
    Object value = options.get(key);
    if (value == null) {
      return Optional.empty();
    }
    String str = value.toString();
    return str.isBlank() ? Optional.empty() : Optional.of(str);
  }

  public String string(String key, String defaultValue) {
    return string(key).orElse(defaultValue);
  }

  public boolean bool(String key, boolean defaultValue) {
    Object value = options.get(key);
    if (value instanceof Boolean bool) {
      return bool;
    }
    if (value instanceof String str && !str.isBlank()) {
      return Boolean.parseBoolean(str.trim());
    }
    return defaultValue;
  }

  public int integer(String key, int defaultValue) {
    Object value = options.get(key);
    if (value instanceof Number number) {
      return number.intValue();
    }
    if (value instanceof String str && !str.isBlank()) {
      try {
        return Integer.parseInt(str.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid integer for " + key + ": '" + str + "'", ex);
      }
    }
    return defaultValue;
  }

  public long longValue(String key, long defaultValue) {
    Object value = options.get(key);
    if (value instanceof Number number) {
      return number.longValue();
    }
    if (value instanceof String str && !str.isBlank()) {
      try {
        return Long.parseLong(str.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid long for " + key + ": '" + str + "'", ex);
      }
    }
    return defaultValue;
  }

  public double decimal(String key, double defaultValue) {
    Object value = options.get(key);
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    if (value instanceof String str && !str.isBlank()) {
      try {
        return Double.parseDouble(str.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid number for " + key + ": '" + str + "'", ex);
      }
    }
    return defaultValue;
  }

  /**
   * Returns a list of strings, accepting either a single string or a list.
   *
   * @param key option key
   * @param defaultValue value used when the key is absent
   * @return immutable list
   */
  public List<String> strings(String key, List<String> defaultValue) {
    Object value = options.get(key);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof String single) {
      return List.of(single);
    }
    if (value instanceof Iterable<?> iterable) {
      List<String> result = new ArrayList<>();
      for (Object element : iterable) {
        if (element != null) {
          result.add(element.toString());
        }
      }
      return List.copyOf(result);
    }
    throw new IllegalArgumentException(key + " must be a string or a list of strings");
  }

  /**
   * Returns case-insensitive patterns compiled from a string list option.
   *
   * <p>Compiled patterns are memoized per key.</p>
   *
   * @param key option key
   * @param defaultValue patterns used when the key is absent
   * @return immutable pattern list
   * @throws IllegalArgumentException when a configured expression does not compile
   */
  public List<Pattern> patterns(String key, List<Pattern> defaultValue) {
    Objects.requireNonNull(defaultValue, "defaultValue");
    if (!options.containsKey(key)) {
      return defaultValue;
    }
    return compiledPatterns.computeIfAbsent(key, this::compile);
  }

  private List<Pattern> compile(String key) {
    List<Pattern> result = new ArrayList<>();
    for (String expression : strings(key, List.of())) {
      try {
        result.add(Pattern.compile(expression, Pattern.CASE_INSENSITIVE));
      } catch (PatternSyntaxException ex) {
        throw new IllegalArgumentException("Invalid pattern for " + key + ": " + expression, ex);
      }
    }
    return List.copyOf(result);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof GuardrailConfig that)) {
      return false;
    }
    return enabled == that.enabled && options.equals(that.options);
  }

  @Override
  public int hashCode() {
    return Objects.hash(enabled, options);
  }

  @Override
  public String toString() {
    return "GuardrailConfig{enabled=" + enabled + ", options=" + options + '}';
  }
}
