package ca.gc.cra.guardrails.domain.guardrail;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Guardrail selection and tuning for one persona.
 * <p><strong>Why:</strong> A strict moderator and a permissive greeter share the same guardrail implementations
 * but differ in which ones run and with which thresholds.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param enabled guardrail names enabled for the persona, in declaration order; never {@code null}
 * @param guardrails per-guardrail configuration keyed by guardrail name; never {@code null}
 * @since 0.1.0
 */
public record PersonaGuardrailConfig(List<String> enabled, Map<String, GuardrailConfig> guardrails) {

  public PersonaGuardrailConfig {
    if (enabled == null) {
      throw new InvalidPersonaConfigException("Persona config must have enabled list");
    }
    enabled = List.copyOf(enabled);
    guardrails = guardrails == null ? Map.of() : Map.copyOf(guardrails);
  }

  /**
   * Creates a configuration that enables the given guardrails with default settings.
   *
   * @param names guardrail names
   * @return persona configuration
   */
  public static PersonaGuardrailConfig enabling(String... names) {
    return new PersonaGuardrailConfig(List.of(names), Map.of());
  }

  /**
   * Resolves the configuration for a guardrail, defaulting to {@link GuardrailConfig#ENABLED}.
   *
   * @param guardrailName guardrail name
   * @return configuration; never {@code null}
   */
  public GuardrailConfig configFor(String guardrailName) {
    return guardrails.getOrDefault(guardrailName, GuardrailConfig.ENABLED);
  }

  /**
   * Returns a copy restricted to the supplied enabled names, keeping the per-guardrail map.
   *
   * @param retained enabled names to keep
   * @return new configuration
   */
  public PersonaGuardrailConfig withEnabled(List<String> retained) {
    return new PersonaGuardrailConfig(retained, guardrails);
  }

  /**
   * Parses a raw mapping with an {@code enabled} list and an optional {@code guardrails} mapping.
   *
   * @param raw raw mapping, typically a YAML node
   * @return persona configuration
   * @throws InvalidPersonaConfigException when {@code enabled} is missing or not a list, or a guardrail entry is
   *     not a mapping
   */
  public static PersonaGuardrailConfig fromMap(Map<String, ?> raw) {
    Objects.requireNonNull(raw, "raw");
    Object enabledNode = raw.get("enabled");
    if (!(enabledNode instanceof List<?> list)) {
      throw new InvalidPersonaConfigException("Persona config must have enabled list");
    }
    List<String> names = list.stream().map(String::valueOf).toList();

    Map<String, GuardrailConfig> configs = new LinkedHashMap<>();
    Object guardrailsNode = raw.get("guardrails");
    if (guardrailsNode != null) {
      if (!(guardrailsNode instanceof Map<?, ?> map)) {
        throw new InvalidPersonaConfigException("guardrails must be a mapping");
      }
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        String name = String.valueOf(entry.getKey());
        Object value = entry.getValue();
        if (value != null && !(value instanceof Map<?, ?>)) {
          throw new InvalidPersonaConfigException("guardrails." + name + " must be a mapping");
        }
        try {
          configs.put(name, GuardrailConfig.fromMap(stringKeys((Map<?, ?>) value, name)));
        } catch (IllegalArgumentException ex) {
          throw new InvalidPersonaConfigException("guardrails." + name + ": " + ex.getMessage(), ex);
        }
      }
    }
    return new PersonaGuardrailConfig(names, configs);
  }

  private static Map<String, Object> stringKeys(Map<?, ?> raw, String context) {
    if (raw == null) {
      return Map.of();
    }
    Map<String, Object> result = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new InvalidPersonaConfigException("guardrails." + context + " contains non-string key");
      }
      result.put(key, entry.getValue());
    }
    return result;
  }
}
