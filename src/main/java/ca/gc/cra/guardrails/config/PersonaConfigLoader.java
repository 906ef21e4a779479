package ca.gc.cra.guardrails.config;

import ca.gc.cra.guardrails.domain.guardrail.InvalidPersonaConfigException;
import ca.gc.cra.guardrails.domain.guardrail.PersonaGuardrailConfig;
import ca.gc.cra.guardrails.validation.Strings;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads persona guardrail configurations from a YAML document.
 *
 * <pre>
 * version: 1
 * personas:
 *   greeter:
 *     enabled: [safety, length, spam]
 *     guardrails:
 *       spam: { maxRepeats: 3, timeWindowMs: 60000 }
 * </pre>
 *
 * @since 0.1.0
 */
public final class PersonaConfigLoader {
  /** Classpath location of the bundled personas. */
  public static final String DEFAULT_RESOURCE = "guardrails/personas.yaml";

  private PersonaConfigLoader() {}

  /**
   * Loads the bundled personas.
   *
   * @return personas keyed by name, in document order
   * @throws IOException when the resource is missing or unreadable
   */
  public static Map<String, PersonaGuardrailConfig> loadDefaults() throws IOException {
    return loadResource(DEFAULT_RESOURCE);
  }

  /**
   * Loads personas from a classpath resource.
   *
   * @param resource resource name relative to the classpath root
   * @return personas keyed by name, in document order
   * @throws IOException when the resource is missing or unreadable
   */
  public static Map<String, PersonaGuardrailConfig> loadResource(String resource) throws IOException {
    Objects.requireNonNull(resource, "resource");
    ClassLoader loader = PersonaConfigLoader.class.getClassLoader();
    try (InputStream in = loader.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IOException("Persona resource not found: " + resource);
      }
      return parse(new InputStreamReader(in, StandardCharsets.UTF_8), "classpath:" + resource);
    }
  }

  /**
   * Loads personas from a file.
   *
   * @param path persona file
   * @return personas keyed by name, in document order
   * @throws IOException when the file is missing or unreadable
   */
  public static Map<String, PersonaGuardrailConfig> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      throw new IOException("Persona file not found: " + path);
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return parse(reader, path.toString());
    }
  }

  /**
   * Parses a persona document.
   *
   * @param reader YAML source; not closed
   * @param source description used in error messages
   * @return personas keyed by name, in document order
   * @throws InvalidPersonaConfigException when the document or a persona is malformed
   */
  public static Map<String, PersonaGuardrailConfig> parse(Reader reader, String source) {
    Objects.requireNonNull(reader, "reader");
    Object document;
    try {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new InvalidPersonaConfigException("Failed to parse persona YAML at " + source, ex);
    }
    if (document == null) {
      return Map.of();
    }
    Map<String, Object> root = asMap(document, "root", source);
    int version = toInt(root.get("version"), source);
    if (version != 1) {
      throw new InvalidPersonaConfigException("Unsupported persona version " + version + " in " + source);
    }

    Map<String, PersonaGuardrailConfig> personas = new LinkedHashMap<>();
    Object personasNode = root.get("personas");
    if (personasNode == null) {
      return Map.of();
    }
    for (Map.Entry<String, Object> entry : asMap(personasNode, "personas", source).entrySet()) {
      String name = Strings.requireIdentifier("persona", entry.getKey());
      Map<String, Object> body = asMap(entry.getValue(), "personas." + name, source);
      try {
        personas.put(name, PersonaGuardrailConfig.fromMap(body));
      } catch (InvalidPersonaConfigException ex) {
        throw new InvalidPersonaConfigException("personas." + name + " in " + source + ": " + ex.getMessage(), ex);
      }
    }
    return personas;
  }

  private static int toInt(Object node, String source) {
    if (node instanceof Number number) {
      return number.intValue();
    }
    if (node instanceof String text) {
      try {
        return Integer.parseInt(text.trim());
      } catch (NumberFormatException ex) {
        throw new InvalidPersonaConfigException("version must be an integer in " + source, ex);
      }
    }
    throw new InvalidPersonaConfigException("version is required in " + source);
  }

  private static Map<String, Object> asMap(Object node, String context, String source) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new InvalidPersonaConfigException(context + " must be a mapping in " + source);
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new InvalidPersonaConfigException(context + " contains non-string key in " + source);
      }
      map.put(key, entry.getValue());
    }
    return map;
  }
}
