package ca.gc.cra.guardrails.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads the {@code engine} section of a YAML document and flattens it into dotted keys such as
 * {@code breaker.failureThreshold}.
 */
public final class YamlConfigLoader {
  /** Classpath location of the bundled engine settings. */
  public static final String DEFAULT_RESOURCE = "guardrails/engine.yaml";

  static final String ENGINE_SECTION = "engine";

  private YamlConfigLoader() {}

  /**
   * Loads the bundled engine settings.
   *
   * @return flat map of the bundled {@code engine} section
   * @throws IOException when the resource is missing or unreadable
   */
  public static Map<String, String> loadDefaults() throws IOException {
    ClassLoader loader = YamlConfigLoader.class.getClassLoader();
    try (InputStream in = loader.getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) {
        throw new IOException("Engine config resource not found: " + DEFAULT_RESOURCE);
      }
      return parse(new InputStreamReader(in, StandardCharsets.UTF_8), "classpath:" + DEFAULT_RESOURCE);
    }
  }

  /**
   * Loads engine settings from {@code path}.
   *
   * @param path location of the YAML configuration
   * @return flat map of the {@code engine} section, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return Optional.of(parse(reader, path.toString()));
    }
  }

  /**
   * Parses engine settings from a reader.
   *
   * @param reader YAML source; not closed
   * @param source description used in error messages
   * @return flat map of the {@code engine} section; empty when the document or section is absent
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Map<String, String> parse(Reader reader, String source) {
    Objects.requireNonNull(reader, "reader");
    try {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return Map.of();
      }
      Object section = findSection(asMap(document, "root"), ENGINE_SECTION);
      if (section == null) {
        return Map.of();
      }
      Map<String, String> flattened = new LinkedHashMap<>();
      flatten(asMap(section, ENGINE_SECTION), "", flattened);
      return Map.copyOf(flattened);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + source, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String key) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(key)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML arrays are not supported for key " + composite);
      } else {
        target.put(composite, value.toString());
      }
    }
  }
}
