package ca.gc.cra.guardrails.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.guardrails.domain.guardrail.GuardrailConfig;
import ca.gc.cra.guardrails.domain.guardrail.InvalidPersonaConfigException;
import ca.gc.cra.guardrails.domain.guardrail.PersonaGuardrailConfig;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PersonaConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void bundledPersonasAreLoadedInDocumentOrder() throws IOException {
    Map<String, PersonaGuardrailConfig> personas = PersonaConfigLoader.loadDefaults();

    assertEquals(
        List.of("default", "greeter", "moderator", "escalator", "strict", "lenient", "technical"),
        List.copyOf(personas.keySet()));
    assertEquals(List.of("safety", "off_topic", "relevance"), personas.get("lenient").enabled());
    assertFalse(personas.get("greeter").enabled().contains("spam"));
  }

  @Test
  void moderatorIsTightened() throws IOException {
    PersonaGuardrailConfig moderator = PersonaConfigLoader.loadDefaults().get("moderator");

    GuardrailConfig spam = moderator.configFor("spam");
    assertEquals(2, spam.integer("maxRepeats", 0));
    assertEquals(30_000L, spam.longValue("timeWindowMs", 0L));
    assertEquals(1000, moderator.configFor("length").integer("maxLength", 0));
    assertTrue(moderator.configFor("pii").bool("checkIP", false));
    assertEquals(0.4, moderator.configFor("relevance").decimal("minScore", 0.0));
  }

  @Test
  void unconfiguredGuardrailDefaultsToEnabled() throws IOException {
    PersonaGuardrailConfig technical = PersonaConfigLoader.loadDefaults().get("technical");

    assertEquals(GuardrailConfig.ENABLED, technical.configFor("spam"));
    assertFalse(technical.configFor("off_topic").enabled());
  }

  @Test
  void loadsPersonaFile() throws IOException {
    Path yaml = tempDir.resolve("personas.yaml");
    Files.writeString(yaml, """
        version: 1
        personas:
          support-bot:
            enabled: [safety, length]
            guardrails:
              length: { maxLength: 300 }
        """);

    Map<String, PersonaGuardrailConfig> personas = PersonaConfigLoader.load(yaml);

    assertEquals(List.of("safety", "length"), personas.get("support-bot").enabled());
    assertEquals(300, personas.get("support-bot").configFor("length").integer("maxLength", 0));
  }

  @Test
  void missingFileIsAnIoError() {
    assertThrows(IOException.class, () -> PersonaConfigLoader.load(tempDir.resolve("absent.yaml")));
    assertThrows(IOException.class, () -> PersonaConfigLoader.loadResource("guardrails/absent.yaml"));
  }

  @Test
  void unsupportedVersionIsRejected() {
    InvalidPersonaConfigException ex = assertThrows(InvalidPersonaConfigException.class,
        () -> PersonaConfigLoader.parse(new StringReader("version: 2\npersonas: {}\n"), "inline"));
    assertTrue(ex.getMessage().contains("version 2"));
    assertThrows(InvalidPersonaConfigException.class,
        () -> PersonaConfigLoader.parse(new StringReader("personas: {}\n"), "inline"));
  }

  @Test
  void enabledMustBeAList() {
    InvalidPersonaConfigException ex = assertThrows(InvalidPersonaConfigException.class,
        () -> PersonaConfigLoader.parse(new StringReader("""
            version: 1
            personas:
              greeter:
                enabled: safety
            """), "inline"));
    assertTrue(ex.getMessage().startsWith("personas.greeter in inline"));
  }

  @Test
  void nonBooleanEnabledFlagIsRejected() {
    assertThrows(InvalidPersonaConfigException.class,
        () -> PersonaConfigLoader.parse(new StringReader("""
            version: 1
            personas:
              greeter:
                enabled: [spam]
                guardrails:
                  spam: { enabled: sometimes }
            """), "inline"));
  }

  @Test
  void personaNamesMustBeIdentifiers() {
    assertThrows(IllegalArgumentException.class,
        () -> PersonaConfigLoader.parse(new StringReader("""
            version: 1
            personas:
              "bad name":
                enabled: []
            """), "inline"));
  }
}
