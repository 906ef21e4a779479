package ca.gc.cra.guardrails.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.guardrails.application.port.CachePort;
import ca.gc.cra.guardrails.application.port.MetricsPort;
import ca.gc.cra.guardrails.application.registry.CircuitBreaker;
import ca.gc.cra.guardrails.application.registry.GuardrailMetricsCollector;
import ca.gc.cra.guardrails.application.registry.GuardrailRegistry;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailCategory;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailContext;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailResult;
import ca.gc.cra.guardrails.domain.guardrail.PersonaGuardrailConfig;
import ca.gc.cra.guardrails.domain.guardrail.Severity;
import ca.gc.cra.guardrails.domain.guardrail.Snippet;
import ca.gc.cra.guardrails.support.MutableClock;
import ca.gc.cra.guardrails.support.RecordingMetricsPort;
import ca.gc.cra.guardrails.support.StubGuardrail;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class GuardrailCheckUseCaseTest {
  private final MutableClock clock = new MutableClock();

  @Test
  void blankQueryIsRejectedWithoutRunningGuardrails() {
    StubGuardrail length = StubGuardrail.allowing("length", GuardrailCategory.LENGTH);
    GuardrailCheckUseCase useCase = new GuardrailCheckUseCase(registry(new RecordingMetricsPort(), length));

    for (String query : new String[] {null, "", "   "}) {
      GuardrailResult result = useCase.check(query, List.of(), "default", "s1");
      assertFalse(result.allowed());
      assertEquals(GuardrailCategory.CUSTOM, result.category());
      assertEquals(Severity.MEDIUM, result.severity());
      assertEquals(GuardrailCheckUseCase.INVALID_QUERY_MESSAGE, result.reason());
    }
    assertEquals(0, length.calls());
  }

  @Test
  void buildsContextFromArguments() {
    AtomicReference<GuardrailContext> seen = new AtomicReference<>();
    StubGuardrail capture = StubGuardrail.scripted("capture", GuardrailCategory.RELEVANCE, (context, config) -> {
      seen.set(context);
      return GuardrailResult.allow(GuardrailCategory.RELEVANCE);
    });
    GuardrailRegistry registry = registry(new RecordingMetricsPort(), capture);
    registry.configurePersona("greeter", PersonaGuardrailConfig.enabling("capture"));
    GuardrailCheckUseCase useCase = new GuardrailCheckUseCase(registry);

    GuardrailResult result = useCase.check(
        "  How do I export?  ", List.of(Snippet.scored("Export from the File menu", 0.8)), "greeter", "s9");

    assertTrue(result.allowed());
    assertEquals("How do I export?", seen.get().query());
    assertEquals(1, seen.get().snippets().size());
    assertEquals("s9", seen.get().sessionId());
    assertEquals("greeter", seen.get().persona());
  }

  @Test
  void nullSnippetsAndPersonaUseDefaults() {
    AtomicReference<GuardrailContext> seen = new AtomicReference<>();
    StubGuardrail capture = StubGuardrail.scripted("capture", GuardrailCategory.LENGTH, (context, config) -> {
      seen.set(context);
      return GuardrailResult.allow(GuardrailCategory.LENGTH);
    });
    GuardrailCheckUseCase useCase = new GuardrailCheckUseCase(registry(new RecordingMetricsPort(), capture));

    assertTrue(useCase.check("What plans are available?", null, null, null).allowed());
    assertTrue(seen.get().snippets().isEmpty());
  }

  @Test
  void threeArgumentCheckIsAnonymous() {
    AtomicReference<GuardrailContext> seen = new AtomicReference<>();
    StubGuardrail capture = StubGuardrail.scripted("capture", GuardrailCategory.LENGTH, (context, config) -> {
      seen.set(context);
      return GuardrailResult.allow(GuardrailCategory.LENGTH);
    });
    GuardrailCheckUseCase useCase = new GuardrailCheckUseCase(registry(new RecordingMetricsPort(), capture));

    assertTrue(useCase.check("What plans are available?", List.of(), "default").allowed());
    assertNull(seen.get().sessionId());
  }

  @Test
  void blockingVerdictIsReturnedUnchanged() {
    GuardrailCheckUseCase useCase = new GuardrailCheckUseCase(registry(new RecordingMetricsPort(),
        StubGuardrail.blocking("pii", GuardrailCategory.PII, Severity.HIGH, "personal data")));

    GuardrailResult result = useCase.check(GuardrailContext.ofQuery("my SIN is 123-456-789"));

    assertFalse(result.allowed());
    assertEquals(GuardrailCategory.PII, result.category());
    assertEquals("personal data", result.reason());
  }

  @Test
  void unexpectedRegistryFailureAllowsWithErrorMetadata() {
    MetricsPort exploding = new MetricsPort() {
      @Override
      public void increment(String key) {
        throw new IllegalStateException("metrics backend down");
      }

      @Override
      public void observe(String key, long value) {}
    };
    GuardrailCheckUseCase useCase = new GuardrailCheckUseCase(
        registry(exploding, StubGuardrail.allowing("length", GuardrailCategory.LENGTH)));

    GuardrailResult result = useCase.check("How do I reset my password?", List.of(), null, "s1");

    assertTrue(result.allowed());
    assertEquals(GuardrailCategory.CUSTOM, result.category());
    assertEquals(GuardrailCheckUseCase.SYSTEM_ERROR_MESSAGE, result.metadata().get("error"));
  }

  private GuardrailRegistry registry(MetricsPort metrics, StubGuardrail... guardrails) {
    GuardrailRegistry registry = new GuardrailRegistry(
        CachePort.UNAVAILABLE,
        new CircuitBreaker("test-pipeline", CircuitBreaker.Settings.DEFAULTS, clock),
        new GuardrailMetricsCollector(metrics),
        clock,
        Duration.ofMinutes(5),
        Duration.ofSeconds(5));
    for (StubGuardrail guardrail : guardrails) {
      registry.register(guardrail);
    }
    return registry;
  }
}
