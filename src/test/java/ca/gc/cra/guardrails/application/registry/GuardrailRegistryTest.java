package ca.gc.cra.guardrails.application.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.guardrails.application.port.CachePort;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailCategory;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailConfig;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailContext;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailResult;
import ca.gc.cra.guardrails.domain.guardrail.InvalidPersonaConfigException;
import ca.gc.cra.guardrails.domain.guardrail.PersonaGuardrailConfig;
import ca.gc.cra.guardrails.domain.guardrail.Severity;
import ca.gc.cra.guardrails.infrastructure.cache.InMemoryCacheAdapter;
import ca.gc.cra.guardrails.support.FailingCachePort;
import ca.gc.cra.guardrails.support.MutableClock;
import ca.gc.cra.guardrails.support.RecordingMetricsPort;
import ca.gc.cra.guardrails.support.StubGuardrail;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class GuardrailRegistryTest {
  private static final String QUERY = "How do I export my project?";

  private final MutableClock clock = new MutableClock();
  private final RecordingMetricsPort metricsPort = new RecordingMetricsPort();
  private final InMemoryCacheAdapter cache = new InMemoryCacheAdapter(clock);

  @Test
  void safetyBlockShortCircuitsLaterGuardrails() {
    GuardrailRegistry registry = newRegistry(cache);
    StubGuardrail pii = StubGuardrail.allowing("pii", GuardrailCategory.PII);
    registry.register(pii);
    registry.register(StubGuardrail.blocking("safety", GuardrailCategory.SAFETY, Severity.CRITICAL, "unsafe"));

    GuardrailResult result = registry.check(GuardrailContext.ofQuery(QUERY), null);

    assertFalse(result.allowed());
    assertEquals(GuardrailCategory.SAFETY, result.category());
    assertEquals(Severity.CRITICAL, result.severity());
    assertEquals(0, pii.calls());
  }

  @Test
  void personaGuardrailsRunSafetyFirstAndRelevanceBeforeOffTopic() {
    GuardrailRegistry registry = newRegistry(cache);
    List<String> journal = new ArrayList<>();
    registry.register(StubGuardrail.allowing("length", GuardrailCategory.LENGTH, journal));
    registry.register(StubGuardrail.allowing("off_topic", GuardrailCategory.OFF_TOPIC, journal));
    registry.register(StubGuardrail.allowing("relevance", GuardrailCategory.RELEVANCE, journal));
    registry.register(StubGuardrail.allowing("safety", GuardrailCategory.SAFETY, journal));
    registry.configurePersona("ordered",
        PersonaGuardrailConfig.enabling("length", "off_topic", "relevance", "safety"));

    GuardrailResult result = registry.check(GuardrailContext.ofQuery(QUERY), "ordered");

    assertTrue(result.allowed());
    assertEquals(GuardrailCategory.CUSTOM, result.category());
    assertEquals(List.of("safety", "length", "relevance", "off_topic"), journal);
  }

  @Test
  void allowedVerdictsAreServedFromCache() {
    GuardrailRegistry registry = newRegistry(cache);
    StubGuardrail length = StubGuardrail.allowing("length", GuardrailCategory.LENGTH);
    registry.register(length);

    assertTrue(registry.check(GuardrailContext.ofQuery(QUERY), null).allowed());
    assertTrue(registry.check(GuardrailContext.ofQuery("  " + QUERY.toUpperCase() + " "), null).allowed());

    assertEquals(1, length.calls());
    assertEquals(1L, metricsPort.counter("guardrails.cache_hit.allowed"));
    assertEquals(1L, registry.getMetrics().get(GuardrailRegistry.CACHE_HIT).totalChecks());
    assertTrue(cache.get(GuardrailRegistry.cacheKey("default", QUERY), GuardrailResult.class).isPresent());
  }

  @Test
  void cachedVerdictsAreScopedByPersona() {
    GuardrailRegistry registry = newRegistry(cache);
    StubGuardrail length = StubGuardrail.allowing("length", GuardrailCategory.LENGTH);
    registry.register(length);

    registry.check(GuardrailContext.ofQuery(QUERY), "greeter");
    registry.check(GuardrailContext.ofQuery(QUERY), "Greeter");
    registry.check(GuardrailContext.ofQuery(QUERY), "moderator");

    assertEquals(2, length.calls());
  }

  @Test
  void blockedVerdictsAreNeverCached() {
    GuardrailRegistry registry = newRegistry(cache);
    StubGuardrail profanity =
        StubGuardrail.blocking("profanity", GuardrailCategory.PROFANITY, Severity.MEDIUM, "language");
    registry.register(profanity);

    assertFalse(registry.check(GuardrailContext.ofQuery(QUERY), null).allowed());
    assertFalse(registry.check(GuardrailContext.ofQuery(QUERY), null).allowed());

    assertEquals(2, profanity.calls());
    assertTrue(cache.get(GuardrailRegistry.cacheKey("default", QUERY), GuardrailResult.class).isEmpty());
    assertEquals(2L, metricsPort.counter("guardrails.guardrail_check.blocked"));
    assertEquals(2L, metricsPort.counter("guardrails.guardrail.profanity.blocked"));
  }

  @Test
  void clearCacheForcesReevaluation() {
    GuardrailRegistry registry = newRegistry(cache);
    StubGuardrail length = StubGuardrail.allowing("length", GuardrailCategory.LENGTH);
    registry.register(length);

    registry.check(GuardrailContext.ofQuery(QUERY), null);
    registry.clearCache();
    registry.check(GuardrailContext.ofQuery(QUERY), null);

    assertEquals(2, length.calls());
  }

  @Test
  void cacheExpiresAfterTtl() {
    GuardrailRegistry registry = newRegistry(cache);
    StubGuardrail length = StubGuardrail.allowing("length", GuardrailCategory.LENGTH);
    registry.register(length);

    registry.check(GuardrailContext.ofQuery(QUERY), null);
    clock.advance(Duration.ofMinutes(5).toMillis() + 1);
    registry.check(GuardrailContext.ofQuery(QUERY), null);

    assertEquals(2, length.calls());
  }

  @Test
  void configurePersonaDropsUnknownGuardrails() {
    GuardrailRegistry registry = newRegistry(cache);
    registry.register(StubGuardrail.allowing("length", GuardrailCategory.LENGTH));

    registry.configurePersona("Moderator", PersonaGuardrailConfig.enabling("length", "ghost"));

    PersonaGuardrailConfig stored = registry.getPersonaConfig("moderator").orElseThrow();
    assertEquals(List.of("length"), stored.enabled());
    assertTrue(registry.getPersonaConfig("unknown").isEmpty());
  }

  @Test
  void configurePersonaRejectsRawMapWithoutEnabledList() {
    GuardrailRegistry registry = newRegistry(cache);

    assertThrows(InvalidPersonaConfigException.class,
        () -> registry.configurePersona("broken", Map.of("enabled", "length")));
    assertThrows(InvalidPersonaConfigException.class,
        () -> registry.configurePersona("broken", Map.of("guardrails", Map.of())));
  }

  @Test
  void disabledGuardrailsAreSkippedAndOptionsArePassedThrough() {
    GuardrailRegistry registry = newRegistry(cache);
    StubGuardrail pii = StubGuardrail.allowing("pii", GuardrailCategory.PII);
    StubGuardrail length = StubGuardrail.allowing("length", GuardrailCategory.LENGTH);
    registry.register(pii);
    registry.register(length);
    registry.configurePersona("greeter", Map.of(
        "enabled", List.of("pii", "length"),
        "guardrails", Map.of(
            "pii", Map.of("enabled", false),
            "length", Map.of("maxLength", 500))));

    assertTrue(registry.check(GuardrailContext.ofQuery(QUERY), "greeter").allowed());

    assertEquals(0, pii.calls());
    assertEquals(1, length.calls());
    assertEquals(500, length.lastConfig().integer("maxLength", 0));
  }

  @Test
  void unconfiguredPersonaRunsEveryRegisteredGuardrail() {
    GuardrailRegistry registry = newRegistry(cache);
    StubGuardrail pii = StubGuardrail.allowing("pii", GuardrailCategory.PII);
    StubGuardrail length = StubGuardrail.allowing("length", GuardrailCategory.LENGTH);
    registry.register(pii);
    registry.register(length);

    registry.check(GuardrailContext.ofQuery(QUERY), "nobody");

    assertEquals(1, pii.calls());
    assertEquals(1, length.calls());
    assertEquals(GuardrailConfig.ENABLED, length.lastConfig());
  }

  @Test
  void failingSafetyGuardrailBlocksQuery() {
    GuardrailRegistry registry = newRegistry(cache);
    registry.register(StubGuardrail.throwing("safety", GuardrailCategory.SAFETY));
    StubGuardrail length = StubGuardrail.allowing("length", GuardrailCategory.LENGTH);
    registry.register(length);

    GuardrailResult result = registry.check(GuardrailContext.ofQuery(QUERY), null);

    assertFalse(result.allowed());
    assertEquals(Severity.CRITICAL, result.severity());
    assertEquals(GuardrailRegistry.SAFETY_ERROR_MESSAGE, result.reason());
    assertEquals(0, length.calls());
    assertEquals(1L, registry.getMetrics().get("guardrail:safety").errors());
  }

  @Test
  void failingNonSafetyGuardrailIsSkipped() {
    GuardrailRegistry registry = newRegistry(cache);
    registry.register(StubGuardrail.throwing("broken", GuardrailCategory.PII));
    StubGuardrail length = StubGuardrail.allowing("length", GuardrailCategory.LENGTH);
    registry.register(length);

    GuardrailResult result = registry.check(GuardrailContext.ofQuery(QUERY), null);

    assertTrue(result.allowed());
    assertFalse(result.degraded());
    assertEquals(1, length.calls());
    MetricsSnapshot broken = registry.getMetrics().get("guardrail:broken");
    assertEquals(1L, broken.errors());
    assertEquals(Map.of("custom", 1L), broken.byCategory());
    assertEquals(1L, metricsPort.counter("guardrails.guardrail.broken.error"));
  }

  @Test
  void nullVerdictCountsAsGuardrailError() {
    GuardrailRegistry registry = newRegistry(cache);
    registry.register(StubGuardrail.scripted("silent", GuardrailCategory.LENGTH, (context, config) -> null));

    GuardrailResult result = registry.check(GuardrailContext.ofQuery(QUERY), null);

    assertTrue(result.allowed());
    assertEquals(1L, registry.getMetrics().get("guardrail:silent").errors());
  }

  @Test
  void failingCacheIsTreatedAsMiss() {
    FailingCachePort failing = new FailingCachePort();
    GuardrailRegistry registry = newRegistry(failing);
    StubGuardrail length = StubGuardrail.allowing("length", GuardrailCategory.LENGTH);
    registry.register(length);

    GuardrailResult first = registry.check(GuardrailContext.ofQuery(QUERY), null);
    GuardrailResult second = registry.check(GuardrailContext.ofQuery(QUERY), null);

    assertTrue(first.allowed());
    assertFalse(first.degraded());
    assertTrue(second.allowed());
    assertEquals(2, length.calls());
    assertEquals(4, failing.calls());
    registry.clearCache();
  }

  @Test
  void unavailableCacheIsNeverCalled() {
    GuardrailRegistry registry = newRegistry(CachePort.UNAVAILABLE);
    StubGuardrail length = StubGuardrail.allowing("length", GuardrailCategory.LENGTH);
    registry.register(length);

    registry.check(GuardrailContext.ofQuery(QUERY), null);
    registry.check(GuardrailContext.ofQuery(QUERY), null);

    assertEquals(2, length.calls());
  }

  @Test
  void repeatedTimeoutsOpenCircuitAndDegradeUntilReset() {
    GuardrailRegistry registry = newRegistry(CachePort.UNAVAILABLE);
    AtomicBoolean slow = new AtomicBoolean(true);
    StubGuardrail first = StubGuardrail.scripted("first", GuardrailCategory.LENGTH, (context, config) -> {
      if (slow.get()) {
        clock.advance(6_000L);
      }
      return GuardrailResult.allow(GuardrailCategory.LENGTH);
    });
    StubGuardrail second = StubGuardrail.allowing("second", GuardrailCategory.PII);
    registry.register(first);
    registry.register(second);

    for (int i = 0; i < 10; i++) {
      GuardrailResult result = registry.check(GuardrailContext.ofQuery(QUERY + i), null);
      assertTrue(result.allowed());
      assertTrue(result.degraded());
      assertTrue(String.valueOf(result.metadata().get("error")).contains("exceeded"));
    }
    assertEquals(CircuitState.OPEN, registry.circuitState());
    assertEquals(0, second.calls());

    GuardrailResult rejected = registry.check(GuardrailContext.ofQuery("another question"), null);
    assertTrue(rejected.degraded());
    assertEquals(10, first.calls());
    assertEquals(11L, registry.getMetrics().get(GuardrailRegistry.GUARDRAIL_ERROR).errors());

    slow.set(false);
    clock.advance(Duration.ofSeconds(30).toMillis());
    assertFalse(registry.check(GuardrailContext.ofQuery("recovered one"), null).degraded());
    assertEquals(CircuitState.HALF_OPEN, registry.circuitState());
    assertFalse(registry.check(GuardrailContext.ofQuery("recovered two"), null).degraded());
    assertEquals(CircuitState.CLOSED, registry.circuitState());
    assertEquals(2, second.calls());
  }

  @Test
  void blockedQueryIsLoggedAtWarn() {
    GuardrailRegistry registry = newRegistry(cache);
    registry.register(StubGuardrail.blocking("spam", GuardrailCategory.SPAM, Severity.LOW, "too short"));

    Logger logger = (Logger) LoggerFactory.getLogger(GuardrailRegistry.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    boolean originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);
    try {
      registry.check(GuardrailContext.builder("hi").sessionId("session-7").build(), null);
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      appender.stop();
    }

    List<ILoggingEvent> warnings = appender.list.stream()
        .filter(event -> event.getLevel() == Level.WARN)
        .toList();
    assertEquals(1, warnings.size());
    String message = warnings.get(0).getFormattedMessage();
    assertTrue(message.startsWith("Query blocked guardrail=spam"));
    assertTrue(message.contains("session=session-7"));
  }

  @Test
  void registrationIsKeyedByName() {
    GuardrailRegistry registry = newRegistry(cache);
    StubGuardrail original = StubGuardrail.allowing("length", GuardrailCategory.LENGTH);
    StubGuardrail replacement = StubGuardrail.allowing("length", GuardrailCategory.LENGTH);
    registry.register(original);
    registry.register(replacement);
    registry.register(StubGuardrail.allowing("pii", GuardrailCategory.PII));

    assertEquals(2, registry.list().size());
    assertEquals(replacement, registry.get("length").orElseThrow());
    assertEquals(1, registry.listByCategory(GuardrailCategory.PII).size());
    assertTrue(registry.unregister("pii"));
    assertFalse(registry.unregister("pii"));
    assertTrue(registry.get("pii").isEmpty());
  }

  @Test
  void clearMetricsDropsEverySnapshot() {
    GuardrailRegistry registry = newRegistry(cache);
    registry.register(StubGuardrail.allowing("length", GuardrailCategory.LENGTH));
    registry.check(GuardrailContext.ofQuery(QUERY), null);
    assertFalse(registry.getMetrics().isEmpty());

    registry.clearMetrics();

    assertTrue(registry.getMetrics().isEmpty());
  }

  @Test
  void cacheKeyNormalizesQuery() {
    assertEquals(GuardrailRegistry.cacheKey("default", "Hello World"),
        GuardrailRegistry.cacheKey("default", "  hello world "));
    assertTrue(GuardrailRegistry.cacheKey("greeter", "x").startsWith("guardrail:greeter:"));
    assertEquals("guardrail:greeter:".length() + 64, GuardrailRegistry.cacheKey("greeter", "x").length());
  }

  private GuardrailRegistry newRegistry(CachePort cachePort) {
    return new GuardrailRegistry(
        cachePort,
        new CircuitBreaker("test-pipeline", CircuitBreaker.Settings.DEFAULTS, clock),
        new GuardrailMetricsCollector(metricsPort),
        clock,
        Duration.ofMinutes(5),
        Duration.ofSeconds(5));
  }
}
