package ca.gc.cra.guardrails.application.registry;

import ca.gc.cra.guardrails.application.port.CachePort;
import ca.gc.cra.guardrails.application.port.ClockPort;
import ca.gc.cra.guardrails.application.port.Guardrail;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailCategory;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailConfig;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailContext;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailResult;
import ca.gc.cra.guardrails.domain.guardrail.PersonaGuardrailConfig;
import ca.gc.cra.guardrails.domain.guardrail.Severity;
import ca.gc.cra.guardrails.logging.Logs;
import ca.gc.cra.guardrails.validation.Strings;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Orchestrates the guardrail pipeline for a query: cache lookup, persona resolution,
 * ordered execution behind a circuit breaker, and metrics.
 * <p><strong>Why:</strong> Every answer attempt passes through here, so it must be fast on repeats, fail closed
 * on safety problems, and fail open on infrastructure problems.</p>
 * <p><strong>Failure model:</strong>
 * <ul>
 *   <li>A guardrail that throws is logged, metered, and skipped, unless it is a safety guardrail, which turns
 *   the failure into a critical block.</li>
 *   <li>A pipeline failure (open circuit, exhausted time budget, unexpected exception) yields an allowed result
 *   marked {@code degraded}.</li>
 *   <li>Cache failures are treated as misses.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent {@link #check} calls. Registration is synchronized;
 * persona configurations live in a concurrent map.</p>
 *
 * @since 0.1.0
 */
public final class GuardrailRegistry {
  /** Persona used when a check names none. */
  public static final String DEFAULT_PERSONA = "default";
  /** Pipeline operation keys used in {@link #getMetrics()}. */
  public static final String CACHE_HIT = "cache_hit";
  public static final String GUARDRAIL_CHECK = "guardrail_check";
  public static final String GUARDRAIL_ERROR = "guardrail_error";

  static final String CACHE_NAMESPACE = "guardrail";
  static final String SAFETY_ERROR_MESSAGE = "Safety validation system error. Query cannot be processed.";

  private static final Logger log = LoggerFactory.getLogger(GuardrailRegistry.class);
  private static final int QUERY_PREVIEW_BYTES = 64;

  private final Map<String, Guardrail> guardrails = new LinkedHashMap<>();
  private final ConcurrentMap<String, PersonaGuardrailConfig> personas = new ConcurrentHashMap<>();
  private final CachePort cache;
  private final CircuitBreaker breaker;
  private final GuardrailMetricsCollector metrics;
  private final ClockPort clock;
  private final Duration cacheTtl;
  private final long pipelineBudgetMillis;

  /**
   * Creates a registry.
   *
   * @param cache verdict cache; {@link CachePort#UNAVAILABLE} disables caching
   * @param breaker breaker wrapping pipeline execution
   * @param metrics metrics collector
   * @param clock time source for latency and the pipeline budget
   * @param cacheTtl time to live of cached allowed verdicts
   * @param pipelineBudget maximum pipeline duration, checked between guardrails
   */
  public GuardrailRegistry(
      CachePort cache,
      CircuitBreaker breaker,
      GuardrailMetricsCollector metrics,
      ClockPort clock,
      Duration cacheTtl,
      Duration pipelineBudget) {
    this.cache = Objects.requireNonNull(cache, "cache");
    this.breaker = Objects.requireNonNull(breaker, "breaker");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.cacheTtl = Objects.requireNonNull(cacheTtl, "cacheTtl");
    this.pipelineBudgetMillis = Objects.requireNonNull(pipelineBudget, "pipelineBudget").toMillis();
    if (cacheTtl.isZero() || cacheTtl.isNegative()) {
      throw new IllegalArgumentException("cacheTtl must be positive");
    }
    if (pipelineBudgetMillis <= 0) {
      throw new IllegalArgumentException("pipelineBudget must be positive");
    }
  }

  /**
   * Registers a guardrail, replacing any guardrail with the same name.
   *
   * @param guardrail guardrail to register
   */
  public void register(Guardrail guardrail) {
    Objects.requireNonNull(guardrail, "guardrail");
    String name = Strings.requireNonBlank("guardrail name", guardrail.name());
    Guardrail previous;
    synchronized (guardrails) {
      previous = guardrails.put(name, guardrail);
    }
    if (previous != null) {
      log.warn("Guardrail re-registered, overwriting guardrail={}", name);
    } else {
      log.debug("Guardrail registered guardrail={} category={}", name, guardrail.category().id());
    }
  }

  /**
   * Removes a guardrail.
   *
   * @param name guardrail name
   * @return {@code true} when a guardrail was removed
   */
  public boolean unregister(String name) {
    synchronized (guardrails) {
      return guardrails.remove(name) != null;
    }
  }

  public Optional<Guardrail> get(String name) {
    synchronized (guardrails) {
      return Optional.ofNullable(guardrails.get(name));
    }
  }

  /**
   * Lists registered guardrails in registration order.
   *
   * @return immutable snapshot
   */
  public List<Guardrail> list() {
    synchronized (guardrails) {
      return List.copyOf(guardrails.values());
    }
  }

  public List<Guardrail> listByCategory(GuardrailCategory category) {
    Objects.requireNonNull(category, "category");
    return list().stream().filter(guardrail -> guardrail.category() == category).toList();
  }

  /**
   * Stores a persona's configuration under its lower-cased name. Enabled names that are not registered are
   * dropped with a warning; persona configurations last for the life of the registry.
   *
   * @param persona persona name
   * @param config configuration
   * @throws ca.gc.cra.guardrails.domain.guardrail.InvalidPersonaConfigException when the configuration is
   *     invalid
   */
  public void configurePersona(String persona, PersonaGuardrailConfig config) {
    String key = personaKey(Strings.requireNonBlank("persona", persona));
    Objects.requireNonNull(config, "config");
    List<String> retained = new ArrayList<>();
    List<String> dropped = new ArrayList<>();
    synchronized (guardrails) {
      for (String name : config.enabled()) {
        (guardrails.containsKey(name) ? retained : dropped).add(name);
      }
    }
    if (!dropped.isEmpty()) {
      log.warn("Persona references unknown guardrails, ignoring persona={} guardrails={}", key, dropped);
    }
    personas.put(key, config.withEnabled(retained));
    log.info("Persona configured persona={} enabled={}", key, retained);
  }

  /**
   * Parses and stores a persona configuration given as a raw mapping.
   *
   * @param persona persona name
   * @param raw mapping with an {@code enabled} list and optional {@code guardrails} mapping
   * @throws ca.gc.cra.guardrails.domain.guardrail.InvalidPersonaConfigException when {@code enabled} is not a
   *     list
   */
  public void configurePersona(String persona, Map<String, ?> raw) {
    configurePersona(persona, PersonaGuardrailConfig.fromMap(raw));
  }

  public Optional<PersonaGuardrailConfig> getPersonaConfig(String persona) {
    if (persona == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(personas.get(personaKey(persona)));
  }

  /**
   * Checks a query, serving repeats from the cache and degrading to an allowed result when the pipeline fails.
   *
   * @param context query context
   * @param persona persona name; {@code null} or blank selects {@value #DEFAULT_PERSONA}
   * @return verdict; never {@code null}
   */
  public GuardrailResult check(GuardrailContext context, String persona) {
    Objects.requireNonNull(context, "context");
    long start = clock.nowMillis();
    String personaName = persona == null || persona.isBlank() ? DEFAULT_PERSONA : personaKey(persona);
    String cacheKey = cacheKey(personaName, context.query());

    if (cache.isAvailable()) {
      try {
        Optional<GuardrailResult> cached = cache.get(cacheKey, GuardrailResult.class);
        if (cached.isPresent()) {
          metrics.record(CACHE_HIT, GuardrailCategory.CUSTOM, clock.nowMillis() - start, cached.get().allowed());
          log.debug("Guardrail verdict served from cache persona={}", personaName);
          return cached.get();
        }
      } catch (RuntimeException ex) {
        log.warn("Guardrail cache read failed, continuing persona={}", personaName, ex);
      }
    }

    GuardrailResult result;
    try {
      result = breaker.execute(() -> executeGuardrails(context, personaName));
    } catch (RuntimeException ex) {
      log.error("Guardrail check failed, allowing query in degraded mode persona={} session={}",
          personaName, context.sessionId(), ex);
      metrics.recordError(GUARDRAIL_ERROR, clock.nowMillis() - start);
      return degraded(ex);
    }

    if (result.allowed() && cache.isAvailable()) {
      try {
        cache.put(cacheKey, result, cacheTtl);
      } catch (RuntimeException ex) {
        log.warn("Guardrail cache write failed persona={}", personaName, ex);
      }
    }
    metrics.record(GUARDRAIL_CHECK, result.category(), clock.nowMillis() - start, result.allowed());
    return result;
  }

  /**
   * Runs the persona's guardrails in order without cache or circuit breaker; stops at the first block.
   *
   * @param context query context
   * @param persona persona name
   * @return first blocking verdict, or an allowed verdict with category {@code custom}
   * @throws PipelineTimeoutException when the time budget runs out between guardrails
   */
  public GuardrailResult executeGuardrails(GuardrailContext context, String persona) {
    Optional<PersonaGuardrailConfig> personaConfig = getPersonaConfig(persona);
    List<Guardrail> ordered = GuardrailOrdering.order(resolve(personaConfig));
    TimeBudget budget = TimeBudget.start(clock, pipelineBudgetMillis);

    for (int i = 0; i < ordered.size(); i++) {
      Guardrail guardrail = ordered.get(i);
      GuardrailConfig config = personaConfig
          .map(value -> value.configFor(guardrail.name()))
          .orElse(GuardrailConfig.ENABLED);
      if (!config.enabled()) {
        continue;
      }
      if (i > 0) {
        budget.ensureRemaining(guardrail.name());
      }

      String metricKey = "guardrail:" + guardrail.name();
      long checkStart = clock.nowMillis();
      GuardrailResult result;
      try {
        result = Objects.requireNonNull(guardrail.check(context, config), "guardrail returned no result");
      } catch (RuntimeException ex) {
        log.error("Guardrail failed guardrail={} category={} session={}",
            guardrail.name(), guardrail.category().id(), context.sessionId(), ex);
        metrics.recordError(metricKey, 0L);
        if (guardrail.category() == GuardrailCategory.SAFETY) {
          return GuardrailResult.block(GuardrailCategory.SAFETY, Severity.CRITICAL, SAFETY_ERROR_MESSAGE);
        }
        continue;
      }

      long latency = clock.nowMillis() - checkStart;
      metrics.record(metricKey, result.category(), latency, result.allowed());
      if (!result.allowed()) {
        log.warn("Query blocked guardrail={} category={} severity={} session={} latencyMs={}",
            guardrail.name(), result.category().id(), result.severity(), context.sessionId(), latency);
        if (log.isDebugEnabled()) {
          String preview = result.category() == GuardrailCategory.PII
              ? Logs.redact(context.query())
              : Logs.truncate(context.query(), QUERY_PREVIEW_BYTES);
          log.debug("Blocked query guardrail={} query={} metadata={}", guardrail.name(), preview,
              result.metadata());
        }
        return result;
      }
    }
    return GuardrailResult.allow(GuardrailCategory.CUSTOM);
  }

  /**
   * Returns counters and latency percentiles per operation and per guardrail.
   *
   * @return snapshot keyed by {@code cache_hit}, {@code guardrail_check}, {@code guardrail_error}, and
   *     {@code guardrail:<name>}
   */
  public Map<String, MetricsSnapshot> getMetrics() {
    return metrics.snapshot();
  }

  public void clearMetrics() {
    metrics.clear();
  }

  /**
   * Drops cached verdicts, for example after persona changes.
   */
  public void clearCache() {
    if (!cache.isAvailable()) {
      return;
    }
    try {
      cache.clear(CACHE_NAMESPACE);
    } catch (RuntimeException ex) {
      log.warn("Guardrail cache clear failed", ex);
    }
  }

  public CircuitState circuitState() {
    return breaker.state();
  }

  private List<Guardrail> resolve(Optional<PersonaGuardrailConfig> personaConfig) {
    synchronized (guardrails) {
      if (personaConfig.isEmpty()) {
        return new ArrayList<>(guardrails.values());
      }
      List<Guardrail> resolved = new ArrayList<>();
      for (String name : personaConfig.get().enabled()) {
        Guardrail guardrail = guardrails.get(name);
        if (guardrail != null) {
          resolved.add(guardrail);
        }
      }
      return resolved;
    }
  }

  private static GuardrailResult degraded(RuntimeException ex) {
    String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    return GuardrailResult.allow(GuardrailCategory.CUSTOM)
        .withMetadata("degraded", Boolean.TRUE)
        .withMetadata("error", message);
  }

  static String cacheKey(String persona, String query) {
    String normalized = query.trim().toLowerCase(Locale.ROOT);
    return CACHE_NAMESPACE + ":" + persona + ":" + sha256(normalized);
  }

  private static String sha256(String value) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available", ex);
    }
  }

  private static String personaKey(String persona) {
    return persona.trim().toLowerCase(Locale.ROOT);
  }
}
