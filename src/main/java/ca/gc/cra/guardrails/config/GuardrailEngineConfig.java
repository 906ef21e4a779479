package ca.gc.cra.guardrails.config;

import ca.gc.cra.guardrails.application.guardrail.SpamGuardrail;
import ca.gc.cra.guardrails.application.registry.CircuitBreaker;
import ca.gc.cra.guardrails.validation.Numbers;
import ca.gc.cra.guardrails.validation.Strings;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Validated engine settings: breaker thresholds, cache behaviour, pipeline budget, spam
 * store limits, and metrics export.
 * <p><strong>Source:</strong> Built from the flat map produced by {@link YamlConfigLoader}; every key is
 * optional.</p>
 *
 * @param breaker circuit breaker thresholds
 * @param cacheTtl time to live of cached allowed verdicts
 * @param cacheTimeout per-call timeout applied to an external cache
 * @param cacheMaxEntries entry cap of the in-process cache
 * @param pipelineBudget pipeline time budget
 * @param spam spam fallback store settings
 * @param metricsExporter {@code none} or {@code otlp}
 * @param metricsEndpoint optional OTLP endpoint override
 * @param verboseLogging whether to raise guardrail logging to DEBUG at start-up
 * @param personasPath optional persona file replacing the bundled defaults
 * @since 0.1.0
 */
public record GuardrailEngineConfig(
    CircuitBreaker.Settings breaker,
    Duration cacheTtl,
    Duration cacheTimeout,
    long cacheMaxEntries,
    Duration pipelineBudget,
    SpamGuardrail.Settings spam,
    String metricsExporter,
    Optional<String> metricsEndpoint,
    boolean verboseLogging,
    Optional<String> personasPath) {

  public GuardrailEngineConfig {
    Objects.requireNonNull(breaker, "breaker");
    Objects.requireNonNull(cacheTtl, "cacheTtl");
    Objects.requireNonNull(cacheTimeout, "cacheTimeout");
    Objects.requireNonNull(pipelineBudget, "pipelineBudget");
    Objects.requireNonNull(spam, "spam");
    metricsExporter = Strings.requireOneOf("metrics.exporter", metricsExporter, "none", "otlp", "otel");
    if ("otel".equals(metricsExporter)) {
      metricsExporter = "otlp";
    }
    metricsEndpoint = Objects.requireNonNullElse(metricsEndpoint, Optional.empty());
    personasPath = Objects.requireNonNullElse(personasPath, Optional.empty());
  }

  /**
   * Returns the configuration with every default applied.
   *
   * @return defaults
   */
  public static GuardrailEngineConfig defaults() {
    return fromMap(Map.of());
  }

  /**
   * Returns the configuration described by the bundled {@code guardrails/engine.yaml}.
   *
   * @return bundled configuration
   * @throws IOException when the resource is missing or unreadable
   */
  public static GuardrailEngineConfig bundled() throws IOException {
    return fromMap(YamlConfigLoader.loadDefaults());
  }

  /**
   * Loads a configuration from a YAML file with an {@code engine} section.
   *
   * @param path configuration file
   * @return validated configuration
   * @throws NoSuchFileException when the file does not exist
   * @throws IOException when the file cannot be read
   */
  public static GuardrailEngineConfig load(Path path) throws IOException {
    return YamlConfigLoader.load(path)
        .map(GuardrailEngineConfig::fromMap)
        .orElseThrow(() -> new NoSuchFileException(path.toString()));
  }

  /**
   * Builds a configuration from flat keys.
   *
   * @param values flat keys such as {@code breaker.failureThreshold}; missing keys take defaults
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static GuardrailEngineConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");

    int failureThreshold = (int) range(values, "breaker.failureThreshold", 10, 1, 10_000);
    int successThreshold = (int) range(values, "breaker.successThreshold", 2, 1, 1_000);
    long resetTimeoutMillis = range(values, "breaker.resetTimeoutMillis", 30_000, 0, 3_600_000);
    CircuitBreaker.Settings breaker =
        new CircuitBreaker.Settings(failureThreshold, successThreshold, Duration.ofMillis(resetTimeoutMillis));

    long cacheTtlSeconds = range(values, "cache.ttlSeconds", 60, 1, 86_400);
    long cacheTimeoutMillis = range(values, "cache.timeoutMillis", 250, 1, 60_000);
    long cacheMaxEntries = range(values, "cache.maxEntries", 50_000, 1, 10_000_000);
    long budgetMillis = range(values, "pipeline.budgetMillis", 5_000, 1, 600_000);

    long cleanupMillis = range(values, "spam.cleanupIntervalMillis", 300_000, 1_000, 86_400_000);
    long maxAgeMillis = range(values, "spam.maxAgeMillis", 3_600_000, 1_000, 604_800_000);
    int maxSessions = (int) range(values, "spam.maxSessions", 10_000, 1, 10_000_000);
    int retainSessions = (int) range(values, "spam.retainSessions", 5_000, 1, maxSessions);
    SpamGuardrail.Settings spam = new SpamGuardrail.Settings(
        Duration.ofMillis(cleanupMillis), Duration.ofMillis(maxAgeMillis), maxSessions, retainSessions);

    String exporter = text(values, "metrics.exporter").orElse("none");
    Optional<String> endpoint = text(values, "metrics.endpoint");
    boolean verbose = bool(values, "logging.verbose");
    Optional<String> personas = text(values, "personas.path");

    return new GuardrailEngineConfig(
        breaker,
        Duration.ofSeconds(cacheTtlSeconds),
        Duration.ofMillis(cacheTimeoutMillis),
        cacheMaxEntries,
        Duration.ofMillis(budgetMillis),
        spam,
        exporter,
        endpoint,
        verbose,
        personas);
  }

  private static long range(Map<String, String> values, String key, long defaultValue, long min, long max) {
    long value = Numbers.parseLong(key, values.get(key), defaultValue);
    return Numbers.requireRange(key, value, min, max);
  }

  private static Optional<String> text(Map<String, String> values, String key) {
    String raw = values.get(key);
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(Strings.requireNonBlank(key, raw));
  }

  private static boolean bool(Map<String, String> values, String key) {
    Optional<String> raw = text(values, key);
    if (raw.isEmpty()) {
      return false;
    }
    String normalized = raw.get().toLowerCase(Locale.ROOT);
    if (!normalized.equals("true") && !normalized.equals("false")) {
      throw new IllegalArgumentException(key + " must be true or false (was " + raw.get() + ")");
    }
    return Boolean.parseBoolean(normalized);
  }
}
