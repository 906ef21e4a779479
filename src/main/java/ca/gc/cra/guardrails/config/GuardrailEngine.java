package ca.gc.cra.guardrails.config;

import ca.gc.cra.guardrails.application.guardrail.LengthGuardrail;
import ca.gc.cra.guardrails.application.guardrail.OffTopicGuardrail;
import ca.gc.cra.guardrails.application.guardrail.PiiGuardrail;
import ca.gc.cra.guardrails.application.guardrail.ProfanityGuardrail;
import ca.gc.cra.guardrails.application.guardrail.RelevanceGuardrail;
import ca.gc.cra.guardrails.application.guardrail.SafetyGuardrail;
import ca.gc.cra.guardrails.application.guardrail.SpamGuardrail;
import ca.gc.cra.guardrails.application.pipeline.GuardrailCheckUseCase;
import ca.gc.cra.guardrails.application.port.CachePort;
import ca.gc.cra.guardrails.application.port.ClockPort;
import ca.gc.cra.guardrails.application.port.Guardrail;
import ca.gc.cra.guardrails.application.port.MetricsPort;
import ca.gc.cra.guardrails.application.registry.CircuitBreaker;
import ca.gc.cra.guardrails.application.registry.GuardrailMetricsCollector;
import ca.gc.cra.guardrails.application.registry.GuardrailRegistry;
import ca.gc.cra.guardrails.application.registry.MetricsSnapshot;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailContext;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailResult;
import ca.gc.cra.guardrails.domain.guardrail.PersonaGuardrailConfig;
import ca.gc.cra.guardrails.domain.guardrail.Snippet;
import ca.gc.cra.guardrails.infrastructure.cache.InMemoryCacheAdapter;
import ca.gc.cra.guardrails.infrastructure.cache.TimeBoundedCacheAdapter;
import ca.gc.cra.guardrails.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.guardrails.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.guardrails.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.guardrails.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.guardrails.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Composition root that wires the guardrail registry, its adapters, the seven built-in
 * guardrails, and the bundled personas.
 * <p><strong>Why:</strong> Hosting services construct one engine at start-up and close it at shutdown; there is
 * no global instance.</p>
 * <p><strong>Resources:</strong> Owns a maintenance scheduler for the spam store, a worker pool when an external
 * cache is supplied, and the OpenTelemetry meter provider when export is enabled. {@link #close()} releases
 * all of them.</p>
 * <p><strong>Thread-safety:</strong> {@link #check} may be called concurrently.</p>
 *
 * @since 0.1.0
 */
public final class GuardrailEngine implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(GuardrailEngine.class);
  private static final int CACHE_POOL_SIZE = 4;

  private final GuardrailRegistry registry;
  private final GuardrailCheckUseCase useCase;
  private final SpamGuardrail spam;
  private final ScheduledExecutorService scheduler;
  private final ExecutorService cacheExecutor;
  private final AutoCloseable metricsResource;
  private final AtomicBoolean closed = new AtomicBoolean();

  private GuardrailEngine(
      GuardrailRegistry registry,
      SpamGuardrail spam,
      ScheduledExecutorService scheduler,
      ExecutorService cacheExecutor,
      AutoCloseable metricsResource) {
    this.registry = registry;
    this.useCase = new GuardrailCheckUseCase(registry);
    this.spam = spam;
    this.scheduler = scheduler;
    this.cacheExecutor = cacheExecutor;
    this.metricsResource = metricsResource;
  }

  public static Builder builder() {
    return new Builder();
  }

  public GuardrailRegistry registry() {
    return registry;
  }

  public GuardrailResult check(String query, List<Snippet> snippets, String persona) {
    return useCase.check(query, snippets, persona);
  }

  /**
   * Checks a query; see {@link GuardrailCheckUseCase#check(String, List, String, String)}.
   */
  public GuardrailResult check(String query, List<Snippet> snippets, String persona, String sessionId) {
    return useCase.check(query, snippets, persona, sessionId);
  }

  public GuardrailResult check(GuardrailContext context) {
    return useCase.check(context);
  }

  public Map<String, MetricsSnapshot> metrics() {
    return registry.getMetrics();
  }

  /**
   * Stops background work and releases owned resources. Idempotent.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    spam.close();
    scheduler.shutdownNow();
    if (cacheExecutor != null) {
      cacheExecutor.shutdownNow();
    }
    if (metricsResource != null) {
      try {
        metricsResource.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
    log.info("Guardrail engine closed");
  }

  /** Builder for {@link GuardrailEngine}. */
  public static final class Builder {
    private GuardrailEngineConfig config;
    private Path configPath;
    private CachePort cache;
    private MetricsPort metrics;
    private ClockPort clock = new SystemClockAdapter();
    private Path personasPath;
    private final List<Guardrail> extraGuardrails = new ArrayList<>();

    private Builder() {}

    /**
     * Uses explicit settings; takes precedence over {@link #configFile(Path)}.
     */
    public Builder config(GuardrailEngineConfig config) {
      this.config = Objects.requireNonNull(config, "config");
      return this;
    }

    /**
     * Reads settings from a YAML file instead of the bundled {@code guardrails/engine.yaml}.
     */
    public Builder configFile(Path path) {
      this.configPath = Objects.requireNonNull(path, "path");
      return this;
    }

    /**
     * Supplies an external cache such as Redis. Calls are bounded by {@code cache.timeoutMillis}. Without one,
     * an in-process cache is used.
     */
    public Builder cache(CachePort cache) {
      this.cache = Objects.requireNonNull(cache, "cache");
      return this;
    }

    /**
     * Supplies a metrics port. Without one, {@code metrics.exporter} selects OpenTelemetry or no-op.
     */
    public Builder metrics(MetricsPort metrics) {
      this.metrics = Objects.requireNonNull(metrics, "metrics");
      return this;
    }

    public Builder clock(ClockPort clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    /**
     * Loads personas from a file instead of the bundled {@code guardrails/personas.yaml}.
     */
    public Builder personas(Path path) {
      this.personasPath = Objects.requireNonNull(path, "path");
      return this;
    }

    /**
     * Registers an additional guardrail after the built-in ones.
     */
    public Builder guardrail(Guardrail guardrail) {
      extraGuardrails.add(Objects.requireNonNull(guardrail, "guardrail"));
      return this;
    }

    /**
     * Builds the engine.
     *
     * @return engine owning its background resources
     * @throws IOException when the settings or persona file cannot be read
     * @throws IllegalArgumentException when a setting is malformed or out of range
     * @throws ca.gc.cra.guardrails.domain.guardrail.InvalidPersonaConfigException when a persona is malformed
     */
    public GuardrailEngine build() throws IOException {
      GuardrailEngineConfig engineConfig = resolveConfig();
      if (engineConfig.verboseLogging()) {
        LoggingConfigurator.enableVerboseLogging();
      }

      ScheduledExecutorService scheduler = ExecutorFactories.newMaintenanceScheduler("guardrails-maint");
      ExecutorService cacheExecutor = null;
      AutoCloseable metricsResource = null;
      SpamGuardrail spam = null;
      try {
        CachePort effectiveCache;
        if (cache == null) {
          effectiveCache = new InMemoryCacheAdapter(clock, engineConfig.cacheMaxEntries());
        } else if (!cache.isAvailable()) {
          effectiveCache = cache;
        } else {
          cacheExecutor = ExecutorFactories.newCachePool(CACHE_POOL_SIZE, "guardrails-cache");
          effectiveCache = new TimeBoundedCacheAdapter(cache, cacheExecutor, engineConfig.cacheTimeout());
        }

        MetricsPort effectiveMetrics = metrics;
        if (effectiveMetrics == null) {
          if ("otlp".equals(engineConfig.metricsExporter())) {
            OpenTelemetryMetricsAdapter otel =
                new OpenTelemetryMetricsAdapter("otlp", engineConfig.metricsEndpoint().orElse(null));
            metricsResource = otel;
            effectiveMetrics = otel;
          } else {
            effectiveMetrics = new NoOpMetricsAdapter();
          }
        }

        CircuitBreaker breaker = new CircuitBreaker("guardrail-pipeline", engineConfig.breaker(), clock);
        GuardrailRegistry registry = new GuardrailRegistry(
            effectiveCache,
            breaker,
            new GuardrailMetricsCollector(effectiveMetrics),
            clock,
            engineConfig.cacheTtl(),
            engineConfig.pipelineBudget());

        spam = new SpamGuardrail(effectiveCache, clock, scheduler, engineConfig.spam());
        registry.register(new SafetyGuardrail());
        registry.register(new OffTopicGuardrail());
        registry.register(new RelevanceGuardrail());
        registry.register(new PiiGuardrail());
        registry.register(new ProfanityGuardrail());
        registry.register(spam);
        registry.register(new LengthGuardrail());
        extraGuardrails.forEach(registry::register);

        Path path = personasPath != null ? personasPath : engineConfig.personasPath().map(Path::of).orElse(null);
        Map<String, PersonaGuardrailConfig> personas = path != null
            ? PersonaConfigLoader.load(path)
            : PersonaConfigLoader.loadDefaults();
        personas.forEach(registry::configurePersona);

        log.info("Guardrail engine started guardrails={} personas={} cache={} metrics={}",
            registry.list().size(), personas.keySet(), effectiveCache.getClass().getSimpleName(),
            effectiveMetrics.getClass().getSimpleName());
        return new GuardrailEngine(registry, spam, scheduler, cacheExecutor, metricsResource);
      } catch (IOException | RuntimeException ex) {
        if (spam != null) {
          spam.close();
        }
        scheduler.shutdownNow();
        if (cacheExecutor != null) {
          cacheExecutor.shutdownNow();
        }
        if (metricsResource != null) {
          try {
            metricsResource.close();
          } catch (Exception closeEx) {
            ex.addSuppressed(closeEx);
          }
        }
        throw ex;
      }
    }

    private GuardrailEngineConfig resolveConfig() throws IOException {
      if (config != null) {
        return config;
      }
      if (configPath != null) {
        log.info("Loading engine config path={}", configPath);
        return GuardrailEngineConfig.load(configPath);
      }
      return GuardrailEngineConfig.bundled();
    }
  }
}
