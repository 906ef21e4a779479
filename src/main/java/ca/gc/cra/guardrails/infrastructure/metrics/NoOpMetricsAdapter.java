package ca.gc.cra.guardrails.infrastructure.metrics;

import ca.gc.cra.guardrails.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations; used when {@code metrics.exporter} is {@code none} and no
 * external {@link MetricsPort} is supplied.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  public NoOpMetricsAdapter() {}

  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
