package ca.gc.cra.guardrails.application.registry;

import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Point-in-time view of one metrics bucket.
 *
 * @param totalChecks checks recorded
 * @param allowed checks that passed
 * @param blocked checks that blocked
 * @param errors checks that failed with an exception
 * @param byCategory count per category id
 * @param latencySamples number of retained latency samples (at most 1000)
 * @param p50 median latency in milliseconds; empty without samples
 * @param p95 95th percentile latency in milliseconds; empty without samples
 * @param p99 99th percentile latency in milliseconds; empty without samples
 * @since 0.1.0
 */
public record MetricsSnapshot(
    long totalChecks,
    long allowed,
    long blocked,
    long errors,
    Map<String, Long> byCategory,
    int latencySamples,
    OptionalLong p50,
    OptionalLong p95,
    OptionalLong p99) {

  public MetricsSnapshot {
    byCategory = Map.copyOf(byCategory);
    Objects.requireNonNull(p50, "p50");
    Objects.requireNonNull(p95, "p95");
    Objects.requireNonNull(p99, "p99");
  }
}
