package ca.gc.cra.guardrails.application.registry;

import ca.gc.cra.guardrails.application.port.MetricsPort;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailCategory;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * <strong>What:</strong> In-process counters and latency percentiles per pipeline operation and per guardrail.
 * <p><strong>Why:</strong> Operators read {@link #snapshot()} from an admin endpoint; the same updates are
 * forwarded to a {@link MetricsPort} for export.</p>
 * <p><strong>Keys:</strong> {@code cache_hit}, {@code guardrail_check}, {@code guardrail_error}, and
 * {@code guardrail:<name>}. Exported names are {@code guardrails.<key>.allowed|blocked|error} and
 * {@code guardrails.<key>.latencyMillis}, with {@code :} replaced by {@code .}.</p>
 * <p><strong>Thread-safety:</strong> Buckets live in a concurrent map; each bucket synchronizes its updates.</p>
 *
 * @since 0.1.0
 */
public final class GuardrailMetricsCollector {
  static final int MAX_LATENCY_SAMPLES = 1000;

  private final MetricsPort metrics;
  private final ConcurrentMap<String, Bucket> buckets = new ConcurrentHashMap<>();

  public GuardrailMetricsCollector(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Records a completed check.
   *
   * @param key operation or {@code guardrail:<name>}
   * @param category category of the verdict
   * @param latencyMillis elapsed time
   * @param allowed verdict
   */
  public void record(String key, GuardrailCategory category, long latencyMillis, boolean allowed) {
    bucket(key).record(category, latencyMillis, allowed ? Outcome.ALLOWED : Outcome.BLOCKED);
    String exported = exportName(key);
    metrics.increment(exported + (allowed ? ".allowed" : ".blocked"));
    metrics.observe(exported + ".latencyMillis", latencyMillis);
  }

  /**
   * Records a check that failed with an exception; the sample is counted under {@code custom}.
   *
   * @param key operation or {@code guardrail:<name>}
   * @param latencyMillis elapsed time; 0 for per-guardrail failures
   */
  public void recordError(String key, long latencyMillis) {
    bucket(key).record(GuardrailCategory.CUSTOM, latencyMillis, Outcome.ERROR);
    metrics.increment(exportName(key) + ".error");
  }

  /**
   * Returns a snapshot of every bucket, keyed and sorted by bucket key.
   *
   * @return immutable map of snapshots
   */
  public Map<String, MetricsSnapshot> snapshot() {
    Map<String, MetricsSnapshot> sorted = new TreeMap<>();
    buckets.forEach((key, bucket) -> sorted.put(key, bucket.snapshot()));
    return Map.copyOf(sorted);
  }

  /** Drops all buckets. */
  public void clear() {
    buckets.clear();
  }

  private Bucket bucket(String key) {
    return buckets.computeIfAbsent(Objects.requireNonNull(key, "key"), k -> new Bucket());
  }

  private static String exportName(String key) {
    return "guardrails." + key.replace(':', '.');
  }

  /**
   * Nearest-rank percentile over ascending samples.
   */
  static OptionalLong percentile(long[] sorted, int p) {
    if (sorted.length == 0) {
      return OptionalLong.empty();
    }
    int index = (int) Math.ceil(p / 100.0 * sorted.length) - 1;
    return OptionalLong.of(sorted[Math.max(0, index)]);
  }

  private enum Outcome { ALLOWED, BLOCKED, ERROR }

  private static final class Bucket {
    private final long[] latencies = new long[MAX_LATENCY_SAMPLES];
    private final Map<String, Long> byCategory = new LinkedHashMap<>();
    private int next;
    private int samples;
    private long total;
    private long allowed;
    private long blocked;
    private long errors;

    synchronized void record(GuardrailCategory category, long latencyMillis, Outcome outcome) {
      total++;
      switch (outcome) {
        case ALLOWED -> allowed++;
        case BLOCKED -> blocked++;
        case ERROR -> errors++;
      }
      latencies[next] = latencyMillis;
      next = (next + 1) % latencies.length;
      samples = Math.min(samples + 1, latencies.length);
      byCategory.merge(category.id(), 1L, Long::sum);
    }

    synchronized MetricsSnapshot snapshot() {
      long[] sorted = Arrays.copyOf(latencies, samples);
      Arrays.sort(sorted);
      return new MetricsSnapshot(total, allowed, blocked, errors, byCategory, samples,
          percentile(sorted, 50), percentile(sorted, 95), percentile(sorted, 99));
    }
  }
}
