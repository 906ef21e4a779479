package ca.gc.cra.guardrails.infrastructure.cache;

import ca.gc.cra.guardrails.application.port.CachePort;
import ca.gc.cra.guardrails.application.port.ClockPort;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * <strong>What:</strong> In-process {@link CachePort} backed by a Caffeine cache with per-entry TTLs.
 * <p><strong>Why:</strong> Default cache for single-instance deployments and tests; a shared cache such as Redis
 * can be plugged in through the same port.</p>
 * <p><strong>Thread-safety:</strong> Caffeine caches are safe for concurrent use.</p>
 * <p><strong>Time:</strong> Expiry follows the supplied {@link ClockPort}, so tests advance a fake clock instead
 * of sleeping.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryCacheAdapter implements CachePort {
  /** Entry cap used when none is configured. */
  public static final long DEFAULT_MAX_ENTRIES = 50_000L;

  private final Cache<String, Entry> cache;

  public InMemoryCacheAdapter(ClockPort clock) {
    this(clock, DEFAULT_MAX_ENTRIES);
  }

  /**
   * Creates the cache.
   *
   * @param clock time source for expiry
   * @param maxEntries size bound; least recently used entries are evicted beyond it
   */
  public InMemoryCacheAdapter(ClockPort clock, long maxEntries) {
    Objects.requireNonNull(clock, "clock");
    if (maxEntries <= 0) {
      throw new IllegalArgumentException("maxEntries must be positive");
    }
    this.cache = Caffeine.newBuilder()
        .maximumSize(maxEntries)
        .expireAfter(new TtlExpiry())
        .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.nowMillis()))
        .executor(Runnable::run)
        .build();
  }

  @Override
  public <T> Optional<T> get(String key, Class<T> type) {
    Objects.requireNonNull(type, "type");
    Entry entry = cache.getIfPresent(Objects.requireNonNull(key, "key"));
    if (entry == null || !type.isInstance(entry.value())) {
      return Optional.empty();
    }
    return Optional.of(type.cast(entry.value()));
  }

  @Override
  public void put(String key, Object value, Duration ttl) {
    Objects.requireNonNull(ttl, "ttl");
    if (ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must be positive");
    }
    Entry entry = new Entry(Objects.requireNonNull(value, "value"), ttl.toNanos());
    cache.put(Objects.requireNonNull(key, "key"), entry);
  }

  @Override
  public void clear(String namespace) {
    if (namespace == null) {
      cache.invalidateAll();
      return;
    }
    String prefix = namespace + ":";
    cache.asMap().keySet().removeIf(key -> key.startsWith(prefix));
  }

  long estimatedSize() {
    cache.cleanUp();
    return cache.estimatedSize();
  }

  private record Entry(Object value, long ttlNanos) {}

  private static final class TtlExpiry implements Expiry<String, Entry> {
    @Override
    public long expireAfterCreate(String key, Entry value, long currentTime) {
      return value.ttlNanos();
    }

    @Override
    public long expireAfterUpdate(String key, Entry value, long currentTime, long currentDuration) {
      return value.ttlNanos();
    }

    @Override
    public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
