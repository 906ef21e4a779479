package ca.gc.cra.guardrails.application.port;

import java.time.Duration;
import java.util.Optional;

/**
 * <strong>What:</strong> Port abstracting the shared short-TTL cache used for verdicts and spam counters.
 * <p><strong>Why:</strong> The hosting service may back it with Redis or an in-process map; the guardrails only
 * need best-effort reads and writes.</p>
 * <p><strong>Role:</strong> Application port implemented by adapters under
 * {@code ca.gc.cra.guardrails.infrastructure.cache}.</p>
 * <p><strong>Failure:</strong> Implementations signal outages with {@link CacheUnavailableException}; every call
 * site treats failures as a miss and carries on.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Calls must return quickly; remote adapters are wrapped in a time-bounded
 * decorator.</p>
 *
 * @since 0.1.0
 */
public interface CachePort {
  /**
   * Reads a value.
   *
   * @param key cache key; must not be {@code null}
   * @param type expected value type
   * @param <T> value type
   * @return the cached value, or empty when absent, expired, or of another type
   * @throws CacheUnavailableException when the cache cannot be reached
   */
  <T> Optional<T> get(String key, Class<T> type);

  /**
   * Writes a value with a time to live.
   *
   * @param key cache key; must not be {@code null}
   * @param value value to store; must not be {@code null}
   * @param ttl time to live; must be positive
   * @throws CacheUnavailableException when the cache cannot be reached
   */
  void put(String key, Object value, Duration ttl);

  /**
   * Removes entries whose key starts with {@code namespace + ":"}, or every entry when {@code namespace} is
   * {@code null}.
   *
   * @param namespace key namespace or {@code null}
   * @throws CacheUnavailableException when the cache cannot be reached
   */
  void clear(String namespace);

  /**
   * Indicates whether the cache is wired at all. Callers skip the cache entirely when {@code false}.
   *
   * @return {@code true} for real adapters
   */
  default boolean isAvailable() {
    return true;
  }

  /** Cache used when none is configured; every call fails and {@link #isAvailable()} is {@code false}. */
  CachePort UNAVAILABLE = new CachePort() {
    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
      throw new CacheUnavailableException("no cache configured");
    }

    @Override
    public void put(String key, Object value, Duration ttl) {
      throw new CacheUnavailableException("no cache configured");
    }

    @Override
    public void clear(String namespace) {
      throw new CacheUnavailableException("no cache configured");
    }

    @Override
    public boolean isAvailable() {
      return false;
    }
  };
}
