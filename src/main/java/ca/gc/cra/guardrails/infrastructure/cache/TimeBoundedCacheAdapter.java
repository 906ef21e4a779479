package ca.gc.cra.guardrails.infrastructure.cache;

import ca.gc.cra.guardrails.application.port.CachePort;
import ca.gc.cra.guardrails.application.port.CacheUnavailableException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decorator that runs every call of a remote {@link CachePort} on a worker pool and gives up after a timeout.
 *
 * <p>A slow or hung cache therefore costs at most the timeout per call and surfaces as
 * {@link CacheUnavailableException}, which callers treat as a miss.</p>
 *
 * @since 0.1.0
 */
public final class TimeBoundedCacheAdapter implements CachePort {
  private static final Logger log = LoggerFactory.getLogger(TimeBoundedCacheAdapter.class);

  private final CachePort delegate;
  private final ExecutorService executor;
  private final long timeoutMillis;

  /**
   * Creates the decorator.
   *
   * @param delegate cache to protect
   * @param executor pool that runs cache calls; owned by the caller
   * @param timeout per-call timeout; must be positive
   */
  public TimeBoundedCacheAdapter(CachePort delegate, ExecutorService executor, Duration timeout) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.executor = Objects.requireNonNull(executor, "executor");
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    this.timeoutMillis = timeout.toMillis();
  }

  @Override
  public <T> Optional<T> get(String key, Class<T> type) {
    return call("get", () -> delegate.get(key, type));
  }

  @Override
  public void put(String key, Object value, Duration ttl) {
    call("put", () -> {
      delegate.put(key, value, ttl);
      return null;
    });
  }

  @Override
  public void clear(String namespace) {
    call("clear", () -> {
      delegate.clear(namespace);
      return null;
    });
  }

  @Override
  public boolean isAvailable() {
    return delegate.isAvailable();
  }

  private <T> T call(String operation, Callable<T> task) {
    Future<T> future;
    try {
      future = executor.submit(task);
    } catch (RejectedExecutionException ex) {
      throw new CacheUnavailableException("cache " + operation + " rejected", ex);
    }
    try {
      return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      log.debug("Cache {} timed out after {} ms", operation, timeoutMillis);
      throw new CacheUnavailableException("cache " + operation + " timed out after " + timeoutMillis + " ms", ex);
    } catch (InterruptedException ex) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new CacheUnavailableException("interrupted waiting for cache " + operation, ex);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof CacheUnavailableException unavailable) {
        throw unavailable;
      }
      throw new CacheUnavailableException("cache " + operation + " failed", cause);
    }
  }
}
