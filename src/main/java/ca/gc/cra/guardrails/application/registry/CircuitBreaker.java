package ca.gc.cra.guardrails.application.registry;

import ca.gc.cra.guardrails.application.port.ClockPort;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Three-state circuit breaker protecting the guardrail pipeline.
 * <p><strong>Why:</strong> When the pipeline keeps failing, checks should stop paying for it and fail open fast
 * until it has had time to recover.</p>
 * <p><strong>Transitions:</strong>
 * <ul>
 *   <li>CLOSED to OPEN after {@code failureThreshold} consecutive failures.</li>
 *   <li>OPEN to HALF_OPEN on the first call after {@code resetTimeout} since the last failure.</li>
 *   <li>HALF_OPEN to CLOSED after {@code successThreshold} successes; any failure re-opens.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> State transitions are synchronized; the protected call runs outside the
 * lock, so half-open admits concurrent trial calls.</p>
 *
 * @since 0.1.0
 */
public final class CircuitBreaker {
  private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

  private final String name;
  private final Settings settings;
  private final ClockPort clock;

  private CircuitState state = CircuitState.CLOSED;
  private int failures;
  private int halfOpenSuccesses;
  private long lastFailureMillis;

  public CircuitBreaker(String name, Settings settings, ClockPort clock) {
    this.name = Objects.requireNonNull(name, "name");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Runs {@code call} if the circuit admits it.
   *
   * @param call protected call
   * @param <T> result type
   * @return the call's result
   * @throws CircuitBreakerOpenException when the circuit is open
   * @throws RuntimeException whatever the call throws, after recording the failure
   */
  public <T> T execute(Supplier<T> call) {
    Objects.requireNonNull(call, "call");
    admit();
    T result;
    try {
      result = call.get();
    } catch (RuntimeException ex) {
      onFailure();
      throw ex;
    }
    onSuccess();
    return result;
  }

  /**
   * Returns the current state, without applying the open-to-half-open timeout.
   *
   * @return state
   */
  public synchronized CircuitState state() {
    return state;
  }

  synchronized int failureCount() {
    return failures;
  }

  /** Forces the circuit closed and clears counters. */
  public synchronized void reset() {
    transition(CircuitState.CLOSED);
  }

  private synchronized void admit() {
    if (state != CircuitState.OPEN) {
      return;
    }
    long elapsed = clock.nowMillis() - lastFailureMillis;
    long resetMillis = settings.resetTimeout().toMillis();
    if (elapsed >= resetMillis) {
      transition(CircuitState.HALF_OPEN);
      return;
    }
    throw new CircuitBreakerOpenException(name, resetMillis - elapsed);
  }

  private synchronized void onSuccess() {
    if (state == CircuitState.HALF_OPEN) {
      halfOpenSuccesses++;
      if (halfOpenSuccesses >= settings.successThreshold()) {
        transition(CircuitState.CLOSED);
      }
    } else {
      failures = 0;
    }
  }

  private synchronized void onFailure() {
    failures++;
    lastFailureMillis = clock.nowMillis();
    if (state == CircuitState.HALF_OPEN || failures >= settings.failureThreshold()) {
      if (state != CircuitState.OPEN) {
        transition(CircuitState.OPEN);
      }
    }
  }

  private void transition(CircuitState next) {
    CircuitState previous = state;
    state = next;
    halfOpenSuccesses = 0;
    if (next == CircuitState.CLOSED) {
      failures = 0;
    }
    if (previous != next) {
      if (next == CircuitState.OPEN) {
        log.warn("Circuit breaker opened breaker={} failures={} resetMs={}",
            name, failures, settings.resetTimeout().toMillis());
      } else {
        log.info("Circuit breaker state change breaker={} from={} to={}", name, previous, next);
      }
    }
  }

  /**
   * Breaker thresholds.
   *
   * @param failureThreshold consecutive failures that open the circuit
   * @param successThreshold half-open successes that close it
   * @param resetTimeout time the circuit stays open after the last failure
   */
  public record Settings(int failureThreshold, int successThreshold, Duration resetTimeout) {
    /** 10 failures, 2 successes, 30 seconds. */
    public static final Settings DEFAULTS = new Settings(10, 2, Duration.ofSeconds(30));

    public Settings {
      if (failureThreshold < 1) {
        throw new IllegalArgumentException("failureThreshold must be positive");
      }
      if (successThreshold < 1) {
        throw new IllegalArgumentException("successThreshold must be positive");
      }
      Objects.requireNonNull(resetTimeout, "resetTimeout");
      if (resetTimeout.isNegative()) {
        throw new IllegalArgumentException("resetTimeout must not be negative");
      }
    }
  }
}
