package ca.gc.cra.guardrails.application.registry;

/**
 * Thrown by {@link CircuitBreaker#execute} while the circuit is open.
 *
 * @since 0.1.0
 */
public class CircuitBreakerOpenException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String breakerName;
  private final long retryAfterMillis;

  public CircuitBreakerOpenException(String breakerName, long retryAfterMillis) {
    super("Circuit breaker " + breakerName + " is open; retry in " + retryAfterMillis + " ms");
    this.breakerName = breakerName;
    this.retryAfterMillis = retryAfterMillis;
  }

  public String breakerName() {
    return breakerName;
  }

  public long retryAfterMillis() {
    return retryAfterMillis;
  }
}
