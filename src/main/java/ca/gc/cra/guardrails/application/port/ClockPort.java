package ca.gc.cra.guardrails.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock time to latency measurement, rate limiting, and the circuit
 * breaker.
 * <p><strong>Why:</strong> Time windows and reset timeouts must be testable without sleeping.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 * @see ca.gc.cra.guardrails.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
