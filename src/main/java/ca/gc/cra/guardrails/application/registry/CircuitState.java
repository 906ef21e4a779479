package ca.gc.cra.guardrails.application.registry;

/**
 * States of the pipeline {@link CircuitBreaker}.
 */
public enum CircuitState {
  /** Calls pass through; consecutive failures are counted. */
  CLOSED,
  /** Calls fail fast until the reset timeout has elapsed. */
  OPEN,
  /** Trial calls pass through; enough successes close the circuit, any failure re-opens it. */
  HALF_OPEN
}
