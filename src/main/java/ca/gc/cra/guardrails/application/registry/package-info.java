/**
 * Guardrail registry and the machinery around pipeline execution: ordering, circuit breaker, time budget, and
 * in-process metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.guardrails.application.registry;
