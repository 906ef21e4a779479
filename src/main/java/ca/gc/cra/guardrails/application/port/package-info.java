/**
 * <strong>Purpose:</strong> Ports separating the guardrail pipeline from checks, caches, clocks, and metrics
 * backends.
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 * <p><strong>Observability:</strong> Ports expose hooks for metrics but do not prescribe implementations.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.guardrails.application.port;
