/**
 * Metrics adapters that bridge {@link ca.gc.cra.guardrails.application.port.MetricsPort} to OpenTelemetry or
 * discard updates.
 * <p><strong>Metrics:</strong> Publishes under the {@code guardrails.*} namespace.</p>
 * <p><strong>Security:</strong> Only guardrail names and categories appear in metric names; never query text.</p>
 */
package ca.gc.cra.guardrails.infrastructure.metrics;
