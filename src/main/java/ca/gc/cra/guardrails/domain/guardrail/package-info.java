/**
 * <strong>Purpose:</strong> Domain model of the guardrail pipeline: contexts, verdicts, categories, and persona
 * configuration.
 * <p><strong>Concurrency:</strong> All types are immutable and safe to share across request threads.</p>
 * <p><strong>Security:</strong> Query text travels inside {@link GuardrailContext}; it must not be logged verbatim.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.guardrails.domain.guardrail;
