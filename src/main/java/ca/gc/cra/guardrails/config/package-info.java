/**
 * <strong>Purpose:</strong> Configuration loading and the {@link ca.gc.cra.guardrails.config.GuardrailEngine}
 * composition root.
 * <p><strong>Sources:</strong> Engine settings come from the {@code engine} section of a YAML file; personas come
 * from {@code guardrails/personas.yaml} or a supplied file.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.guardrails.config;
