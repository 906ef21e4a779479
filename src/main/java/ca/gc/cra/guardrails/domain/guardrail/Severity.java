package ca.gc.cra.guardrails.domain.guardrail;

/**
 * Severity attached to a blocking verdict.
 *
 * <p>{@link #CRITICAL} is reserved for {@link GuardrailCategory#SAFETY} blocks.</p>
 *
 * @since 0.1.0
 */
public enum Severity {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL
}
