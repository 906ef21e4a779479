/**
 * Built-in guardrails: safety, length, profanity, PII, off-topic, relevance, and spam.
 * <p>Each guardrail is stateless per request and reads its thresholds and messages from the persona's
 * {@link ca.gc.cra.guardrails.domain.guardrail.GuardrailConfig}. Only {@link
 * ca.gc.cra.guardrails.application.guardrail.SpamGuardrail} keeps state across requests.</p>
 */
package ca.gc.cra.guardrails.application.guardrail;
