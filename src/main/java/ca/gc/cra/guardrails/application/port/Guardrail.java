package ca.gc.cra.guardrails.application.port;

import ca.gc.cra.guardrails.domain.guardrail.GuardrailCategory;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailConfig;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailContext;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailResult;

/**
 * <strong>What:</strong> Port implemented by every validation check that can allow or block a query.
 * <p><strong>Why:</strong> Lets the registry compose safety, relevance, PII, and other checks per persona without
 * knowing their internals.</p>
 * <p><strong>Role:</strong> Application port; implementations live in
 * {@code ca.gc.cra.guardrails.application.guardrail} or in the hosting service.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose a registry-unique {@link #name()} and a fixed {@link #category()}.</li>
 *   <li>Return a verdict for the query; never {@code null}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent {@link #check} calls from many
 * request threads; internal counters must be privately synchronized.</p>
 * <p><strong>Failure:</strong> Implementations may throw {@link RuntimeException}s. The registry skips a failing
 * guardrail, except for {@link GuardrailCategory#SAFETY} where a failure blocks the query.</p>
 *
 * @since 0.1.0
 */
public interface Guardrail {
  /**
   * Returns the unique registry name, for example {@code off_topic}.
   *
   * @return guardrail name
   */
  String name();

  GuardrailCategory category();

  /**
   * Returns a one-line human-readable description.
   *
   * @return description
   */
  String description();

  /**
   * Evaluates the query.
   *
   * @param context immutable query context
   * @param config persona-specific configuration; {@link GuardrailConfig#ENABLED} when the persona has none
   * @return verdict; never {@code null}
   */
  GuardrailResult check(GuardrailContext context, GuardrailConfig config);
}
