package ca.gc.cra.guardrails.application.pipeline;

import ca.gc.cra.guardrails.application.registry.GuardrailRegistry;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailCategory;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailContext;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailResult;
import ca.gc.cra.guardrails.domain.guardrail.Severity;
import ca.gc.cra.guardrails.domain.guardrail.Snippet;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Entry point used by answer-generation flows to vet a query and its retrieved snippets.
 * <p><strong>Why:</strong> Rejects malformed input before the registry sees it and guarantees that a check never
 * throws into the caller.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class GuardrailCheckUseCase {
  static final String INVALID_QUERY_MESSAGE = "Invalid query provided";
  static final String SYSTEM_ERROR_MESSAGE = "Guardrail system error, query allowed";

  private static final Logger log = LoggerFactory.getLogger(GuardrailCheckUseCase.class);

  private final GuardrailRegistry registry;

  public GuardrailCheckUseCase(GuardrailRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  /** Checks a query for an anonymous caller. */
  public GuardrailResult check(String query, List<Snippet> snippets, String persona) {
    return check(query, snippets, persona, null);
  }

  /**
   * Checks a query for a persona.
   *
   * @param query user query; {@code null} or blank is blocked
   * @param snippets retrieved snippets; {@code null} means none
   * @param persona persona name; {@code null} selects {@link GuardrailRegistry#DEFAULT_PERSONA}
   * @param sessionId conversation session; {@code null} for anonymous
   * @return verdict; never {@code null}
   */
  public GuardrailResult check(String query, List<Snippet> snippets, String persona, String sessionId) {
    if (query == null || query.isBlank()) {
      return GuardrailResult.block(GuardrailCategory.CUSTOM, Severity.MEDIUM, INVALID_QUERY_MESSAGE);
    }
    GuardrailContext context = GuardrailContext.builder(query.trim())
        .snippets(snippets == null ? List.of() : snippets)
        .sessionId(sessionId)
        .persona(persona)
        .build();
    return check(context);
  }

  /**
   * Checks a fully built context using its persona.
   *
   * @param context query context
   * @return verdict; never {@code null}
   */
  public GuardrailResult check(GuardrailContext context) {
    Objects.requireNonNull(context, "context");
    if (context.query().isBlank()) {
      return GuardrailResult.block(GuardrailCategory.CUSTOM, Severity.MEDIUM, INVALID_QUERY_MESSAGE);
    }
    String persona = context.persona() == null ? GuardrailRegistry.DEFAULT_PERSONA : context.persona();
    try {
      return registry.check(context, persona);
    } catch (RuntimeException ex) {
      log.error("Guardrail check escaped the registry, allowing query persona={} session={}",
          persona, context.sessionId(), ex);
      return GuardrailResult.allow(GuardrailCategory.CUSTOM).withMetadata("error", SYSTEM_ERROR_MESSAGE);
    }
  }
}
