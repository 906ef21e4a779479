package ca.gc.cra.guardrails.application.guardrail;

import ca.gc.cra.guardrails.domain.guardrail.GuardrailCategory;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailConfig;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailContext;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailResult;
import ca.gc.cra.guardrails.domain.guardrail.Severity;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Blocks vulgar language. The word list can be replaced per persona with {@code patterns}.
 *
 * @since 0.1.0
 */
public final class ProfanityGuardrail extends AbstractGuardrail {
  public static final String NAME = "profanity";

  private static final List<Pattern> DEFAULT_PATTERNS = compileAll(
      "\\b(fuck|shit|damn|bitch|asshole|piss|cunt|bastard)\\b",
      "\\b(hell|damn|dammit)\\b");

  public ProfanityGuardrail() {
    super(NAME, GuardrailCategory.PROFANITY, "Detects profanity and vulgar language");
  }

  @Override
  public GuardrailResult check(GuardrailContext context, GuardrailConfig config) {
    List<Pattern> patterns = config.patterns("patterns", DEFAULT_PATTERNS);
    if (anyFind(patterns, context.query())) {
      return block(Severity.LOW, config, "profanityMessage",
          "Please keep your language appropriate. I'm here to help with product-related questions.");
    }
    return allow();
  }
}
