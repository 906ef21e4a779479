package ca.gc.cra.guardrails.application.guardrail;

import ca.gc.cra.guardrails.domain.guardrail.GuardrailCategory;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailConfig;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailContext;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailResult;
import ca.gc.cra.guardrails.domain.guardrail.Severity;

/**
 * Rejects queries outside {@code [minLength, maxLength]} characters (defaults 3 and 2000).
 *
 * @since 0.1.0
 */
public final class LengthGuardrail extends AbstractGuardrail {
  public static final String NAME = "length";

  static final int DEFAULT_MIN_LENGTH = 3;
  static final int DEFAULT_MAX_LENGTH = 2000;

  public LengthGuardrail() {
    super(NAME, GuardrailCategory.LENGTH, "Validates query length is within acceptable limits");
  }

  @Override
  public GuardrailResult check(GuardrailContext context, GuardrailConfig config) {
    int length = context.query().length();
    int minLength = config.integer("minLength", DEFAULT_MIN_LENGTH);
    int maxLength = config.integer("maxLength", DEFAULT_MAX_LENGTH);

    if (length < minLength) {
      return block(Severity.LOW, config, "tooShortMessage",
          "Please provide a question that is at least " + minLength + " characters long.");
    }
    if (length > maxLength) {
      return block(Severity.LOW, config, "tooLongMessage",
          "Please keep your question under " + maxLength
              + " characters. You can break it into multiple questions if needed.");
    }
    return allow();
  }
}
