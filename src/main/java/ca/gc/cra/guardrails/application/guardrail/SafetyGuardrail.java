package ca.gc.cra.guardrails.application.guardrail;

import ca.gc.cra.guardrails.domain.guardrail.GuardrailCategory;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailConfig;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailContext;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailResult;
import ca.gc.cra.guardrails.domain.guardrail.Severity;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Detects self-harm, threats, and requests for illegal activity.
 *
 * <p>Tiers are evaluated in fixed priority and the first matching tier wins: self-harm (critical), threats
 * (critical), illegal activity (high, disabled with {@code checkIllegal: false}).</p>
 *
 * <p>Persona keys: {@code checkIllegal}, {@code selfHarmMessage}, {@code threatMessage},
 * {@code illegalMessage}.</p>
 *
 * @since 0.1.0
 */
public final class SafetyGuardrail extends AbstractGuardrail {
  public static final String NAME = "safety";

  private static final int MIN_INSPECTED_LENGTH = 3;

  private static final List<Pattern> SELF_HARM = compileAll(
      "\\b(suicide|self.?harm|cut myself|end it all|want to die|kill myself)\\b",
      "\\b(no reason to live|better off dead|not worth living)\\b",
      "\\b(hurt myself|self.?injure|self.?destruct)\\b");

  private static final List<Pattern> THREATS = compileAll(
      "\\b(kill|murder|harm|attack|violence|bomb|terror|threat|dangerous)\\b",
      "\\b(hurt|injure|damage|destroy|assault|maim|torture)\\b",
      "\\b(shoot|stab|poison|explode|burn)\\b");

  private static final List<Pattern> ILLEGAL = compileAll(
      "\\b(hack|crack|pirate|illegal|fraud|steal|scam|drug|weapon)\\b");

  public SafetyGuardrail() {
    super(NAME, GuardrailCategory.SAFETY, "Detects threats, self-harm, and harmful content");
  }

  @Override
  public GuardrailResult check(GuardrailContext context, GuardrailConfig config) {
    String query = context.query();
    if (query.length() < MIN_INSPECTED_LENGTH) {
      return allow();
    }
    String lower = query.toLowerCase(Locale.ROOT);

    if (anyFind(SELF_HARM, lower)) {
      return block(Severity.CRITICAL, config, "selfHarmMessage",
          "I'm not equipped to help with self-harm concerns. Please reach out to a mental health professional"
              + " or crisis helpline for immediate support.");
    }
    if (anyFind(THREATS, lower)) {
      return block(Severity.CRITICAL, config, "threatMessage",
          "I cannot assist with queries related to threats or violence. If you have concerns, please contact"
              + " appropriate authorities.");
    }
    if (config.bool("checkIllegal", true) && anyFind(ILLEGAL, lower)) {
      return block(Severity.HIGH, config, "illegalMessage",
          "I cannot assist with queries related to illegal activities.");
    }
    return allow();
  }
}
