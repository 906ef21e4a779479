package ca.gc.cra.guardrails.application.guardrail;

import ca.gc.cra.guardrails.application.port.Guardrail;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailCategory;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailConfig;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailResult;
import ca.gc.cra.guardrails.domain.guardrail.Severity;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Base for the built-in guardrails: holds identity and builds verdicts whose message can be overridden per
 * persona.
 *
 * @since 0.1.0
 */
abstract class AbstractGuardrail implements Guardrail {
  private final String name;
  private final GuardrailCategory category;
  private final String description;
  private final GuardrailResult allowed;

  AbstractGuardrail(String name, GuardrailCategory category, String description) {
    this.name = Objects.requireNonNull(name, "name");
    this.category = Objects.requireNonNull(category, "category");
    this.description = Objects.requireNonNull(description, "description");
    this.allowed = GuardrailResult.allow(category);
  }

  @Override
  public final String name() {
    return name;
  }

  @Override
  public final GuardrailCategory category() {
    return category;
  }

  @Override
  public final String description() {
    return description;
  }

  final GuardrailResult allow() {
    return allowed;
  }

  final GuardrailResult block(Severity severity, GuardrailConfig config, String messageKey, String defaultMessage) {
    return GuardrailResult.block(category, severity, config.string(messageKey, defaultMessage));
  }

  static boolean anyFind(List<Pattern> patterns, String text) {
    for (Pattern pattern : patterns) {
      if (pattern.matcher(text).find()) {
        return true;
      }
    }
    return false;
  }

  static List<Pattern> compileAll(String... expressions) {
    return Arrays.stream(expressions)
        .map(expression -> Pattern.compile(expression, Pattern.CASE_INSENSITIVE))
        .toList();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + name + "/" + category.id() + "]";
  }
}
