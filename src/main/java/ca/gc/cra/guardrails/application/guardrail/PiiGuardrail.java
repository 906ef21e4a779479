package ca.gc.cra.guardrails.application.guardrail;

import ca.gc.cra.guardrails.domain.guardrail.GuardrailCategory;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailConfig;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailContext;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailResult;
import ca.gc.cra.guardrails.domain.guardrail.Severity;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Detects personally identifiable information in the query.
 *
 * <p>Every enabled detector runs, so the verdict lists all detected types under
 * {@code metadata.detectedTypes}. IP addresses are only checked when {@code checkIP} is {@code true}.</p>
 *
 * @since 0.1.0
 */
public final class PiiGuardrail extends AbstractGuardrail {
  public static final String NAME = "pii";

  private static final Pattern EMAIL =
      Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");
  private static final Pattern PHONE =
      Pattern.compile("\\b(?:\\+?1[-.\\s]?)?\\(?[0-9]{3}\\)?[-.\\s]?[0-9]{3}[-.\\s]?[0-9]{4}\\b");
  private static final Pattern SSN = Pattern.compile("\\b\\d{3}-?\\d{2}-?\\d{4}\\b");
  private static final Pattern CREDIT_CARD = Pattern.compile("\\b(?:\\d{4}[-\\s]?){3}\\d{4}\\b");
  private static final Pattern IP_ADDRESS = Pattern.compile("\\b(?:\\d{1,3}\\.){3}\\d{1,3}\\b");

  private final List<Detector> detectors = List.of(
      new Detector("checkEmail", true, EMAIL, "email address"),
      new Detector("checkPhone", true, PHONE, "phone number"),
      new Detector("checkSSN", true, SSN, "Social Security Number"),
      new Detector("checkCreditCard", true, CREDIT_CARD, "credit card number"),
      new Detector("checkIP", false, IP_ADDRESS, "IP address"));

  public PiiGuardrail() {
    super(NAME, GuardrailCategory.PII, "Detects personally identifiable information (PII)");
  }

  @Override
  public GuardrailResult check(GuardrailContext context, GuardrailConfig config) {
    String query = context.query();
    List<String> detected = new ArrayList<>();
    for (Detector detector : detectors) {
      if (config.bool(detector.toggle(), detector.enabledByDefault())
          && detector.pattern().matcher(query).find()) {
        detected.add(detector.label());
      }
    }
    if (detected.isEmpty()) {
      return allow();
    }
    String message = "For your security, please do not share " + String.join(", ", detected)
        + " in your messages.";
    return block(Severity.HIGH, config, "piiMessage", message)
        .withMetadata("detectedTypes", List.copyOf(detected));
  }

  private record Detector(String toggle, boolean enabledByDefault, Pattern pattern, String label) {}
}
