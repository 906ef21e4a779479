package ca.gc.cra.guardrails.domain.guardrail;

import java.util.Locale;

/**
 * <strong>What:</strong> Fixed set of categories a guardrail or a verdict can belong to.
 * <p><strong>Why:</strong> Ordering, fail-closed handling, and metrics all key off the category rather than the
 * guardrail name.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and globally shareable.</p>
 *
 * @since 0.1.0
 */
public enum GuardrailCategory {
  /** Self-harm, threats, and illegal activity. */
  SAFETY("safety"),
  /** Retrieved context does not match the query. */
  RELEVANCE("relevance"),
  /** Query is unrelated to the product. */
  OFF_TOPIC("off_topic"),
  /** Personally identifiable information. */
  PII("pii"),
  PROFANITY("profanity"),
  SPAM("spam"),
  LENGTH("length"),
  RATE_LIMIT("rate_limit"),
  LANGUAGE("language"),
  CONTENT_MODERATION("content_moderation"),
  PRIVACY("privacy"),
  /** Pipeline-level verdicts and anything not covered above. */
  CUSTOM("custom");

  private final String id;

  GuardrailCategory(String id) {
    this.id = id;
  }

  /**
   * Returns the lower-case identifier used in configuration files and metric keys.
   *
   * @return stable identifier such as {@code off_topic}
   */
  public String id() {
    return id;
  }

  /**
   * Resolves a category from its identifier, case-insensitively.
   *
   * @param raw identifier such as {@code "safety"} or {@code "OFF_TOPIC"}
   * @return matching category
   * @throws IllegalArgumentException when the identifier is unknown
   */
  public static GuardrailCategory fromId(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("category must not be blank");
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (GuardrailCategory category : values()) {
      if (category.id.equals(normalized)) {
        return category;
      }
    }
    throw new IllegalArgumentException("Unknown guardrail category: " + raw);
  }
}
