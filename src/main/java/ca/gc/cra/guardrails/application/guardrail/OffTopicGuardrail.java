package ca.gc.cra.guardrails.application.guardrail;

import ca.gc.cra.guardrails.domain.guardrail.GuardrailCategory;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailConfig;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailContext;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailResult;
import ca.gc.cra.guardrails.domain.guardrail.Severity;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects queries unrelated to the product or knowledge base.
 *
 * <p>Evaluation order:
 * <ol>
 *   <li>Any product keyword present: allow. Domain phrasing always wins over the patterns below.</li>
 *   <li>Any off-topic pattern matches: block.</li>
 *   <li>A generic "wh- + auxiliary" question whose first article-introduced entity is not a product term:
 *   block.</li>
 * </ol>
 *
 * <p>Persona keys: {@code productKeywords}, {@code offTopicPatterns}, {@code productTerms},
 * {@code offTopicMessage}.</p>
 *
 * @since 0.1.0
 */
public final class OffTopicGuardrail extends AbstractGuardrail {
  public static final String NAME = "off_topic";

  private static final String DEFAULT_MESSAGE =
      "I can only answer questions related to our product, support documentation, pricing, and policies."
          + " I don't have information about general topics, celebrities, or unrelated subjects.";

  private static final List<Pattern> DEFAULT_PATTERNS = compileAll(
      // celebrities and public figures
      "\\b(eminem|beyonce|taylor swift|justin bieber|celebrity|actor|singer|musician|rapper|artist|famous)\\b",
      // encyclopedia-style questions
      "\\b(wikipedia|encyclopedia|define|definition of|what does|meaning of)\\b",
      // weather, news, current events
      "\\b(weather|news|current events|today|stock market|sports|politics|election)\\b",
      // history, geography, science
      "\\b(history of|who invented|where is|what country|capital of|science|physics|chemistry|biology)\\b",
      // entertainment
      "\\b(movie|film|tv show|television|netflix|disney|marvel|star wars|game of thrones)\\b",
      // general knowledge
      "\\b(what is|who is|tell me about|explain)\\b");

  private static final List<String> DEFAULT_PRODUCT_KEYWORDS = List.of(
      "plan", "pricing", "feature", "support", "account", "subscription",
      "billing", "export", "video", "upload", "download", "settings",
      "faq", "help", "issue", "bug", "error", "troubleshoot", "problem",
      "how to", "how do i", "can i", "documentation", "guide", "tutorial",
      "api", "integration", "webhook", "email", "notification", "alert");

  private static final List<String> DEFAULT_PRODUCT_TERMS = List.of(
      "product", "service", "app", "platform", "system", "tool", "software", "account", "plan", "subscription");

  private static final Pattern GENERIC_QUESTION = Pattern.compile(
      "^(what|who|where|when|why|how)\\s+(is|are|was|were|does|do|did|can|could|should|will|would)\\s+",
      Pattern.CASE_INSENSITIVE);
  private static final Pattern ARTICLE_ENTITY =
      Pattern.compile("\\b(the|a|an)\\s+([a-z]+(?:\\s+[a-z]+){0,2})", Pattern.CASE_INSENSITIVE);

  public OffTopicGuardrail() {
    super(NAME, GuardrailCategory.OFF_TOPIC, "Detects queries unrelated to the product or knowledge base");
  }

  @Override
  public GuardrailResult check(GuardrailContext context, GuardrailConfig config) {
    String query = context.query().toLowerCase(Locale.ROOT).trim();

    List<String> keywords = config.strings("productKeywords", DEFAULT_PRODUCT_KEYWORDS);
    for (String keyword : keywords) {
      if (query.contains(keyword.toLowerCase(Locale.ROOT))) {
        return allow();
      }
    }

    if (anyFind(config.patterns("offTopicPatterns", DEFAULT_PATTERNS), query)) {
      return block(Severity.MEDIUM, config, "offTopicMessage", DEFAULT_MESSAGE);
    }

    if (GENERIC_QUESTION.matcher(query).find()) {
      Matcher entity = ARTICLE_ENTITY.matcher(query);
      if (entity.find()) {
        String subject = entity.group(2).toLowerCase(Locale.ROOT);
        List<String> productTerms = config.strings("productTerms", DEFAULT_PRODUCT_TERMS);
        if (productTerms.stream().noneMatch(subject::contains)) {
          return block(Severity.MEDIUM, config, "offTopicMessage", DEFAULT_MESSAGE);
        }
      }
    }
    return allow();
  }
}
