package ca.gc.cra.guardrails.application.guardrail;

import ca.gc.cra.guardrails.domain.guardrail.GuardrailCategory;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailConfig;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailContext;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailResult;
import ca.gc.cra.guardrails.domain.guardrail.Severity;
import ca.gc.cra.guardrails.domain.guardrail.Snippet;
import ca.gc.cra.guardrails.logging.Logs;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Rejects an answer attempt when no retrieved snippet plausibly relates to the query.
 * <p><strong>Why:</strong> Prevents the assistant from answering confidently out of irrelevant context.</p>
 * <p><strong>Algorithm:</strong>
 * <ol>
 *   <li>No snippets, or no meaningful query token after stop-word removal: block.</li>
 *   <li>Every snippet scored and every score below {@code minScore}: block.</li>
 *   <li>Every snippet is a generic fallback snippet and none has a relevance ratio above
 *   {@code minRelevanceRatio}: block.</li>
 *   <li>Allow when some snippet reaches {@code minRelevanceRatio} or some score exceeds {@code minScore}.</li>
 * </ol>
 * The relevance ratio of a snippet is the fraction of meaningful query tokens found as substrings of its text.
 *
 * <p>Persona keys: {@code minScore} (0.2), {@code minRelevanceRatio} (0.2), {@code fallbackPatterns},
 * {@code noResultsMessage}, {@code lowRelevanceMessage}.</p>
 *
 * @since 0.1.0
 */
public final class RelevanceGuardrail extends AbstractGuardrail {
  public static final String NAME = "relevance";

  private static final Logger log = LoggerFactory.getLogger(RelevanceGuardrail.class);

  static final double DEFAULT_MIN_SCORE = 0.2;
  static final double DEFAULT_MIN_RELEVANCE_RATIO = 0.2;
  private static final int PREVIEW_BYTES = 50;

  private static final String NO_RESULTS_MESSAGE =
      "I couldn't find relevant information in my knowledge base to answer your question. I can only answer"
          + " questions related to our product, support documentation, and policies.";
  private static final String LOW_RELEVANCE_MESSAGE =
      "I couldn't find relevant information in my knowledge base to answer your question.";

  // "known" and "issues" stay meaningful so queries like "known issues" keep their tokens.
  private static final Set<String> STOP_WORDS = Set.of(
      "the", "is", "are", "was", "were", "be", "been", "being", "have", "has", "had",
      "do", "does", "did", "will", "would", "should", "could", "can", "may", "might",
      "must", "this", "that", "these", "those", "a", "an", "for", "with", "about",
      "what", "who", "where", "when", "why", "how", "to", "of", "in", "on", "at", "by");

  private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private static final List<Pattern> DEFAULT_FALLBACK_PATTERNS = compileAll(
      "business plan includes",
      "upload.*via web",
      "suggest.*desktop app");

  public RelevanceGuardrail() {
    super(NAME, GuardrailCategory.RELEVANCE, "Validates that retrieved snippets are relevant to the query");
  }

  @Override
  public GuardrailResult check(GuardrailContext context, GuardrailConfig config) {
    List<Snippet> snippets = context.snippets();
    double minScore = config.decimal("minScore", DEFAULT_MIN_SCORE);
    double minRelevanceRatio = config.decimal("minRelevanceRatio", DEFAULT_MIN_RELEVANCE_RATIO);

    if (snippets.isEmpty()) {
      return block(Severity.MEDIUM, config, "noResultsMessage", NO_RESULTS_MESSAGE);
    }

    List<String> queryTokens = meaningfulTokens(context.query());
    if (queryTokens.isEmpty()) {
      return block(Severity.MEDIUM, config, "noResultsMessage", LOW_RELEVANCE_MESSAGE);
    }

    boolean allScored = snippets.stream().allMatch(Snippet::hasScore);
    if (allScored && snippets.stream().allMatch(s -> s.score() < minScore)) {
      return lowRelevance(config);
    }

    List<Double> ratios = new ArrayList<>(snippets.size());
    for (Snippet snippet : snippets) {
      ratios.add(relevanceRatio(queryTokens, snippet));
    }

    List<Pattern> fallbackPatterns = config.patterns("fallbackPatterns", DEFAULT_FALLBACK_PATTERNS);
    boolean onlyFallbacks = snippets.stream().allMatch(s -> anyFind(fallbackPatterns, s.text()));
    if (onlyFallbacks && ratios.stream().noneMatch(ratio -> ratio > minRelevanceRatio)) {
      return lowRelevance(config);
    }

    boolean relevantText = ratios.stream().anyMatch(ratio -> ratio >= minRelevanceRatio);
    boolean goodScore = snippets.stream().anyMatch(s -> s.hasScore() && s.score() > minScore);
    if (!relevantText && !goodScore) {
      if (log.isWarnEnabled()) {
        log.warn("Guardrail rejected: low relevance query={} tokens={} snippets={} ratios={}",
            Logs.truncate(context.query(), PREVIEW_BYTES), queryTokens, previews(snippets), ratios);
      }
      return lowRelevance(config);
    }
    return allow();
  }

  /**
   * Lower-cases, strips punctuation, splits on whitespace, and drops stop-words and single characters.
   *
   * @param query raw query
   * @return meaningful tokens in query order
   */
  static List<String> meaningfulTokens(String query) {
    String cleaned = NON_WORD.matcher(query.toLowerCase(Locale.ROOT)).replaceAll(" ");
    List<String> tokens = new ArrayList<>();
    for (String token : WHITESPACE.split(cleaned)) {
      if (token.length() > 1 && !STOP_WORDS.contains(token)) {
        tokens.add(token);
      }
    }
    return tokens;
  }

  static double relevanceRatio(List<String> queryTokens, Snippet snippet) {
    String text = snippet.text().toLowerCase(Locale.ROOT);
    long matching = queryTokens.stream().filter(text::contains).count();
    return (double) matching / queryTokens.size();
  }

  private GuardrailResult lowRelevance(GuardrailConfig config) {
    return block(Severity.MEDIUM, config, "lowRelevanceMessage", LOW_RELEVANCE_MESSAGE);
  }

  private static List<String> previews(List<Snippet> snippets) {
    List<String> previews = new ArrayList<>(snippets.size());
    for (Snippet snippet : snippets) {
      previews.add("source=" + snippet.source() + " score=" + snippet.score()
          + " text=" + Logs.truncate(snippet.text(), PREVIEW_BYTES));
    }
    return previews;
  }
}
