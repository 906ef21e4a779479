package ca.gc.cra.guardrails.domain.guardrail;

import java.util.Objects;

/**
 * Retrieved context snippet handed to guardrails that judge relevance.
 *
 * @param text snippet text; never {@code null}
 * @param score optional retrieval score (BM25 or vector similarity); {@code null} when the retriever did not
 *     score the snippet
 * @param source optional source identifier, used only for diagnostics
 * @since 0.1.0
 */
public record Snippet(String text, Double score, String source) {

  public Snippet {
    text = Objects.requireNonNull(text, "text");
  }

  /**
   * Creates an unscored snippet without a source.
   *
   * @param text snippet text
   * @return snippet
   */
  public static Snippet of(String text) {
    return new Snippet(text, null, null);
  }

  /**
   * Creates a scored snippet without a source.
   *
   * @param text snippet text
   * @param score retrieval score
   * @return snippet
   */
  public static Snippet scored(String text, double score) {
    return new Snippet(text, score, null);
  }

  public boolean hasScore() {
    return score != null;
  }
}
