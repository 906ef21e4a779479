package ca.gc.cra.guardrails.domain.guardrail;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable input handed to every guardrail for a single query.
 * <p><strong>Why:</strong> Bundles the query with the retrieval output and caller identity so guardrails stay
 * stateless with respect to the request.</p>
 * <p><strong>Thread-safety:</strong> Records are immutable; lists and maps are defensively copied.</p>
 *
 * @param query user query text; never {@code null}
 * @param snippets retrieved snippets in retrieval order; empty when retrieval has not run
 * @param sessionId optional session identifier used for per-session rate limiting
 * @param userId optional end-user identifier
 * @param persona optional persona name the caller is speaking to
 * @param metadata free-form caller metadata; never {@code null}
 * @since 0.1.0
 */
public record GuardrailContext(
    String query,
    List<Snippet> snippets,
    String sessionId,
    String userId,
    String persona,
    Map<String, Object> metadata) {

  public GuardrailContext {
    query = Objects.requireNonNull(query, "query");
    snippets = snippets == null ? List.of() : List.copyOf(snippets);
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  /**
   * Creates a context carrying only the query text.
   *
   * @param query user query
   * @return context without snippets or identity
   */
  public static GuardrailContext ofQuery(String query) {
    return new GuardrailContext(query, List.of(), null, null, null, Map.of());
  }

  /**
   * Returns a builder seeded with the query text.
   *
   * @param query user query
   * @return builder
   */
  public static Builder builder(String query) {
    return new Builder(query);
  }

  /** Fluent builder for contexts with optional parts. */
  public static final class Builder {
    private final String query;
    private List<Snippet> snippets = List.of();
    private String sessionId;
    private String userId;
    private String persona;
    private Map<String, Object> metadata = Map.of();

    private Builder(String query) {
      this.query = query;
    }

    public Builder snippets(List<Snippet> snippets) {
      this.snippets = snippets;
      return this;
    }

    public Builder sessionId(String sessionId) {
      this.sessionId = sessionId;
      return this;
    }

    public Builder userId(String userId) {
      this.userId = userId;
      return this;
    }

    public Builder persona(String persona) {
      this.persona = persona;
      return this;
    }

    public Builder metadata(Map<String, Object> metadata) {
      this.metadata = metadata;
      return this;
    }

    public GuardrailContext build() {
      return new GuardrailContext(query, snippets, sessionId, userId, persona, metadata);
    }
  }
}
