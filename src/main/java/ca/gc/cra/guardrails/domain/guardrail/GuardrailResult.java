package ca.gc.cra.guardrails.domain.guardrail;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Verdict produced by a single guardrail or by the whole pipeline.
 * <p><strong>Why:</strong> Callers treat {@code allowed == false} as authoritative and surface {@link #reason()}
 * to the end user instead of generating an answer.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to cache and share across requests.</p>
 *
 * @param allowed whether the query may proceed
 * @param category category of the guardrail that produced the verdict; never {@code null}
 * @param reason user-facing message; required when blocked
 * @param severity optional severity; {@link Severity#CRITICAL} only for safety blocks
 * @param metadata diagnostic attributes such as detected PII types; never {@code null}
 * @since 0.1.0
 */
public record GuardrailResult(
    boolean allowed,
    GuardrailCategory category,
    String reason,
    Severity severity,
    Map<String, Object> metadata) {

  public GuardrailResult {
    category = Objects.requireNonNull(category, "category");
    if (!allowed && (reason == null || reason.isBlank())) {
      throw new IllegalArgumentException("blocked result requires a reason");
    }
    if (severity == Severity.CRITICAL && category != GuardrailCategory.SAFETY) {
      throw new IllegalArgumentException("critical severity is reserved for safety blocks");
    }
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  /**
   * Creates an allowing verdict.
   *
   * @param category category of the guardrail that passed the query
   * @return allowed result without reason or severity
   */
  public static GuardrailResult allow(GuardrailCategory category) {
    return new GuardrailResult(true, category, null, null, Map.of());
  }

  /**
   * Creates a blocking verdict.
   *
   * @param category category of the blocking guardrail
   * @param severity severity of the block
   * @param reason user-facing message
   * @return blocked result
   */
  public static GuardrailResult block(GuardrailCategory category, Severity severity, String reason) {
    return new GuardrailResult(false, category, reason, severity, Map.of());
  }

  /**
   * Returns a copy of this result with an additional metadata entry.
   *
   * @param key metadata key
   * @param value metadata value; must not be {@code null}
   * @return new result
   */
  public GuardrailResult withMetadata(String key, Object value) {
    Map<String, Object> merged = new LinkedHashMap<>(metadata);
    merged.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    return new GuardrailResult(allowed, category, reason, severity, merged);
  }

  /**
   * Indicates whether the pipeline produced this verdict in fail-open mode.
   *
   * @return {@code true} when {@code metadata.degraded} is set
   */
  public boolean degraded() {
    return Boolean.TRUE.equals(metadata.get("degraded"));
  }
}
