package ca.gc.cra.guardrails.domain.guardrail;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GuardrailResultTest {

  @Test
  void blockedResultRequiresReason() {
    assertThrows(IllegalArgumentException.class,
        () -> GuardrailResult.block(GuardrailCategory.PII, Severity.HIGH, " "));
  }

  @Test
  void criticalSeverityIsReservedForSafety() {
    assertThrows(IllegalArgumentException.class,
        () -> GuardrailResult.block(GuardrailCategory.SPAM, Severity.CRITICAL, "no"));
    GuardrailResult safety = GuardrailResult.block(GuardrailCategory.SAFETY, Severity.CRITICAL, "no");
    assertEquals(Severity.CRITICAL, safety.severity());
  }

  @Test
  void allowCarriesNoReasonOrSeverity() {
    GuardrailResult result = GuardrailResult.allow(GuardrailCategory.LENGTH);
    assertTrue(result.allowed());
    assertNull(result.reason());
    assertNull(result.severity());
    assertTrue(result.metadata().isEmpty());
  }

  @Test
  void withMetadataCopiesAndFlagsDegraded() {
    GuardrailResult base = GuardrailResult.allow(GuardrailCategory.CUSTOM);
    GuardrailResult degraded = base.withMetadata("degraded", Boolean.TRUE);

    assertFalse(base.degraded());
    assertTrue(degraded.degraded());
    assertThrows(UnsupportedOperationException.class, () -> degraded.metadata().put("x", "y"));
  }

  @Test
  void metadataIsDefensivelyCopied() {
    Map<String, Object> metadata = new HashMap<>();
    metadata.put("detectedTypes", "email address");
    GuardrailResult result = new GuardrailResult(false, GuardrailCategory.PII, "stop", Severity.HIGH, metadata);
    metadata.clear();

    assertEquals("email address", result.metadata().get("detectedTypes"));
  }
}
