package ca.gc.cra.guardrails.application.guardrail;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.guardrails.domain.guardrail.GuardrailConfig;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailContext;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailResult;
import ca.gc.cra.guardrails.domain.guardrail.Severity;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LengthGuardrailTest {
  private final LengthGuardrail guardrail = new LengthGuardrail();

  @Test
  void tooShortUsesDefaultMinimum() {
    GuardrailResult result = guardrail.check(GuardrailContext.ofQuery("hi"), GuardrailConfig.ENABLED);

    assertFalse(result.allowed());
    assertEquals(Severity.LOW, result.severity());
    assertEquals("Please provide a question that is at least 3 characters long.", result.reason());
  }

  @Test
  void tooLongHonoursPersonaMaximum() {
    GuardrailConfig config = new GuardrailConfig(true, Map.of("maxLength", 10));
    GuardrailResult result = guardrail.check(GuardrailContext.ofQuery("this is far too long"), config);

    assertFalse(result.allowed());
    assertTrue(result.reason().startsWith("Please keep your question under 10 characters."));
  }

  @Test
  void boundariesAreInclusive() {
    GuardrailConfig config = new GuardrailConfig(true, Map.of("minLength", 1, "maxLength", 5));
    assertTrue(guardrail.check(GuardrailContext.ofQuery("a"), config).allowed());
    assertTrue(guardrail.check(GuardrailContext.ofQuery("abcde"), config).allowed());
  }

  @Test
  void customMessagesApply() {
    GuardrailConfig config = new GuardrailConfig(true, Map.of("tooShortMessage", "Say more."));
    assertEquals("Say more.", guardrail.check(GuardrailContext.ofQuery("?"), config).reason());
  }
}
