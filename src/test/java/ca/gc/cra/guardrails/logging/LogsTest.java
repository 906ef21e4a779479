package ca.gc.cra.guardrails.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesAreUnchanged() {
    assertEquals("export video", Logs.truncate("export video", 64));
  }

  @Test
  void longValuesAreCutAndMarked() {
    String truncated = Logs.truncate("abcdefghij", 4);

    assertEquals("abcd... (truncated, 4 of 10)", truncated);
  }

  @Test
  void truncationNeverSplitsCodePoints() {
    String truncated = Logs.truncate("café au lait", 4);

    assertTrue(truncated.startsWith("caf..."));
  }

  @Test
  void nullAndInvalidLimits() {
    assertEquals("<null>", Logs.truncate(null, 4));
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("abc", 0));
  }

  @Test
  void redactHidesValue() {
    String redacted = Logs.redact("jane@example.com");

    assertEquals("[REDACTED 16 chars]", redacted);
    assertFalse(redacted.contains("jane"));
    assertEquals("<null>", Logs.redact(null));
  }
}
