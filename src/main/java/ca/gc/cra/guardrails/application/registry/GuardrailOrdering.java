package ca.gc.cra.guardrails.application.registry;

import ca.gc.cra.guardrails.application.port.Guardrail;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailCategory;
import java.util.ArrayList;
import java.util.List;

/**
 * Execution order for a persona's guardrails.
 *
 * <p>Safety guardrails run first. Among the rest, every relevance guardrail runs before the first off-topic one.
 * Everything else keeps its configured order. The ordering is stable and idempotent.</p>
 */
final class GuardrailOrdering {
  private GuardrailOrdering() {}

  static List<Guardrail> order(List<Guardrail> configured) {
    List<Guardrail> ordered = new ArrayList<>(configured.size());
    List<Guardrail> rest = new ArrayList<>(configured.size());
    for (Guardrail guardrail : configured) {
      if (guardrail.category() == GuardrailCategory.SAFETY) {
        ordered.add(guardrail);
      } else {
        rest.add(guardrail);
      }
    }

    int firstOffTopic = -1;
    for (int i = 0; i < rest.size(); i++) {
      if (rest.get(i).category() == GuardrailCategory.OFF_TOPIC) {
        firstOffTopic = i;
        break;
      }
    }
    if (firstOffTopic >= 0) {
      List<Guardrail> head = new ArrayList<>(rest.subList(0, firstOffTopic));
      List<Guardrail> tail = new ArrayList<>();
      for (Guardrail guardrail : rest.subList(firstOffTopic, rest.size())) {
        if (guardrail.category() == GuardrailCategory.RELEVANCE) {
          head.add(guardrail);
        } else {
          tail.add(guardrail);
        }
      }
      rest = head;
      rest.addAll(tail);
    }

    ordered.addAll(rest);
    return ordered;
  }
}
