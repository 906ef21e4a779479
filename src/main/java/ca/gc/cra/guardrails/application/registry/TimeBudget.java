package ca.gc.cra.guardrails.application.registry;

import ca.gc.cra.guardrails.application.port.ClockPort;

/**
 * Deadline for one pipeline run, checked between guardrails.
 */
final class TimeBudget {
  private final ClockPort clock;
  private final long budgetMillis;
  private final long deadlineMillis;

  private TimeBudget(ClockPort clock, long budgetMillis) {
    this.clock = clock;
    this.budgetMillis = budgetMillis;
    this.deadlineMillis = clock.nowMillis() + budgetMillis;
  }

  static TimeBudget start(ClockPort clock, long budgetMillis) {
    return new TimeBudget(clock, budgetMillis);
  }

  long remainingMillis() {
    return Math.max(0L, deadlineMillis - clock.nowMillis());
  }

  boolean exhausted() {
    return remainingMillis() <= 0L;
  }

  /**
   * @param nextGuardrail guardrail about to run, for the exception message
   * @throws PipelineTimeoutException when the deadline has passed
   */
  void ensureRemaining(String nextGuardrail) {
    if (exhausted()) {
      throw new PipelineTimeoutException(
          "Guardrail pipeline exceeded " + budgetMillis + " ms before " + nextGuardrail);
    }
  }
}
