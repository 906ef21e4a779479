package ca.gc.cra.guardrails.application.registry;

/**
 * Thrown when the guardrail pipeline runs past its time budget.
 *
 * @since 0.1.0
 */
public class PipelineTimeoutException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public PipelineTimeoutException(String message) {
    super(message);
  }
}
