package ca.gc.cra.guardrails.application.port;

/**
 * Signals that a {@link CachePort} call failed or timed out.
 *
 * @since 0.1.0
 */
public class CacheUnavailableException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public CacheUnavailableException(String message) {
    super(message);
  }

  public CacheUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
