package ca.gc.cra.guardrails.domain.guardrail;

/**
 * Raised synchronously when a persona configuration is malformed.
 *
 * @since 0.1.0
 */
public class InvalidPersonaConfigException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public InvalidPersonaConfigException(String message) {
    super(message);
  }

  public InvalidPersonaConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
