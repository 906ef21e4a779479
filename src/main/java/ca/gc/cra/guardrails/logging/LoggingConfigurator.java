package ca.gc.cra.guardrails.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Raises guardrail logging verbosity at runtime.
 * <p><strong>Why:</strong> Lets operators see per-guardrail decisions while tuning personas, without editing
 * {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for engine start-up; relies on Logback's own synchronization.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings log a warning and keep their levels.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  /** Logger hierarchy root for this library. */
  public static final String GUARDRAILS_LOGGER = "ca.gc.cra.guardrails";

  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Sets the {@value #GUARDRAILS_LOGGER} logger to DEBUG.
   *
   * @return {@code true} when the level was applied
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger logger = context.getLogger(GUARDRAILS_LOGGER);
      if (!Level.DEBUG.equals(logger.getLevel())) {
        logger.setLevel(Level.DEBUG);
      }
      return true;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return false;
  }
}
