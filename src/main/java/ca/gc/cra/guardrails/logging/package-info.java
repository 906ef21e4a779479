/**
 * Logging helpers: logback bootstrap and query previews safe for operator logs.
 */
package ca.gc.cra.guardrails.logging;
