/**
 * Executor factories for engine background work.
 */
package ca.gc.cra.guardrails.infrastructure.exec;
