/**
 * Clock adapters.
 */
package ca.gc.cra.guardrails.infrastructure.time;
