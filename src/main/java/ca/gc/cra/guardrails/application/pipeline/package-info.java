/**
 * Use cases that front the guardrail registry for answer-generation flows.
 */
package ca.gc.cra.guardrails.application.pipeline;
