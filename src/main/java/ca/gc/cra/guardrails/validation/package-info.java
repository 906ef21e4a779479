/**
 * Validation helpers shared by configuration loaders and the registry.
 *
 * @since 0.1.0
 */
package ca.gc.cra.guardrails.validation;
