/**
 * {@link ca.gc.cra.guardrails.application.port.CachePort} adapters: the Caffeine-backed in-process cache and a
 * timeout decorator for remote caches.
 */
package ca.gc.cra.guardrails.infrastructure.cache;
