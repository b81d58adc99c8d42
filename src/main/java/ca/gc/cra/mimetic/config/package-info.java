/**
 * Configuration records, YAML loading, precedence merging and composition root wiring.
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Endpoints and paths go through {@code ca.gc.cra.mimetic.validation} before any
 * adapter is built.</p>
 */
package ca.gc.cra.mimetic.config;
