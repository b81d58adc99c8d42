/**
 * Landmark detector adapters.
 * <p><strong>Concurrency:</strong> Each adapter runs detection on its own bounded pool and rejects frames
 * when saturated; callbacks arrive on pool threads.</p>
 * <p><strong>Metrics:</strong> {@code detect.<kind>.error}, {@code detect.<kind>.latencyNanos}.</p>
 */
package ca.gc.cra.mimetic.infrastructure.detect;
