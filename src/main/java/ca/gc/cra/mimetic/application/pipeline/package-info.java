/**
 * Real-time pipeline stages and the session that owns them.
 * <p><strong>Role:</strong> Capture, detection hand-off, result fusion, smoothing and actuator dispatch.</p>
 * <p><strong>Concurrency:</strong> Every stage runs on its own named thread; stages meet only through bounded
 * queues and the {@link ca.gc.cra.mimetic.application.pipeline.CorrelationBuffer} lock.</p>
 * <p><strong>Performance:</strong> Lossy. Saturated queues drop the newest (frames, payloads) or the
 * oldest (detector results) entry rather than block.</p>
 * <p><strong>Metrics:</strong> Emits {@code frames.*}, {@code dispatch.*}, {@code detect.*}, {@code fusion.*},
 * {@code actuator.*} and {@code session.*}.</p>
 */
package ca.gc.cra.mimetic.application.pipeline;
