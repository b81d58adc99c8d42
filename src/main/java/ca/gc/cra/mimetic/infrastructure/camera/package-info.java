/**
 * Camera device adapters: a synthetic pattern generator and a still-image replayer.
 * <p>Devices are read by a single capture thread and need not be thread-safe.</p>
 */
package ca.gc.cra.mimetic.infrastructure.camera;
