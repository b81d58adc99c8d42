/**
 * Application layer for MIMETIC sessions.
 * <p><strong>Role:</strong> Hosts the pipeline and the ports it drives (camera, detectors, actuators, pose log).</p>
 * <p><strong>Concurrency:</strong> Stages manage their own threads; port interfaces document caller responsibilities.</p>
 */
package ca.gc.cra.mimetic.application;
