package ca.gc.cra.mimetic.application.pipeline;

/** Lifecycle of a {@link MimicSession}. Transitions only move forward. */
public enum SessionState {
  IDLE,
  INITIALIZING,
  CALIBRATING,
  RUNNING,
  STOPPING,
  STOPPED
}
