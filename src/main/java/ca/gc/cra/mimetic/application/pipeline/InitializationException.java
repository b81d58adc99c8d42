package ca.gc.cra.mimetic.application.pipeline;

/**
 * Raised when a session cannot reach a runnable state: the camera never produced a frame, a
 * component failed to start, or calibration collected no usable samples.
 */
public final class InitializationException extends Exception {
  private static final long serialVersionUID = 1L;

  public InitializationException(String message) {
    super(message);
  }

  public InitializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
