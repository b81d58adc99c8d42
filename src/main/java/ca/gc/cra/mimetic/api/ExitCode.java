package ca.gc.cra.mimetic.api;

/**
 * Process exit statuses returned by the MIMETIC commands.
 *
 * <p>Scripts supervising a robot session can rely on these values staying stable between
 * releases.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command finished normally. */
  SUCCESS(0),
  /** Arguments or configuration values were rejected. */
  INVALID_ARGS(2),
  /** A file or socket could not be read or written. */
  IO_ERROR(3),
  /** Configuration was accepted by the parser but could not be applied. */
  CONFIG_ERROR(4),
  /** Unexpected failure while the pipeline was running. */
  RUNTIME_FAILURE(5),
  /** Camera never delivered a frame, or calibration collected no samples. */
  INIT_FAILURE(6),
  /** Interrupted, typically by SIGINT. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /** @return numeric status handed to {@link System#exit(int)} */
  public int code() {
    return code;
  }
}
