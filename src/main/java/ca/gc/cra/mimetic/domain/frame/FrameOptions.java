package ca.gc.cra.mimetic.domain.frame;

/**
 * Transformations applied when a consumer reads the latest frame.
 *
 * @param width target width in pixels, or {@code 0} to keep the native size
 * @param height target height in pixels, or {@code 0} to keep the native size
 * @param mirror flip the image horizontally after resizing
 * @since 0.1.0
 */
public record FrameOptions(int width, int height, boolean mirror) {
  /** Native size, not mirrored. */
  public static final FrameOptions NATIVE = new FrameOptions(0, 0, false);

  public FrameOptions {
    if (width < 0 || height < 0) {
      throw new IllegalArgumentException("target dimensions must not be negative");
    }
    if ((width == 0) != (height == 0)) {
      throw new IllegalArgumentException("width and height must both be set or both be 0");
    }
  }

  /**
   * Options that only mirror.
   *
   * @param mirror whether to flip horizontally
   * @return options keeping the native size
   */
  public static FrameOptions nativeSize(boolean mirror) {
    return new FrameOptions(0, 0, mirror);
  }

  /** @return {@code true} when a resize to an explicit size was requested */
  public boolean resizes() {
    return width > 0 && height > 0;
  }
}
