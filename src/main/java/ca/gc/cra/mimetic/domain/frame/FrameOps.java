package ca.gc.cra.mimetic.domain.frame;

import java.util.Objects;

/**
 * Pixel operations used when handing frames to consumers: nearest-neighbour resize and horizontal
 * mirror. Every operation returns a new frame.
 *
 * @since 0.1.0
 */
public final class FrameOps {
  private FrameOps() {
    // Utility
  }

  /**
   * Applies the requested options to a frame.
   *
   * @param frame source frame
   * @param options resize and mirror settings
   * @return transformed copy; never the input instance
   */
  public static Frame apply(Frame frame, FrameOptions options) {
    Objects.requireNonNull(frame, "frame");
    Objects.requireNonNull(options, "options");
    Frame result = options.resizes() ? resize(frame, options.width(), options.height()) : frame;
    if (options.mirror()) {
      result = mirror(result);
    }
    return result == frame ? frame.withCapturedAt(frame.capturedAtMillis()) : result;
  }

  /**
   * Resizes using nearest-neighbour sampling to exactly {@code width x height}.
   *
   * @param frame source frame
   * @param width target width
   * @param height target height
   * @return resized frame
   */
  public static Frame resize(Frame frame, int width, int height) {
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException("target dimensions must be positive");
    }
    byte[] src = frame.rawPixels();
    byte[] dst = new byte[width * height * Frame.CHANNELS];
    int srcWidth = frame.width();
    int srcHeight = frame.height();
    for (int y = 0; y < height; y++) {
      int sy = (int) ((long) y * srcHeight / height);
      for (int x = 0; x < width; x++) {
        int sx = (int) ((long) x * srcWidth / width);
        int from = (sy * srcWidth + sx) * Frame.CHANNELS;
        int to = (y * width + x) * Frame.CHANNELS;
        dst[to] = src[from];
        dst[to + 1] = src[from + 1];
        dst[to + 2] = src[from + 2];
      }
    }
    return new Frame(width, height, dst, frame.capturedAtMillis());
  }

  /**
   * Flips the frame around its vertical axis.
   *
   * @param frame source frame
   * @return mirrored frame
   */
  public static Frame mirror(Frame frame) {
    byte[] src = frame.rawPixels();
    byte[] dst = new byte[src.length];
    int width = frame.width();
    for (int y = 0; y < frame.height(); y++) {
      int row = y * width;
      for (int x = 0; x < width; x++) {
        int from = (row + x) * Frame.CHANNELS;
        int to = (row + (width - 1 - x)) * Frame.CHANNELS;
        dst[to] = src[from];
        dst[to + 1] = src[from + 1];
        dst[to + 2] = src[from + 2];
      }
    }
    return new Frame(width, frame.height(), dst, frame.capturedAtMillis());
  }
}
