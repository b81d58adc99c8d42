package ca.gc.cra.mimetic.domain.frame;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable camera image in packed 8-bit RGB order (three bytes per pixel, row-major).
 *
 * <p>The pixel buffer is copied on construction and on access so a frame can be handed to several
 * threads without sharing mutable state.</p>
 *
 * @param width image width in pixels; positive
 * @param height image height in pixels; positive
 * @param pixels packed RGB bytes of length {@code width * height * 3}
 * @param capturedAtMillis monotonic capture time in milliseconds
 * @since 0.1.0
 */
public record Frame(int width, int height, byte[] pixels, long capturedAtMillis) {
  /** Bytes per pixel in the packed RGB layout. */
  public static final int CHANNELS = 3;

  public Frame {
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException(
          "frame dimensions must be positive (was " + width + "x" + height + ")");
    }
    Objects.requireNonNull(pixels, "pixels");
    long expected = (long) width * height * CHANNELS;
    if (pixels.length != expected) {
      throw new IllegalArgumentException(
          "pixel buffer length " + pixels.length + " does not match " + width + "x" + height + " RGB");
    }
    pixels = pixels.clone();
  }

  /**
   * Returns a copy of the packed RGB buffer.
   *
   * @return fresh pixel array owned by the caller
   */
  @Override
  public byte[] pixels() {
    return pixels.clone();
  }

  /**
   * Reads one colour component without copying the whole buffer.
   *
   * @param x column
   * @param y row
   * @param channel 0 = red, 1 = green, 2 = blue
   * @return unsigned component value 0..255
   */
  public int component(int x, int y, int channel) {
    Objects.checkIndex(x, width);
    Objects.checkIndex(y, height);
    Objects.checkIndex(channel, CHANNELS);
    return pixels[(y * width + x) * CHANNELS + channel] & 0xFF;
  }

  /**
   * Returns a copy of this frame stamped with a different capture time.
   *
   * @param millis replacement timestamp
   * @return new frame sharing no state with this one
   */
  public Frame withCapturedAt(long millis) {
    return new Frame(width, height, pixels, millis);
  }

  byte[] rawPixels() {
    return pixels;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Frame that)) {
      return false;
    }
    return width == that.width
        && height == that.height
        && capturedAtMillis == that.capturedAtMillis
        && Arrays.equals(pixels, that.pixels);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(width, height, capturedAtMillis);
    return 31 * result + Arrays.hashCode(pixels);
  }

  @Override
  public String toString() {
    return "Frame[" + width + "x" + height + ", capturedAtMillis=" + capturedAtMillis + "]";
  }
}
