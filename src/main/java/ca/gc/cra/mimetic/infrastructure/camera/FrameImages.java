package ca.gc.cra.mimetic.infrastructure.camera;

import ca.gc.cra.mimetic.domain.frame.Frame;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Objects;
import javax.imageio.ImageIO;

/** Conversions between {@link Frame} and {@code java.awt} images. */
public final class FrameImages {
  private FrameImages() {}

  /**
   * Copies an image into a packed RGB frame. Alpha is discarded.
   *
   * @param image source image of any type
   * @param capturedAtMillis timestamp for the frame
   * @return frame with the image's dimensions
   */
  public static Frame toFrame(BufferedImage image, long capturedAtMillis) {
    Objects.requireNonNull(image, "image");
    int width = image.getWidth();
    int height = image.getHeight();
    int[] argb = image.getRGB(0, 0, width, height, null, 0, width);
    byte[] rgb = new byte[width * height * Frame.CHANNELS];
    for (int i = 0; i < argb.length; i++) {
      int p = argb[i];
      rgb[i * 3] = (byte) (p >> 16);
      rgb[i * 3 + 1] = (byte) (p >> 8);
      rgb[i * 3 + 2] = (byte) p;
    }
    return new Frame(width, height, rgb, capturedAtMillis);
  }

  /**
   * Builds an RGB image from a frame.
   *
   * @param frame source frame
   * @return new {@link BufferedImage#TYPE_INT_RGB} image
   */
  public static BufferedImage toImage(Frame frame) {
    Objects.requireNonNull(frame, "frame");
    byte[] rgb = frame.pixels();
    int width = frame.width();
    int height = frame.height();
    int[] packed = new int[width * height];
    for (int i = 0; i < packed.length; i++) {
      packed[i] = (rgb[i * 3] & 0xFF) << 16 | (rgb[i * 3 + 1] & 0xFF) << 8 | (rgb[i * 3 + 2] & 0xFF);
    }
    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    image.setRGB(0, 0, width, height, packed, 0, width);
    return image;
  }

  /**
   * Encodes a frame as JPEG.
   *
   * @param frame frame to encode
   * @return JPEG bytes
   * @throws IOException when no JPEG writer is available or encoding fails
   */
  public static byte[] toJpeg(Frame frame) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream(frame.width() * frame.height() / 4 + 1024);
    if (!ImageIO.write(toImage(frame), "jpg", out)) {
      throw new IOException("No JPEG writer available");
    }
    return out.toByteArray();
  }
}
