package ca.gc.cra.mimetic.infrastructure.camera;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import ca.gc.cra.mimetic.domain.frame.Frame;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Test;

class FrameImagesTest {

  @Test
  void convertsBetweenImageAndFrame() {
    BufferedImage image = new BufferedImage(2, 1, BufferedImage.TYPE_INT_RGB);
    image.setRGB(0, 0, 0x102030);
    image.setRGB(1, 0, 0xA0B0C0);

    Frame frame = FrameImages.toFrame(image, 42L);

    assertEquals(42L, frame.capturedAtMillis());
    assertEquals(0x10, frame.component(0, 0, 0));
    assertEquals(0x20, frame.component(0, 0, 1));
    assertEquals(0xC0, frame.component(1, 0, 2));
    assertEquals(0xA0B0C0, FrameImages.toImage(frame).getRGB(1, 0) & 0xFFFFFF);
  }

  @Test
  void encodesReadableJpeg() throws IOException {
    Frame frame = new Frame(8, 6, new byte[8 * 6 * Frame.CHANNELS], 0L);

    byte[] jpeg = FrameImages.toJpeg(frame);

    BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(jpeg));
    assertNotNull(decoded);
    assertEquals(8, decoded.getWidth());
    assertEquals(6, decoded.getHeight());
  }
}
