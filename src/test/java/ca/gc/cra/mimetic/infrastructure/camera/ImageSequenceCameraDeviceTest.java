package ca.gc.cra.mimetic.infrastructure.camera;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.mimetic.domain.frame.Frame;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ImageSequenceCameraDeviceTest {
  @TempDir Path dir;

  private void writePng(String name, int rgb, int width, int height) throws IOException {
    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        image.setRGB(x, y, rgb);
      }
    }
    ImageIO.write(image, "png", dir.resolve(name).toFile());
  }

  @Test
  void replaysImagesInNameOrderAndLoops() throws IOException {
    writePng("b.png", 0x00FF00, 4, 2);
    writePng("a.png", 0xFF0000, 4, 2);
    Files.writeString(dir.resolve("notes.txt"), "not an image");
    ImageSequenceCameraDevice camera = new ImageSequenceCameraDevice(dir, 0, 0, 500);
    camera.open();
    try {
      assertEquals(2, camera.size());
      Frame first = camera.read().orElseThrow();
      Frame second = camera.read().orElseThrow();
      Frame third = camera.read().orElseThrow();

      assertEquals(255, first.component(0, 0, 0));
      assertEquals(255, second.component(0, 0, 1));
      assertArrayEquals(first.pixels(), third.pixels());
    } finally {
      camera.close();
    }
  }

  @Test
  void resizesWhenSizeRequested() throws IOException {
    writePng("only.png", 0x0000FF, 10, 10);
    ImageSequenceCameraDevice camera = new ImageSequenceCameraDevice(dir, 5, 3, 30);
    camera.open();
    try {
      Frame frame = camera.read().orElseThrow();
      assertEquals(5, frame.width());
      assertEquals(3, frame.height());
      assertEquals(255, frame.component(4, 2, 2));
    } finally {
      camera.close();
    }
  }

  @Test
  void openFailsForMissingOrEmptyDirectory() throws IOException {
    assertThrows(IOException.class,
        () -> new ImageSequenceCameraDevice(dir.resolve("missing"), 0, 0, 30).open());
    Files.writeString(dir.resolve("readme.md"), "# none");
    assertThrows(IOException.class, () -> new ImageSequenceCameraDevice(dir, 0, 0, 30).open());
  }

  @Test
  void readAfterCloseFails() throws IOException {
    writePng("a.png", 0xFFFFFF, 2, 2);
    ImageSequenceCameraDevice camera = new ImageSequenceCameraDevice(dir, 0, 0, 30);
    camera.open();
    camera.close();
    assertThrows(IOException.class, camera::read);
  }
}
