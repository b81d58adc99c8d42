package ca.gc.cra.mimetic.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class CameraSourceTest {

  @Test
  void blankAndSyntheticMeanGeneratedFrames() {
    assertEquals(CameraSource.Kind.SYNTHETIC, CameraSource.parse(null).kind());
    assertEquals(CameraSource.Kind.SYNTHETIC, CameraSource.parse(" Synthetic ").kind());
    assertTrue(CameraSource.parse("synthetic").imageDirectory().isEmpty());
  }

  @Test
  void imagesPrefixResolvesDirectory() {
    CameraSource source = CameraSource.parse("images:frames/demo");

    assertEquals(CameraSource.Kind.IMAGES, source.kind());
    assertEquals(Path.of("frames/demo").toAbsolutePath().normalize(), source.imageDirectory().orElseThrow());
    assertTrue(source.toString().startsWith("images:"));
  }

  @Test
  void rejectsUnknownSources() {
    assertThrows(IllegalArgumentException.class, () -> CameraSource.parse("images:"));
    assertThrows(IllegalArgumentException.class, () -> CameraSource.parse("usb0"));
    assertThrows(IllegalArgumentException.class, () -> new CameraSource(CameraSource.Kind.IMAGES, null));
  }
}
