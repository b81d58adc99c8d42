package ca.gc.cra.mimetic.domain.frame;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class FrameOpsTest {

  @Test
  void mirrorSwapsColumns() {
    // 2x1: red, blue
    Frame frame = new Frame(2, 1, new byte[] {(byte) 255, 0, 0, 0, 0, (byte) 255}, 7L);

    Frame mirrored = FrameOps.mirror(frame);

    assertEquals(0, mirrored.component(0, 0, 0));
    assertEquals(255, mirrored.component(0, 0, 2));
    assertEquals(255, mirrored.component(1, 0, 0));
    assertEquals(7L, mirrored.capturedAtMillis());
  }

  @Test
  void resizeUsesNearestNeighbour() {
    byte[] pixels = new byte[4 * 2 * Frame.CHANNELS];
    for (int x = 0; x < 4; x++) {
      pixels[x * Frame.CHANNELS] = (byte) (x * 10);
    }
    Frame frame = new Frame(4, 2, pixels, 1L);

    Frame resized = FrameOps.resize(frame, 2, 1);

    assertEquals(2, resized.width());
    assertEquals(1, resized.height());
    assertEquals(0, resized.component(0, 0, 0));
    assertEquals(20, resized.component(1, 0, 0));
  }

  @Test
  void applyWithNativeOptionsReturnsEqualCopy() {
    Frame frame = new Frame(1, 1, new byte[] {1, 2, 3}, 5L);

    Frame copy = FrameOps.apply(frame, FrameOptions.NATIVE);

    assertNotSame(frame, copy);
    assertEquals(frame, copy);
  }

  @Test
  void applyResizesThenMirrors() {
    Frame frame = new Frame(2, 2, new byte[] {
        1, 1, 1, 2, 2, 2,
        3, 3, 3, 4, 4, 4}, 0L);

    Frame out = FrameOps.apply(frame, new FrameOptions(2, 1, true));

    assertArrayEquals(new byte[] {2, 2, 2, 1, 1, 1}, out.pixels());
  }

  @Test
  void framePixelsAreDefensivelyCopied() {
    byte[] pixels = {9, 9, 9};
    Frame frame = new Frame(1, 1, pixels, 0L);
    pixels[0] = 0;
    frame.pixels()[1] = 0;

    assertEquals(9, frame.component(0, 0, 0));
    assertEquals(9, frame.component(0, 0, 1));
  }

  @Test
  void rejectsMismatchedBufferAndHalfSpecifiedSize() {
    assertThrows(IllegalArgumentException.class, () -> new Frame(2, 2, new byte[3], 0L));
    assertThrows(IllegalArgumentException.class, () -> new FrameOptions(320, 0, false));
  }
}
