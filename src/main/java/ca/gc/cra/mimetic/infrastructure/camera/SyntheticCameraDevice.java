package ca.gc.cra.mimetic.infrastructure.camera;

import ca.gc.cra.mimetic.application.port.CameraDevice;
import ca.gc.cra.mimetic.domain.frame.Frame;
import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Camera stand-in producing a moving colour-bar pattern at a fixed rate.
 *
 * <p>Used for demos, dry runs and tests that need frames without hardware. {@link #read()} paces itself
 * to the configured rate.</p>
 */
public final class SyntheticCameraDevice implements CameraDevice {
  private final int width;
  private final int height;
  private final long periodNanos;
  private volatile boolean open;
  private long frameIndex;
  private long nextDueNanos;

  public SyntheticCameraDevice(int width, int height, int fps) {
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException("frame size must be positive");
    }
    if (fps <= 0) {
      throw new IllegalArgumentException("fps must be positive");
    }
    this.width = width;
    this.height = height;
    this.periodNanos = TimeUnit.SECONDS.toNanos(1) / fps;
  }

  @Override
  public void open() {
    open = true;
    nextDueNanos = System.nanoTime();
  }

  @Override
  public Optional<Frame> read() throws IOException {
    if (!open) {
      throw new IOException("synthetic camera is closed");
    }
    long wait = nextDueNanos - System.nanoTime();
    if (wait > 0) {
      try {
        TimeUnit.NANOSECONDS.sleep(wait);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return Optional.empty();
      }
    }
    nextDueNanos = Math.max(nextDueNanos + periodNanos, System.nanoTime());
    return Optional.of(render(frameIndex++));
  }

  private Frame render(long index) {
    byte[] rgb = new byte[width * height * Frame.CHANNELS];
    int shift = (int) (index % width);
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        int band = ((x + shift) * 8 / width) % 8;
        int i = (y * width + x) * Frame.CHANNELS;
        rgb[i] = (byte) ((band & 1) != 0 ? 0xFF : 0);
        rgb[i + 1] = (byte) ((band & 2) != 0 ? 0xFF : 0);
        rgb[i + 2] = (byte) ((band & 4) != 0 ? 0xFF : y * 255 / height);
      }
    }
    return new Frame(width, height, rgb, 0L);
  }

  @Override
  public String describe() {
    return "synthetic:" + width + "x" + height;
  }

  @Override
  public void close() {
    open = false;
  }
}
