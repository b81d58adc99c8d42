package ca.gc.cra.mimetic.infrastructure.camera;

import ca.gc.cra.mimetic.application.port.CameraDevice;
import ca.gc.cra.mimetic.domain.frame.Frame;
import ca.gc.cra.mimetic.domain.frame.FrameOps;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays the still images of a directory (PNG, JPEG, BMP) in name order, looping forever.
 *
 * <p>Images are decoded once on {@link #open()} and scaled to the configured frame size when one is
 * given. {@link #read()} paces itself to the configured rate.</p>
 */
public final class ImageSequenceCameraDevice implements CameraDevice {
  private static final Logger log = LoggerFactory.getLogger(ImageSequenceCameraDevice.class);
  private static final List<String> EXTENSIONS = List.of(".png", ".jpg", ".jpeg", ".bmp");

  private final Path directory;
  private final int width;
  private final int height;
  private final long periodNanos;
  private List<Frame> frames = List.of();
  private int index;
  private long nextDueNanos;

  /**
   * Creates a replay device.
   *
   * @param directory folder holding the images
   * @param width output width, or {@code 0} to keep each image's size
   * @param height output height, or {@code 0} to keep each image's size
   * @param fps replay rate
   */
  public ImageSequenceCameraDevice(Path directory, int width, int height, int fps) {
    this.directory = Objects.requireNonNull(directory, "directory");
    if (width < 0 || height < 0) {
      throw new IllegalArgumentException("frame size must not be negative");
    }
    if (fps <= 0) {
      throw new IllegalArgumentException("fps must be positive");
    }
    this.width = width;
    this.height = height;
    this.periodNanos = TimeUnit.SECONDS.toNanos(1) / fps;
  }

  @Override
  public void open() throws IOException {
    if (!Files.isDirectory(directory)) {
      throw new IOException("image directory not found: " + directory);
    }
    List<Path> files;
    try (Stream<Path> listing = Files.list(directory)) {
      files = listing.filter(ImageSequenceCameraDevice::isImage).sorted().toList();
    }
    List<Frame> loaded = new ArrayList<>(files.size());
    for (Path file : files) {
      BufferedImage image = ImageIO.read(file.toFile());
      if (image == null) {
        log.warn("Skipping unreadable image {}", file);
        continue;
      }
      Frame frame = FrameImages.toFrame(image, 0L);
      loaded.add(width > 0 && height > 0 ? FrameOps.resize(frame, width, height) : frame);
    }
    if (loaded.isEmpty()) {
      throw new IOException("no readable images in " + directory);
    }
    frames = List.copyOf(loaded);
    index = 0;
    nextDueNanos = System.nanoTime();
    log.debug("Loaded {} image(s) from {}", frames.size(), directory);
  }

  @Override
  public Optional<Frame> read() throws IOException {
    if (frames.isEmpty()) {
      throw new IOException("image sequence is not open");
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
    Frame next = frames.get(index);
    index = (index + 1) % frames.size();
    return Optional.of(next);
  }

  /** @return images loaded by the last {@link #open()} */
  public int size() {
    return frames.size();
  }

  @Override
  public String describe() {
    return "images:" + directory;
  }

  @Override
  public void close() {
    frames = List.of();
  }

  private static boolean isImage(Path path) {
    String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
    return Files.isRegularFile(path) && EXTENSIONS.stream().anyMatch(name::endsWith);
  }
}
