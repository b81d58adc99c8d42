package ca.gc.cra.mimetic.application.port;

import ca.gc.cra.mimetic.domain.frame.Frame;
import java.io.IOException;
import java.util.Optional;

/**
 * <strong>What:</strong> Port over a physical or simulated camera.
 * <p><strong>Why:</strong> Keeps the capture loop independent of the imaging backend (synthetic
 * pattern, image replay, native camera bindings).</p>
 * <p><strong>Role:</strong> Driven by {@code LatestFrameSource} from a single capture thread.</p>
 * <p><strong>Thread-safety:</strong> {@link #read()} is called from one thread; {@link #close()} may be
 * called from another to unblock it.</p>
 *
 * @since 0.1.0
 */
public interface CameraDevice extends AutoCloseable {
  /**
   * Opens the device.
   *
   * @throws IOException when the device cannot be opened; fatal for session start-up
   */
  void open() throws IOException;

  /**
   * Acquires the next image, blocking for at most one acquisition cycle.
   *
   * @return captured frame, or empty when no image was produced this cycle
   * @throws IOException when the device fails
   */
  Optional<Frame> read() throws IOException;

  /** @return human-readable device description for logs */
  String describe();

  /** Releases the device. Idempotent. */
  @Override
  void close();
}
