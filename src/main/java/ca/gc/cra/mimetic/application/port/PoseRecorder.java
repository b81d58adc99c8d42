package ca.gc.cra.mimetic.application.port;

import ca.gc.cra.mimetic.domain.motion.PoseRecord;
import java.io.IOException;

/**
 * Sink for per-sample pose records written by the control loop.
 *
 * <p>Called from the control thread only. Failures are reported to the caller, which logs and keeps
 * running.</p>
 *
 * @since 0.1.0
 */
public interface PoseRecorder extends AutoCloseable {
  /**
   * Appends one record.
   *
   * @param record processed sample
   * @throws IOException when the sink cannot be written
   */
  void record(PoseRecord record) throws IOException;

  @Override
  default void close() throws IOException {}

  /** Recorder that discards everything. */
  PoseRecorder NO_OP = record -> {};
}
