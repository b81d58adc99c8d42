package ca.gc.cra.mimetic.application.port;

import ca.gc.cra.mimetic.domain.motion.ActuatorPayload;
import java.io.IOException;

/**
 * <strong>What:</strong> Port delivering position commands to one actuator controller.
 * <p><strong>Why:</strong> Separates the dispatcher's queueing and pacing from the wire protocol.</p>
 * <p><strong>Thread-safety:</strong> Called from a single dispatcher worker thread.</p>
 * <p><strong>Performance:</strong> Implementations must bound each call with a short timeout.</p>
 *
 * @since 0.1.0
 */
public interface ActuatorClient extends AutoCloseable {
  /**
   * Sends one payload.
   *
   * @param payload command to deliver
   * @throws IOException when the endpoint is unreachable, times out, or answers with a non-2xx status
   * @throws InterruptedException when the sending thread is interrupted
   */
  void post(ActuatorPayload payload) throws IOException, InterruptedException;

  /** @return endpoint description for logs */
  String endpoint();

  @Override
  default void close() {}
}
