package ca.gc.cra.mimetic.domain.motion;

import ca.gc.cra.mimetic.domain.detect.Gaze;
import java.util.Objects;

/**
 * One processed control-loop sample as written to the pose log.
 *
 * @param timestampMillis fused sample timestamp
 * @param pitch offset-corrected, clamped pitch in degrees
 * @param roll offset-corrected, clamped roll in degrees
 * @param yaw offset-corrected, clamped yaw in degrees
 * @param payload actuator values computed for this sample
 * @param height raw torso height
 * @param gaze gaze estimate or {@code null}
 * @param fps control loop rate measured over the previous iteration
 * @param sent whether the payload passed the emission gate
 * @since 0.1.0
 */
public record PoseRecord(
    long timestampMillis,
    double pitch,
    double roll,
    double yaw,
    ActuatorPayload payload,
    double height,
    Gaze gaze,
    double fps,
    boolean sent) {
  public PoseRecord {
    Objects.requireNonNull(payload, "payload");
  }
}
