package ca.gc.cra.mimetic.domain.motion;

/**
 * Outcome of the smoother's rate and change gate.
 *
 * @param emit whether a payload should be sent now
 * @param durationMs transition time for the actuator; {@code 0} when {@code emit} is false
 * @since 0.1.0
 */
public record EmitDecision(boolean emit, int durationMs) {
  /** Gate closed. */
  public static final EmitDecision HOLD = new EmitDecision(false, 0);

  public EmitDecision {
    if (emit && durationMs <= 0) {
      throw new IllegalArgumentException("emitting decisions need a positive duration");
    }
    if (!emit && durationMs != 0) {
      throw new IllegalArgumentException("held decisions carry no duration");
    }
  }

  public static EmitDecision emit(int durationMs) {
    return new EmitDecision(true, durationMs);
  }
}
