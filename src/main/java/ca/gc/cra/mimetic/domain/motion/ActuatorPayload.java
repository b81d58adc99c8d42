package ca.gc.cra.mimetic.domain.motion;

/**
 * Position command posted to an actuator controller.
 *
 * <p>{@code ax}, {@code ay} and {@code az} are fixed orientation constants expected by the
 * controller firmware.</p>
 *
 * @param x pitch command
 * @param y roll command
 * @param z yaw command
 * @param h height command
 * @param ears ear command
 * @param durationMs transition duration in milliseconds
 * @since 0.1.0
 */
public record ActuatorPayload(double x, double y, double z, double h, double ears, int durationMs) {
  public static final int AX = 0;
  public static final int AY = 0;
  public static final int AZ = -1;
  /** Transition used when no gate duration is available. */
  public static final int DEFAULT_DURATION_MS = 500;

  public ActuatorPayload {
    requireFinite("x", x);
    requireFinite("y", y);
    requireFinite("z", z);
    requireFinite("h", h);
    requireFinite("ears", ears);
    if (durationMs <= 0) {
      throw new IllegalArgumentException("durationMs must be positive (was " + durationMs + ")");
    }
  }

  public int ax() {
    return AX;
  }

  public int ay() {
    return AY;
  }

  public int az() {
    return AZ;
  }

  private static void requireFinite(String name, double value) {
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException(name + " must be finite (was " + value + ")");
    }
  }
}
