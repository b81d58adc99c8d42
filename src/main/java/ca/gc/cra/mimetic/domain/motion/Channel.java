package ca.gc.cra.mimetic.domain.motion;

import java.util.Locale;

/**
 * Smoothed actuator channels with their fixed calibration table.
 *
 * <p>Each channel carries its default EMA factor, the neutral rest value the smoother is seeded with,
 * and the clamp/scale applied <em>after</em> smoothing to reach the actuator's 0..6 unit range.
 * The EMA state and the change gate always work on unscaled values.</p>
 *
 * <table>
 *   <caption>Channel table</caption>
 *   <tr><th>key</th><th>source</th><th>alpha</th><th>seed</th><th>clamp</th><th>scale range</th></tr>
 *   <tr><td>x</td><td>pitch</td><td>0.3</td><td>0</td><td>[-150, 150]</td><td>[-150, 150]</td></tr>
 *   <tr><td>y</td><td>roll</td><td>0.2</td><td>0</td><td>[-150, 150]</td><td>[-150, 150]</td></tr>
 *   <tr><td>z</td><td>yaw</td><td>0.1</td><td>0</td><td>[-40, 40]</td><td>[0, 100]</td></tr>
 *   <tr><td>h</td><td>height</td><td>0.3</td><td>50</td><td>[0, 100]</td><td>[0, 100]</td></tr>
 *   <tr><td>e</td><td>height (ears)</td><td>0.2</td><td>70</td><td>[50, 130]</td><td>[50, 130]</td></tr>
 * </table>
 *
 * <p>The yaw row maps into [0, 100] so a centred head lands at the bottom of the range; negative yaw
 * saturates at 0. Actuator firmware is calibrated against this table.</p>
 *
 * @since 0.1.0
 */
public enum Channel {
  PITCH("x", 0.3, 0.0, -150.0, 150.0, -150.0, 150.0),
  ROLL("y", 0.2, 0.0, -150.0, 150.0, -150.0, 150.0),
  YAW("z", 0.1, 0.0, -40.0, 40.0, 0.0, 100.0),
  HEIGHT("h", 0.3, 50.0, 0.0, 100.0, 0.0, 100.0),
  EARS("e", 0.2, 70.0, 50.0, 130.0, 50.0, 130.0);

  /** Upper bound of the actuator unit range. */
  public static final double ACTUATOR_UNITS = 6.0;

  private final String key;
  private final double defaultAlpha;
  private final double neutral;
  private final double clampMin;
  private final double clampMax;
  private final double rangeMin;
  private final double rangeMax;

  Channel(
      String key,
      double defaultAlpha,
      double neutral,
      double clampMin,
      double clampMax,
      double rangeMin,
      double rangeMax) {
    this.key = key;
    this.defaultAlpha = defaultAlpha;
    this.neutral = neutral;
    this.clampMin = clampMin;
    this.clampMax = clampMax;
    this.rangeMin = rangeMin;
    this.rangeMax = rangeMax;
  }

  /**
   * Resolves a channel by its single-letter key.
   *
   * @param key one of {@code x, y, z, h, e} (case-insensitive)
   * @return matching channel
   * @throws IllegalArgumentException when the key is unknown
   */
  public static Channel fromKey(String key) {
    if (key != null) {
      String normalized = key.trim().toLowerCase(Locale.ROOT);
      for (Channel channel : values()) {
        if (channel.key.equals(normalized)) {
          return channel;
        }
      }
    }
    throw new IllegalArgumentException("unknown channel key: " + key);
  }

  public String key() {
    return key;
  }

  public double defaultAlpha() {
    return defaultAlpha;
  }

  /** @return rest value used to seed smoothing state */
  public double neutral() {
    return neutral;
  }

  /**
   * Clamps a smoothed value and maps it linearly onto {@code [0, ACTUATOR_UNITS]}.
   *
   * @param smoothed smoothed channel value in source units
   * @return actuator units, saturated at both ends
   */
  public double toActuatorUnits(double smoothed) {
    double clamped = clamp(smoothed, clampMin, clampMax);
    double normalized = (clamped - rangeMin) / (rangeMax - rangeMin);
    return clamp(normalized, 0.0, 1.0) * ACTUATOR_UNITS;
  }

  static double clamp(double value, double min, double max) {
    return Math.max(min, Math.min(max, value));
  }
}
