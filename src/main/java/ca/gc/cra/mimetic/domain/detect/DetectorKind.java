package ca.gc.cra.mimetic.domain.detect;

import java.util.Locale;

/**
 * Landmark detector families feeding the correlation buffer.
 *
 * @since 0.1.0
 */
public enum DetectorKind {
  /** Face mesh detector: head angles and gaze. */
  FACE,
  /** Body pose detector: torso height. */
  POSE;

  /**
   * Lowercase label used in metric keys, thread names and endpoint paths.
   *
   * @return stable lowercase name
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Resolves the kind sharing the fused sample with this one.
   *
   * @return the other detector kind
   */
  public DetectorKind other() {
    return this == FACE ? POSE : FACE;
  }
}
