package ca.gc.cra.mimetic.domain.detect;

import java.util.Locale;

/** Coarse horizontal gaze direction. */
public enum GazeLabel {
  LEFT,
  CENTER,
  RIGHT;

  /**
   * Swaps left and right; {@link #CENTER} is unchanged.
   *
   * @return mirrored label
   */
  public GazeLabel mirrored() {
    return switch (this) {
      case LEFT -> RIGHT;
      case RIGHT -> LEFT;
      case CENTER -> CENTER;
    };
  }

  /** @return lowercase label written to pose logs */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
