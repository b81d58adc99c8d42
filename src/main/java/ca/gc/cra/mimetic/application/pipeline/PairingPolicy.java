package ca.gc.cra.mimetic.application.pipeline;

import java.util.Locale;

/**
 * How {@link CorrelationBuffer} combines face and pose results. One policy is chosen per session.
 */
public enum PairingPolicy {
  /**
   * Merge every result with the most recent still-valid result of the other kind. Lowest latency;
   * default.
   */
  LATEST,
  /**
   * Fuse only results whose timestamps match within a tolerance; unmatched entries expire after
   * {@code maxDelay}.
   */
  STRICT;

  /**
   * Parses a configuration value.
   *
   * @param raw {@code latest} or {@code strict} (case-insensitive)
   * @return policy
   * @throws IllegalArgumentException for any other value
   */
  public static PairingPolicy fromString(String raw) {
    if (raw != null) {
      switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "latest":
          return LATEST;
        case "strict":
          return STRICT;
        default:
          break;
      }
    }
    throw new IllegalArgumentException("pairing must be 'latest' or 'strict' (was " + raw + ")");
  }
}
