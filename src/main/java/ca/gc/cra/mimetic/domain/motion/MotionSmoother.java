package ca.gc.cra.mimetic.domain.motion;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Per-channel exponential smoothing with a rate and change gate.
 *
 * <p>State is owned by the instance: one smoother per session, so concurrent sessions never share
 * running averages. Not thread-safe; the control loop thread is the only caller.</p>
 *
 * <p>Smoothed and last-emitted values start at each channel's {@link Channel#neutral()} value. The
 * first emission becomes eligible once {@code minInterval} has elapsed since construction.</p>
 *
 * @since 0.1.0
 */
public final class MotionSmoother {
  public static final double DEFAULT_RATE_HZ = 10.0;
  public static final double DEFAULT_THRESHOLD = 2.0;
  public static final int DEFAULT_MIN_DURATION_MS = 100;
  public static final int DEFAULT_MAX_DURATION_MS = 400;

  private final double[] alpha = new double[Channel.values().length];
  private final double[] smoothed = new double[Channel.values().length];
  private final double[] lastEmitted = new double[Channel.values().length];
  private final long minIntervalMillis;
  private final double threshold;
  private final int minDurationMs;
  private final int maxDurationMs;
  private long lastEmitMillis;

  /**
   * Creates a smoother.
   *
   * @param settings gate and smoothing parameters
   * @param createdAtMillis construction time on the caller's monotonic clock
   */
  public MotionSmoother(Settings settings, long createdAtMillis) {
    Objects.requireNonNull(settings, "settings");
    for (Channel channel : Channel.values()) {
      alpha[channel.ordinal()] = settings.alpha(channel);
      smoothed[channel.ordinal()] = channel.neutral();
    }
    System.arraycopy(smoothed, 0, lastEmitted, 0, smoothed.length);
    this.minIntervalMillis = Math.round(1000.0 / settings.rateHz());
    this.threshold = settings.threshold();
    this.minDurationMs = settings.minDurationMs();
    this.maxDurationMs = settings.maxDurationMs();
    this.lastEmitMillis = createdAtMillis;
  }

  /**
   * Folds a raw value into the channel's running average.
   *
   * @param channel target channel
   * @param value raw value in source units
   * @return new smoothed value, or empty when {@code value} is NaN or infinite (state untouched)
   */
  public OptionalDouble smooth(Channel channel, double value) {
    Objects.requireNonNull(channel, "channel");
    if (!Double.isFinite(value)) {
      return OptionalDouble.empty();
    }
    int i = channel.ordinal();
    double next = alpha[i] * value + (1.0 - alpha[i]) * smoothed[i];
    smoothed[i] = next;
    return OptionalDouble.of(next);
  }

  /**
   * Current smoothed value of a channel.
   *
   * @param channel channel to read
   * @return smoothed value in source units
   */
  public double smoothed(Channel channel) {
    return smoothed[channel.ordinal()];
  }

  /**
   * Decides whether to emit now.
   *
   * @param channels channels whose change drives the gate
   * @param nowMillis current time on the same clock as construction
   * @return emit decision; on emit the requested channels are snapshotted as last emitted
   */
  public EmitDecision shouldEmit(Collection<Channel> channels, long nowMillis) {
    Objects.requireNonNull(channels, "channels");
    if (channels.isEmpty()) {
      throw new IllegalArgumentException("at least one channel is required");
    }
    if (nowMillis - lastEmitMillis < minIntervalMillis) {
      return EmitDecision.HOLD;
    }
    double maxChange = 0.0;
    for (Channel channel : channels) {
      int i = channel.ordinal();
      maxChange = Math.max(maxChange, Math.abs(smoothed[i] - lastEmitted[i]));
    }
    if (!(maxChange > threshold)) {
      return EmitDecision.HOLD;
    }
    lastEmitMillis = nowMillis;
    for (Channel channel : channels) {
      lastEmitted[channel.ordinal()] = smoothed[channel.ordinal()];
    }
    long duration = Math.round(maxChange / 100.0 * 1000.0);
    return EmitDecision.emit((int) Math.max(minDurationMs, Math.min(maxDurationMs, duration)));
  }

  @Override
  public String toString() {
    return "MotionSmoother[smoothed=" + Arrays.toString(smoothed) + "]";
  }

  /**
   * Smoothing factors and gate parameters.
   *
   * @param alphas EMA factor per channel; missing channels use {@link Channel#defaultAlpha()}
   * @param rateHz maximum emission rate
   * @param threshold minimum change (source units) that triggers an emission
   * @param minDurationMs lower transition bound
   * @param maxDurationMs upper transition bound
   */
  public record Settings(
      Map<Channel, Double> alphas,
      double rateHz,
      double threshold,
      int minDurationMs,
      int maxDurationMs) {
    public Settings {
      alphas = alphas == null || alphas.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(alphas));
      for (Map.Entry<Channel, Double> entry : alphas.entrySet()) {
        double a = entry.getValue();
        if (!(a > 0.0 && a <= 1.0)) {
          throw new IllegalArgumentException(
              "alpha." + entry.getKey().key() + " must be within (0, 1] (was " + a + ")");
        }
      }
      if (!(rateHz > 0.0) || Double.isInfinite(rateHz)) {
        throw new IllegalArgumentException("rateHz must be positive (was " + rateHz + ")");
      }
      if (!(threshold >= 0.0) || Double.isInfinite(threshold)) {
        throw new IllegalArgumentException("threshold must be non-negative (was " + threshold + ")");
      }
      if (minDurationMs <= 0 || maxDurationMs < minDurationMs) {
        throw new IllegalArgumentException(
            "durations must satisfy 0 < min <= max (was " + minDurationMs + ", " + maxDurationMs + ")");
      }
    }

    /** @return stock settings: default alphas, 10 Hz, threshold 2.0, 100..400 ms */
    public static Settings defaults() {
      return new Settings(
          Map.of(), DEFAULT_RATE_HZ, DEFAULT_THRESHOLD, DEFAULT_MIN_DURATION_MS, DEFAULT_MAX_DURATION_MS);
    }

    public double alpha(Channel channel) {
      Double configured = alphas.get(channel);
      return configured != null ? configured : channel.defaultAlpha();
    }
  }
}
