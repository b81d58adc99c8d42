package ca.gc.cra.mimetic.infrastructure.metrics;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Validated OpenTelemetry metrics options.
 *
 * @param exporter {@code otlp} or {@code none}
 * @param endpoint OTLP gRPC endpoint URL
 * @param resourceAttributes extra resource attributes
 * @param exportInterval periodic reader interval
 * @since 0.1.0
 */
public record TelemetrySettings(
    String exporter, String endpoint, Map<String, String> resourceAttributes, Duration exportInterval) {
  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  public TelemetrySettings {
    exporter = Objects.requireNonNullElse(exporter, "otlp").trim().toLowerCase(Locale.ROOT);
    if (!exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    resourceAttributes = resourceAttributes == null ? Map.of() : Map.copyOf(resourceAttributes);
    exportInterval = Objects.requireNonNullElse(exportInterval, Duration.ofSeconds(30));
    if (exportInterval.isNegative() || exportInterval.isZero()) {
      throw new IllegalArgumentException("exportInterval must be positive");
    }
  }

  /** @return settings with exporting disabled */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings("none", null, Map.of(), null);
  }

  public boolean enabled() {
    return exporter.equals("otlp");
  }
}
