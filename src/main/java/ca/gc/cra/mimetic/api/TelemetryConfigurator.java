package ca.gc.cra.mimetic.api;

import ca.gc.cra.mimetic.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.mimetic.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pulls the telemetry options out of a merged configuration map and validates them.
 *
 * <p>The keys {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes} are
 * removed from the map so the session parser never sees them.</p>
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  static TelemetrySettings extract(Map<String, String> config) {
    String exporter = trimmed(config.remove("metricsExporter"));
    String endpoint = trimmed(config.remove("otelEndpoint"));
    String attributes = trimmed(config.remove("otelResourceAttributes"));

    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
    }
    Map<String, String> resourceAttributes = Map.of();
    if (!attributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      resourceAttributes = parseAttributes(attributes);
    }
    TelemetrySettings settings = new TelemetrySettings(
        exporter.isEmpty() ? "none" : exporter, endpoint, resourceAttributes, null);
    if (settings.enabled()) {
      log.debug("OTLP metrics export to {} with {} extra resource attributes",
          settings.endpoint(), resourceAttributes.size());
    }
    return settings;
  }

  /** Parses {@code k1=v1,k2=v2}. */
  static Map<String, String> parseAttributes(String raw) {
    Map<String, String> out = new LinkedHashMap<>();
    for (String pair : raw.split(",")) {
      if (pair.isBlank()) {
        continue;
      }
      int eq = pair.indexOf('=');
      if (eq <= 0) {
        throw new IllegalArgumentException("otelResourceAttributes entries must be key=value (was " + pair.trim() + ")");
      }
      out.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
    }
    return out;
  }

  private static void validateEndpoint(String raw) {
    URI uri;
    try {
      uri = new URI(raw);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException("otelEndpoint must use http or https");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("otelEndpoint must include a host");
    }
  }

  private static String trimmed(String value) {
    return value == null ? "" : value.trim();
  }
}
