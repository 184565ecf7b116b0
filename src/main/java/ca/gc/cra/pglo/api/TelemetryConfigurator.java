package ca.gc.cra.pglo.api;

import ca.gc.cra.pglo.infrastructure.metrics.TelemetrySettings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates the {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes} settings.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  static TelemetrySettings settings(Map<String, String> effective) {
    String exporter = trimmed(effective.get("metricsExporter")).toLowerCase(Locale.ROOT);
    if (!exporter.isEmpty() && !exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    String endpoint = trimmed(effective.get("otelEndpoint"));
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
    }
    String attributes = trimmed(effective.get("otelResourceAttributes"));
    if (attributes.length() > MAX_RESOURCE_ATTRIBUTES_LENGTH) {
      throw new IllegalArgumentException(
          "otelResourceAttributes length must be <= " + MAX_RESOURCE_ATTRIBUTES_LENGTH);
    }
    TelemetrySettings settings = new TelemetrySettings(exporter.isEmpty() ? "none" : exporter, endpoint, attributes);
    log.debug("Metrics exporter {} targeting {}", settings.exporter(), settings.endpoint());
    return settings;
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }

  private static String trimmed(String value) {
    return value == null ? "" : value.trim();
  }
}
