package ca.gc.cra.pglo.infrastructure.metrics;

import java.util.Locale;

/**
 * Exporter selection resolved from configuration.
 *
 * @param exporter {@code otlp} or {@code none}
 * @param endpoint OTLP gRPC endpoint; {@code null} selects {@code http://localhost:4317}
 * @param resourceAttributes comma separated {@code key=value} pairs added to the resource
 * @since PGLO 0.1-doc
 */
public record TelemetrySettings(String exporter, String endpoint, String resourceAttributes) {
  /** Endpoint used when none is configured. */
  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  /**
   * Normalizes blanks to defaults.
   */
  public TelemetrySettings {
    exporter = exporter == null || exporter.isBlank() ? "otlp" : exporter.trim().toLowerCase(Locale.ROOT);
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
  }

  /**
   * Settings that turn export off.
   *
   * @return disabled settings
   */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings("none", null, null);
  }

  boolean enabled() {
    return !"none".equals(exporter);
  }
}
