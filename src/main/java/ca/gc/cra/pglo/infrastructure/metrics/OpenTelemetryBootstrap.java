package ca.gc.cra.pglo.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the SDK meter provider for the CLI and tests.
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.pglo";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");

  private OpenTelemetryBootstrap() {}

  static Provisioned initialize(TelemetrySettings settings) {
    Objects.requireNonNull(settings, "settings");
    if (!settings.enabled()) {
      log.debug("Metrics export disabled");
      return Provisioned.noop();
    }
    try {
      OtlpGrpcMetricExporter exporter =
          OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build();
      MetricReader reader = PeriodicMetricReader.builder(exporter).setInterval(EXPORT_INTERVAL).build();
      Provisioned provisioned = build(reader, parseAttributes(settings.resourceAttributes()));
      log.info("OTLP metrics exporter targeting {}", settings.endpoint());
      return provisioned;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; continuing without export", ex);
      return Provisioned.noop();
    }
  }

  static Provisioned forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static Provisioned build(MetricReader reader, Attributes extra) {
    String version = serviceVersion();
    Resource resource = Resource.getDefault()
        .merge(Resource.create(Attributes.of(SERVICE_NAME, "pglo", SERVICE_VERSION, version)))
        .merge(Resource.create(extra));
    SdkMeterProvider provider =
        SdkMeterProvider.builder().setResource(resource).registerMetricReader(reader).build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build();
    return new Provisioned(meter, provider);
  }

  static Attributes parseAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String token : raw.split(",")) {
      String entry = token.trim();
      int eq = entry.indexOf('=');
      if (eq <= 0 || eq == entry.length() - 1) {
        if (!entry.isEmpty()) {
          log.warn("Ignoring malformed resource attribute: {}", entry);
        }
        continue;
      }
      builder.put(AttributeKey.stringKey(entry.substring(0, eq).trim()), entry.substring(eq + 1).trim());
    }
    return builder.build();
  }

  private static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    if (pkg != null && pkg.getImplementationVersion() != null) {
      return pkg.getImplementationVersion();
    }
    try (InputStream in =
        OpenTelemetryBootstrap.class.getResourceAsStream("/META-INF/maven/ca.gc.cra/pglo/pom.properties")) {
      if (in != null) {
        Properties props = new Properties();
        props.load(in);
        return props.getProperty("version", "0.0.0-dev");
      }
    } catch (IOException ex) {
      log.debug("pom.properties unreadable", ex);
    }
    return "0.0.0-dev";
  }

  /** Meter plus the provider that owns it; the provider is {@code null} in noop mode. */
  static final class Provisioned implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private Provisioned(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static Provisioned noop() {
      return new Provisioned(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null) {
        CompletableResultCode flushed = provider.forceFlush().join(5, TimeUnit.SECONDS);
        if (!flushed.isSuccess()) {
          log.warn("Metrics flush did not complete within 5s");
        }
      }
    }

    @Override
    public void close() {
      if (provider != null) {
        CompletableResultCode shutdown = provider.shutdown().join(5, TimeUnit.SECONDS);
        if (!shutdown.isSuccess()) {
          log.warn("Meter provider shutdown did not complete within 5s");
        }
      }
    }
  }
}
