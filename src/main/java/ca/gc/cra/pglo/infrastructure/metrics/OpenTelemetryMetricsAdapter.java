package ca.gc.cra.pglo.infrastructure.metrics;

import ca.gc.cra.pglo.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * <strong>What:</strong> {@link MetricsPort} backed by OpenTelemetry counters and histograms.
 * <p><strong>Naming:</strong> Port keys such as {@code lob.import.bytes} become instrument names after lower-casing
 * and replacing characters OpenTelemetry rejects with {@code _}; the raw key travels as the
 * {@code pglo.metric.key} attribute.</p>
 * <p><strong>Thread-safety:</strong> Instruments are created lazily in concurrent maps; safe for concurrent use.</p>
 *
 * @since PGLO 0.1-doc
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("pglo.metric.key");

  private final OpenTelemetryBootstrap.Provisioned provisioned;
  private final Meter meter;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter exporting according to {@code settings}.
   *
   * @param settings exporter selection
   */
  public OpenTelemetryMetricsAdapter(TelemetrySettings settings) {
    this(OpenTelemetryBootstrap.initialize(settings));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.Provisioned provisioned) {
    this.provisioned = Objects.requireNonNull(provisioned, "provisioned");
    this.meter = provisioned.meter();
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    counters
        .computeIfAbsent(key, k -> meter.counterBuilder(instrumentName(k)).setUnit("1").build())
        .add(1, Attributes.of(METRIC_KEY, key));
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    histograms
        .computeIfAbsent(key, k -> meter.histogramBuilder(instrumentName(k)).ofLongs().build())
        .record(value, Attributes.of(METRIC_KEY, key));
  }

  /** Pushes pending observations to the exporter. */
  public void forceFlush() {
    provisioned.forceFlush();
  }

  boolean isNoop() {
    return provisioned.isNoop();
  }

  @Override
  public void close() {
    provisioned.close();
  }

  static String instrumentName(String key) {
    String trimmed = key.trim().toLowerCase(Locale.ROOT);
    if (trimmed.isEmpty()) {
      return "pglo.metric";
    }
    StringBuilder name = new StringBuilder(trimmed.length() + 1);
    if (!Character.isLetter(trimmed.charAt(0))) {
      name.append('m');
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      name.append(Character.isLetterOrDigit(c) || c == '.' || c == '_' || c == '-' ? c : '_');
    }
    return name.toString();
  }
}
