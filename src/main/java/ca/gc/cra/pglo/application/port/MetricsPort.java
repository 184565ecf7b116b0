package ca.gc.cra.pglo.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for large object transfers.
 * <p><strong>Why:</strong> Lets use cases count imports, exports and uploads without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Output port implemented by {@code OpenTelemetryMetricsAdapter} and
 * {@code NoOpMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates.</p>
 * <p><strong>Performance:</strong> Calls should be non-blocking and amortized O(1).</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code lob.import.bytes}).</p>
 *
 * @since PGLO 0.1-doc
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier such as {@code lob.export.success}; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (bytes, milliseconds); semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
