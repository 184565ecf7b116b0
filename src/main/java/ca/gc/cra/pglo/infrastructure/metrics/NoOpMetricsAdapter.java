package ca.gc.cra.pglo.infrastructure.metrics;

import ca.gc.cra.pglo.application.port.MetricsPort;

/**
 * Metrics adapter used when the exporter is {@code none}; drops every observation.
 *
 * @since PGLO 0.1-doc
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  @Override
  public void increment(String key) {
    // dropped
  }

  @Override
  public void observe(String key, long value) {
    // dropped
  }
}
