/**
 * Metrics adapters: OpenTelemetry export over OTLP gRPC, or nothing at all.
 * <p>Only counts, byte totals and latencies are published; object contents never leave the process.</p>
 */
package ca.gc.cra.pglo.infrastructure.metrics;
