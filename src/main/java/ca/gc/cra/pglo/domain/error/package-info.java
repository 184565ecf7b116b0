/**
 * <strong>Purpose:</strong> Typed failures raised by large object operations.
 * <p><strong>Pipeline role:</strong> Shared by handles, stream adapters, use cases and backends.
 * <p><strong>Concurrency:</strong> Exceptions are immutable values.
 *
 * @since PGLO 0.1-doc
 */
package ca.gc.cra.pglo.domain.error;
