/**
 * <strong>Purpose:</strong> Generic chunk sources and sinks (buffers, {@code java.io} streams, iterables) and the
 * pump that connects them to large object adapters.
 * <p><strong>Concurrency:</strong> Single-threaded; one producer and one consumer per pump run.
 * <p><strong>Performance:</strong> Memory is bounded by the largest chunk in flight, except for
 * {@link ca.gc.cra.pglo.application.stream.ByteArrayChunkSink}, which holds the whole payload.
 *
 * @since PGLO 0.1-doc
 */
package ca.gc.cra.pglo.application.stream;
