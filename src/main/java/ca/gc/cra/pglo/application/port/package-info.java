/**
 * <strong>Purpose:</strong> Ports separating large object semantics from the store, the transaction lifecycle,
 * metrics and time.
 * <p><strong>Pipeline role:</strong> Handles and use cases depend only on these interfaces; adapters live under
 * {@code infrastructure}.
 * <p><strong>Concurrency:</strong> Backends are scope-bound and single-threaded; transaction ports, metrics and
 * clocks are shared.
 *
 * @since PGLO 0.1-doc
 */
package ca.gc.cra.pglo.application.port;
