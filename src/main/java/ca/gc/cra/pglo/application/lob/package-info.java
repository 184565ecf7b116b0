/**
 * <strong>Purpose:</strong> The large object handle and the adapters that stream it in bounded chunks.
 * <p><strong>Pipeline role:</strong> Sits between the import/export use cases and the backend port.
 * <p><strong>Concurrency:</strong> Handles and adapters are single-threaded; the cursor lives in the backend.
 * <p><strong>Lifetime:</strong> Nothing in this package may outlive the transactional scope that opened it.
 *
 * @since PGLO 0.1-doc
 */
package ca.gc.cra.pglo.application.lob;
