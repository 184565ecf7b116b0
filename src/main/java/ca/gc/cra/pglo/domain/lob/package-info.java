/**
 * <strong>Purpose:</strong> Value types describing large object access: open modes, seek anchors and ABI constants.
 * <p><strong>Concurrency:</strong> Immutable enums and stateless helpers.
 *
 * @since PGLO 0.1-doc
 */
package ca.gc.cra.pglo.domain.lob;
