package ca.gc.cra.pglo.domain.error;

/**
 * <strong>What:</strong> Taxonomy of failures surfaced by large object operations.
 * <p><strong>Why:</strong> Callers branch on the kind of failure (missing object, read-only descriptor, bad offset)
 * rather than on backend-specific error codes.</p>
 * <p><strong>Role:</strong> Domain value attached to every {@link LargeObjectException}.</p>
 * <p><strong>Thread-safety:</strong> Immutable enum.</p>
 *
 * @since PGLO 0.1-doc
 */
public enum ErrorKind {
  /** Object id or descriptor does not (or no longer) exist. */
  NOT_FOUND,
  /** Object id collision on creation. */
  ALREADY_EXISTS,
  /** Write or resize attempted through a descriptor not opened for writing. */
  READ_ONLY,
  /** Seek would move the cursor before byte 0. */
  INVALID_OFFSET,
  /** Unrecognised open mode requested. */
  INVALID_MODE,
  /** The enclosing scope ran past its deadline. */
  TIMEOUT,
  /** Any other backend failure (connection loss, unexpected server error). */
  BACKEND
}
