package ca.gc.cra.pglo.application.port;

import ca.gc.cra.pglo.domain.error.LargeObjectException;
import ca.gc.cra.pglo.domain.lob.SeekAnchor;

/**
 * <strong>What:</strong> Port executing the primitive large object operations of a remote store.
 * <p><strong>Why:</strong> Keeps handles, stream adapters and use cases independent of the wire protocol and
 * transport; the JDBC adapter speaks to PostgreSQL, the in-memory adapter emulates it.</p>
 * <p><strong>Role:</strong> Output port bound to exactly one transactional scope. Descriptors it hands out are valid
 * only inside that scope.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Execute one round-trip per call; never retry.</li>
 *   <li>Translate backend error codes into the {@link LargeObjectException} taxonomy.</li>
 *   <li>Own the cursor position of each descriptor; callers keep no mirror of it.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not required; a scope is driven by one thread at a time.</p>
 * <p><strong>Performance:</strong> Every call blocks for one server round-trip.</p>
 * <p><strong>Observability:</strong> Implementations log calls at DEBUG with object id and descriptor.</p>
 *
 * @since PGLO 0.1-doc
 * @see ca.gc.cra.pglo.infrastructure.jdbc.JdbcLargeObjectBackend
 * @see ca.gc.cra.pglo.infrastructure.memory.InMemoryLargeObjectBackend
 */
public interface LargeObjectBackend {
  /**
   * Creates an empty object.
   *
   * @param desiredId requested id, or {@code 0} to let the backend choose
   * @return id of the new object
   * @throws LargeObjectException {@code ALREADY_EXISTS} when {@code desiredId} is taken
   */
  long create(long desiredId) throws LargeObjectException;

  /**
   * Deletes an object and all of its data.
   *
   * @param objectId object to delete
   * @throws LargeObjectException {@code NOT_FOUND} when no such object exists
   */
  void unlink(long objectId) throws LargeObjectException;

  /**
   * Opens an object, returning a descriptor positioned at offset 0.
   *
   * @param objectId object to open
   * @param flags {@code INV_READ} and/or {@code INV_WRITE}
   * @return descriptor valid until closed or until the scope ends
   * @throws LargeObjectException {@code NOT_FOUND} when no such object exists
   */
  int open(long objectId, int flags) throws LargeObjectException;

  /**
   * Releases a descriptor.
   *
   * @param descriptor descriptor to close
   * @throws LargeObjectException {@code NOT_FOUND} when the descriptor is invalid
   */
  void close(int descriptor) throws LargeObjectException;

  /**
   * Writes bytes at the current position, overwriting in place and extending past end-of-object as needed.
   *
   * @param descriptor open descriptor
   * @param data bytes to write; may be empty
   * @throws LargeObjectException {@code READ_ONLY} or {@code NOT_FOUND}
   */
  void write(int descriptor, byte[] data) throws LargeObjectException;

  /**
   * Reads up to {@code length} bytes from the current position.
   *
   * @param descriptor open descriptor
   * @param length maximum number of bytes
   * @return bytes read; empty at end-of-object
   * @throws LargeObjectException {@code NOT_FOUND} when the descriptor is invalid
   */
  byte[] read(int descriptor, int length) throws LargeObjectException;

  /**
   * Moves the cursor.
   *
   * @param descriptor open descriptor
   * @param offset signed offset relative to {@code anchor}
   * @param anchor reference point
   * @return new absolute position
   * @throws LargeObjectException {@code INVALID_OFFSET} when the target lies before byte 0, or {@code NOT_FOUND}
   */
  long seek(int descriptor, long offset, SeekAnchor anchor) throws LargeObjectException;

  /**
   * Reports the cursor position.
   *
   * @param descriptor open descriptor
   * @return absolute position
   * @throws LargeObjectException {@code NOT_FOUND} when the descriptor is invalid
   */
  long tell(int descriptor) throws LargeObjectException;

  /**
   * Truncates or zero-extends the object to exactly {@code size} bytes without moving the cursor.
   *
   * @param descriptor open descriptor
   * @param size target size in bytes
   * @throws LargeObjectException {@code READ_ONLY} or {@code NOT_FOUND}
   */
  void resize(int descriptor, long size) throws LargeObjectException;
}
