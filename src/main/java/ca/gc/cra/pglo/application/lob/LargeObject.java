package ca.gc.cra.pglo.application.lob;

import ca.gc.cra.pglo.application.port.LargeObjectBackend;
import ca.gc.cra.pglo.domain.error.BackendFailureException;
import ca.gc.cra.pglo.domain.error.InvalidOffsetException;
import ca.gc.cra.pglo.domain.error.LargeObjectException;
import ca.gc.cra.pglo.domain.error.ObjectNotFoundException;
import ca.gc.cra.pglo.domain.lob.ChunkMath;
import ca.gc.cra.pglo.domain.lob.OpenMode;
import ca.gc.cra.pglo.domain.lob.SeekAnchor;
import java.io.IOException;
import java.util.Arrays;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Handle on one opened large object.
 * <p><strong>Why:</strong> Gives callers positional I/O (read, write, seek, tell, size, resize) and chunked streaming
 * over an object that lives in the database.</p>
 * <p><strong>Role:</strong> Core application type; owns a backend descriptor for the lifetime of one transactional
 * scope.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create, open, remove and close objects through the {@link LargeObjectBackend}.</li>
 *   <li>Expose cursor operations without mirroring the position client-side; every position query is a
 *   round-trip.</li>
 *   <li>Hand out producer/consumer adapters ({@link #reader()}, {@link #writer()}) and an indexed
 *   {@link #chunks()} view.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe. The backend keeps a single cursor per descriptor; callers must
 * serialize access to one handle.</p>
 * <p><strong>Lifetime:</strong> A handle must not outlive the scope whose backend opened it and must not escape the
 * {@link ca.gc.cra.pglo.application.port.TransactionalWork} it was created in. The backend closes outstanding
 * descriptors when the scope ends.</p>
 * <p><strong>Observability:</strong> Logs open/close/create/remove at DEBUG with object id and descriptor.</p>
 *
 * @since PGLO 0.1-doc
 */
public final class LargeObject implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(LargeObject.class);

  private final LargeObjectBackend backend;
  private final long objectId;
  private final int descriptor;
  private final OpenMode mode;
  private final int bufferSize;
  private boolean closed;

  private LargeObject(
      LargeObjectBackend backend, long objectId, int descriptor, OpenMode mode, int bufferSize) {
    this.backend = backend;
    this.objectId = objectId;
    this.descriptor = descriptor;
    this.mode = mode;
    this.bufferSize = bufferSize;
  }

  /**
   * Creates a new object and opens it read/write with a 1 MiB buffer.
   *
   * @param backend scope-bound backend
   * @return handle on the new object
   * @throws LargeObjectException if creation or opening fails
   */
  public static LargeObject create(LargeObjectBackend backend) throws LargeObjectException {
    return create(backend, OpenOptions.forCreate());
  }

  /**
   * Creates a new object with a backend-chosen id and opens it.
   *
   * @param backend scope-bound backend
   * @param options open mode and chunk size
   * @return handle on the new object
   * @throws LargeObjectException {@code ALREADY_EXISTS} on id collision, or any open failure
   */
  public static LargeObject create(LargeObjectBackend backend, OpenOptions options)
      throws LargeObjectException {
    Objects.requireNonNull(backend, "backend");
    Objects.requireNonNull(options, "options");
    long objectId = backend.create(0L);
    log.debug("Created large object {}", objectId);
    return open(backend, objectId, options);
  }

  /**
   * Opens an existing object read-only with a 1 MiB buffer.
   *
   * @param backend scope-bound backend
   * @param objectId positive object id
   * @return handle
   * @throws LargeObjectException {@code NOT_FOUND} when the object does not exist
   */
  public static LargeObject open(LargeObjectBackend backend, long objectId)
      throws LargeObjectException {
    return open(backend, objectId, OpenOptions.forOpen());
  }

  /**
   * Opens an existing object.
   *
   * @param backend scope-bound backend
   * @param objectId positive object id
   * @param options open mode and chunk size
   * @return handle, positioned at end-of-object for {@link OpenMode#APPEND} and at 0 otherwise
   * @throws LargeObjectException {@code NOT_FOUND} when the object does not exist
   * @throws IllegalArgumentException if {@code objectId} is not positive
   */
  public static LargeObject open(LargeObjectBackend backend, long objectId, OpenOptions options)
      throws LargeObjectException {
    Objects.requireNonNull(backend, "backend");
    Objects.requireNonNull(options, "options");
    ChunkMath.requireObjectId(objectId);
    int descriptor = backend.open(objectId, options.mode().flags());
    LargeObject lob = new LargeObject(backend, objectId, descriptor, options.mode(), options.bufferSize());
    log.debug("Opened large object {} as descriptor {} (mode={})", objectId, descriptor, options.mode());
    if (options.mode().seekToEnd()) {
      try {
        backend.seek(descriptor, 0L, SeekAnchor.END);
      } catch (LargeObjectException ex) {
        lob.closeAfterFailure(ex);
        throw ex;
      }
    }
    return lob;
  }

  /**
   * Deletes an object and all its data, regardless of open handles.
   *
   * @param backend scope-bound backend
   * @param objectId positive object id
   * @throws LargeObjectException {@code NOT_FOUND} when the object does not exist (including a second removal)
   */
  public static void remove(LargeObjectBackend backend, long objectId) throws LargeObjectException {
    Objects.requireNonNull(backend, "backend");
    ChunkMath.requireObjectId(objectId);
    backend.unlink(objectId);
    log.debug("Removed large object {}", objectId);
  }

  /**
   * Opens an object, runs {@code callback} and closes the handle on every exit path.
   *
   * @param backend scope-bound backend
   * @param objectId positive object id
   * @param options open mode and chunk size
   * @param callback work to run against the open handle
   * @param <T> result type
   * @return callback result
   * @throws IOException failure from opening, the callback or closing; a close failure after a callback failure is
   *     attached as suppressed
   */
  public static <T> T withOpen(
      LargeObjectBackend backend, long objectId, OpenOptions options, LargeObjectCallback<T> callback)
      throws IOException {
    Objects.requireNonNull(callback, "callback");
    LargeObject lob = open(backend, objectId, options);
    T result;
    try {
      result = callback.apply(lob);
    } catch (IOException | RuntimeException ex) {
      lob.closeAfterFailure(ex);
      throw ex;
    }
    if (!lob.isClosed()) {
      lob.close();
    }
    return result;
  }

  /**
   * Releases the backend descriptor.
   *
   * @throws LargeObjectException {@code NOT_FOUND} when the descriptor is already invalid, including a second
   *     close of this handle
   */
  @Override
  public void close() throws LargeObjectException {
    if (closed) {
      throw new ObjectNotFoundException(
          "descriptor " + descriptor + " already closed", objectId, descriptor);
    }
    closed = true;
    backend.close(descriptor);
    log.debug("Closed descriptor {} of large object {}", descriptor, objectId);
  }

  /**
   * Indicates whether {@link #close()} was already called on this handle.
   *
   * @return {@code true} once close was requested, even if the backend rejected it
   */
  public boolean isClosed() {
    return closed;
  }

  /**
   * Reads up to {@link #bufferSize()} bytes from the cursor.
   *
   * @return bytes read; empty at end-of-object
   * @throws LargeObjectException {@code NOT_FOUND} when the descriptor is invalid
   */
  public byte[] read() throws LargeObjectException {
    return read(bufferSize);
  }

  /**
   * Reads up to {@code length} bytes from the cursor and advances it by the number of bytes returned.
   *
   * @param length maximum bytes; zero returns an empty array
   * @return bytes read; fewer than {@code length} (possibly none) at end-of-object
   * @throws LargeObjectException {@code NOT_FOUND} when the descriptor is invalid
   */
  public byte[] read(int length) throws LargeObjectException {
    ChunkMath.requireNonNegative("length", length);
    return backend.read(descriptor, length);
  }

  /**
   * Writes {@code data} at the cursor, overwriting in place and extending the object as needed; advances the cursor
   * by {@code data.length}.
   *
   * @param data bytes to write
   * @throws LargeObjectException {@code READ_ONLY} or {@code NOT_FOUND}
   */
  public void write(byte[] data) throws LargeObjectException {
    Objects.requireNonNull(data, "data");
    backend.write(descriptor, data);
  }

  /**
   * Writes a slice of {@code data} at the cursor.
   *
   * @param data source array
   * @param offset start of the slice
   * @param length slice length
   * @throws LargeObjectException {@code READ_ONLY} or {@code NOT_FOUND}
   */
  public void write(byte[] data, int offset, int length) throws LargeObjectException {
    Objects.checkFromIndexSize(offset, length, Objects.requireNonNull(data, "data").length);
    if (offset == 0 && length == data.length) {
      write(data);
    } else {
      write(Arrays.copyOfRange(data, offset, offset + length));
    }
  }

  /**
   * Moves the cursor to an absolute position.
   *
   * @param position non-negative byte offset; may lie past end-of-object
   * @return new position
   * @throws LargeObjectException {@code INVALID_OFFSET} for negative positions, or {@code NOT_FOUND}
   */
  public long seek(long position) throws LargeObjectException {
    return seek(position, SeekAnchor.START);
  }

  /**
   * Moves the cursor relative to {@code anchor}.
   *
   * @param offset {@code >= 0} for {@link SeekAnchor#START}, {@code <= 0} for {@link SeekAnchor#END}, any value for
   *     {@link SeekAnchor#CURRENT}
   * @param anchor reference point
   * @return new absolute position
   * @throws LargeObjectException {@code INVALID_OFFSET} when the target lies before byte 0, or {@code NOT_FOUND}
   * @throws IllegalArgumentException if a positive offset is given with {@link SeekAnchor#END}
   */
  public long seek(long offset, SeekAnchor anchor) throws LargeObjectException {
    Objects.requireNonNull(anchor, "anchor");
    if (anchor == SeekAnchor.START && offset < 0) {
      throw new InvalidOffsetException(
          "cannot seek to negative position " + offset, objectId, descriptor);
    }
    if (anchor == SeekAnchor.END && offset > 0) {
      throw new IllegalArgumentException("offset relative to END must not be positive (was " + offset + ")");
    }
    return backend.seek(descriptor, offset, anchor);
  }

  /**
   * Reports the cursor position.
   *
   * @return absolute position
   * @throws LargeObjectException {@code NOT_FOUND} when the descriptor is invalid
   */
  public long tell() throws LargeObjectException {
    return backend.tell(descriptor);
  }

  /**
   * Reports the object size by seeking to the end and back.
   *
   * @return size in bytes; the cursor is left where it was
   * @throws LargeObjectException if any of the three round-trips fails, including the seek that restores the cursor
   */
  public long size() throws LargeObjectException {
    long position = backend.tell(descriptor);
    long size = backend.seek(descriptor, 0L, SeekAnchor.END);
    long restored = backend.seek(descriptor, position, SeekAnchor.START);
    if (restored != position) {
      throw new BackendFailureException(
          "cursor restored to " + restored + " instead of " + position, objectId, descriptor);
    }
    return size;
  }

  /**
   * Truncates or zero-extends the object to exactly {@code newSize} bytes. The cursor does not move.
   *
   * @param newSize target size in bytes
   * @throws LargeObjectException {@code READ_ONLY} or {@code NOT_FOUND}
   */
  public void resize(long newSize) throws LargeObjectException {
    ChunkMath.requireNonNegative("newSize", newSize);
    backend.resize(descriptor, newSize);
  }

  /**
   * Returns a lazy, single-pass producer reading {@link #bufferSize()} bytes per pull and closing this handle when
   * exhausted or closed early.
   *
   * @return producer adapter
   */
  public LargeObjectReader reader() {
    return new LargeObjectReader(this);
  }

  /**
   * Returns a consumer writing each pushed chunk at the cursor and closing this handle on completion.
   *
   * @return consumer adapter
   */
  public LargeObjectWriter writer() {
    return new LargeObjectWriter(this);
  }

  /**
   * Returns an indexed view over {@link #bufferSize()}-sized chunks.
   *
   * @return chunk view
   */
  public LargeObjectChunks chunks() {
    return new LargeObjectChunks(this);
  }

  /**
   * Returns an {@link java.io.InputStream} reading from the cursor; closing the stream closes this handle.
   *
   * @return input stream view
   */
  public LargeObjectInputStream inputStream() {
    return new LargeObjectInputStream(this);
  }

  /**
   * Returns an {@link java.io.OutputStream} writing at the cursor; closing the stream closes this handle.
   *
   * @return output stream view
   */
  public LargeObjectOutputStream outputStream() {
    return new LargeObjectOutputStream(this);
  }

  /**
   * Returns the object id.
   *
   * @return positive id, stable for the object's lifetime
   */
  public long objectId() {
    return objectId;
  }

  /**
   * Returns the backend descriptor.
   *
   * @return descriptor valid within the opening scope
   */
  public int descriptor() {
    return descriptor;
  }

  /**
   * Returns the mode the handle was opened with.
   *
   * @return open mode
   */
  public OpenMode mode() {
    return mode;
  }

  /**
   * Returns the chunk size used by streaming operations.
   *
   * @return positive chunk size in bytes
   */
  public int bufferSize() {
    return bufferSize;
  }

  void closeAfterFailure(Throwable failure) {
    if (closed) {
      return;
    }
    try {
      close();
    } catch (LargeObjectException ex) {
      failure.addSuppressed(ex);
      log.warn("Failed to close descriptor {} of large object {} after failure", descriptor, objectId, ex);
    }
  }

  @Override
  public String toString() {
    return "LargeObject[objectId=" + objectId + ", descriptor=" + descriptor + ", mode=" + mode
        + ", bufferSize=" + bufferSize + "]";
  }
}
