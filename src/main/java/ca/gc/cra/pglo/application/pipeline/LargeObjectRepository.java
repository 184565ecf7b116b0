package ca.gc.cra.pglo.application.pipeline;

import ca.gc.cra.pglo.application.lob.LargeObject;
import ca.gc.cra.pglo.application.lob.LargeObjectCallback;
import ca.gc.cra.pglo.application.lob.OpenOptions;
import ca.gc.cra.pglo.application.port.ChunkSink;
import ca.gc.cra.pglo.application.port.ChunkSource;
import ca.gc.cra.pglo.application.port.ClockPort;
import ca.gc.cra.pglo.application.port.LargeObjectBackend;
import ca.gc.cra.pglo.application.port.MetricsPort;
import ca.gc.cra.pglo.application.port.TransactionPort;
import ca.gc.cra.pglo.application.port.TransactionalWork;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.Objects;

/**
 * Convenience facade bound to one {@link TransactionPort}.
 *
 * <p>Every method runs in its own scope, so callers never see a raw backend unless they ask for one through
 * {@link #transaction(TransactionalWork)}. Handles passed to callbacks are only valid inside the callback.</p>
 *
 * @since PGLO 0.1-doc
 */
public final class LargeObjectRepository {
  private final TransactionPort transactions;
  private final TransferOptions defaults;
  private final ImportUseCase importer;
  private final ExportUseCase exporter;

  /**
   * Creates a repository using {@link TransferOptions#defaults()}.
   *
   * @param transactions scope provider
   * @param metrics metrics sink
   * @param clock time source
   */
  public LargeObjectRepository(TransactionPort transactions, MetricsPort metrics, ClockPort clock) {
    this(transactions, metrics, clock, TransferOptions.defaults());
  }

  /**
   * Creates a repository with explicit transfer defaults.
   *
   * @param transactions scope provider
   * @param metrics metrics sink
   * @param clock time source
   * @param defaults options used by the overloads that take none
   */
  public LargeObjectRepository(
      TransactionPort transactions, MetricsPort metrics, ClockPort clock, TransferOptions defaults) {
    this.transactions = Objects.requireNonNull(transactions, "transactions");
    this.defaults = Objects.requireNonNull(defaults, "defaults");
    this.importer = new ImportUseCase(transactions, metrics, clock);
    this.exporter = new ExportUseCase(transactions, metrics, clock);
  }

  public TransferOptions defaults() {
    return defaults;
  }

  public long importLargeObject(byte[] data) throws IOException {
    return importer.importBytes(data, defaults);
  }

  public long importLargeObject(byte[] data, TransferOptions options) throws IOException {
    return importer.importBytes(data, options);
  }

  public long importLargeObject(InputStream in, TransferOptions options) throws IOException {
    return importer.importFrom(in, options);
  }

  public long importLargeObject(ChunkSource source, TransferOptions options) throws IOException {
    return importer.importFrom(source, options);
  }

  public long importLargeObject(Iterable<byte[]> chunks, TransferOptions options) throws IOException {
    return importer.importFrom(chunks, options);
  }

  public byte[] exportLargeObject(long objectId) throws IOException {
    return exporter.exportBytes(objectId, defaults);
  }

  public byte[] exportLargeObject(long objectId, TransferOptions options) throws IOException {
    return exporter.exportBytes(objectId, options);
  }

  public long exportLargeObject(long objectId, OutputStream out, TransferOptions options) throws IOException {
    return exporter.exportTo(objectId, out, options);
  }

  public long exportLargeObject(long objectId, ChunkSink sink, TransferOptions options) throws IOException {
    return exporter.exportTo(objectId, sink, options);
  }

  /**
   * Creates an empty object in its own scope.
   *
   * @return id of the new object
   * @throws IOException if creation fails
   */
  public long createLargeObject() throws IOException {
    return transactions.inTransaction(defaults.timeout(), backend -> {
      LargeObject lob = LargeObject.create(backend);
      lob.close();
      return lob.objectId();
    });
  }

  /**
   * Creates an object inside a scope the caller already holds, e.g. from {@link #transaction(TransactionalWork)}.
   *
   * @param backend scope-bound backend
   * @param options mode and chunk size for the returned handle
   * @return open handle; valid until the scope ends
   * @throws IOException if creation fails
   */
  public LargeObject createLargeObject(LargeObjectBackend backend, OpenOptions options) throws IOException {
    return LargeObject.create(backend, options);
  }

  /**
   * Opens an object inside a scope the caller already holds.
   *
   * @param backend scope-bound backend
   * @param objectId object to open
   * @param options mode and chunk size
   * @return open handle; valid until the scope ends
   * @throws IOException {@code NOT_FOUND} for a missing object
   */
  public LargeObject openLargeObject(LargeObjectBackend backend, long objectId, OpenOptions options)
      throws IOException {
    return LargeObject.open(backend, objectId, options);
  }

  /**
   * Creates an object and hands the open read/write handle to {@code callback}.
   *
   * @param options mode and chunk size for the handle
   * @param callback work against the new object
   * @param <T> result type
   * @return callback result
   * @throws IOException if creation or the callback fails; the scope is rolled back
   */
  public <T> T withNewLargeObject(OpenOptions options, LargeObjectCallback<T> callback) throws IOException {
    Objects.requireNonNull(callback, "callback");
    return transactions.inTransaction(defaults.timeout(), backend -> {
      LargeObject created = LargeObject.create(backend);
      created.close();
      return LargeObject.withOpen(backend, created.objectId(), options, callback);
    });
  }

  /**
   * Opens {@code objectId} and hands the handle to {@code callback}; the handle is closed afterwards.
   *
   * @param objectId object to open
   * @param options mode and chunk size
   * @param callback work against the object
   * @param <T> result type
   * @return callback result
   * @throws IOException {@code NOT_FOUND} for a missing object, or any callback failure
   */
  public <T> T withLargeObject(long objectId, OpenOptions options, LargeObjectCallback<T> callback)
      throws IOException {
    return transactions.inTransaction(
        defaults.timeout(), backend -> LargeObject.withOpen(backend, objectId, options, callback));
  }

  /**
   * Deletes {@code objectId} in its own scope.
   *
   * @param objectId object to delete
   * @throws IOException {@code NOT_FOUND} when the object does not exist
   */
  public void removeLargeObject(long objectId) throws IOException {
    transactions.inTransaction(defaults.timeout(), backend -> {
      LargeObject.remove(backend, objectId);
      return null;
    });
  }

  public <T> T transaction(TransactionalWork<T> work) throws IOException {
    return transactions.inTransaction(defaults.timeout(), work);
  }

  public <T> T transaction(Duration timeout, TransactionalWork<T> work) throws IOException {
    return transactions.inTransaction(timeout, work);
  }
}
