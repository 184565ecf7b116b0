package ca.gc.cra.pglo.application.pipeline;

import ca.gc.cra.pglo.application.lob.LargeObject;
import ca.gc.cra.pglo.application.lob.OpenOptions;
import ca.gc.cra.pglo.application.port.MetricsPort;
import ca.gc.cra.pglo.application.port.TransactionPort;
import ca.gc.cra.pglo.application.port.UploadWriterPort;
import ca.gc.cra.pglo.domain.lob.OpenMode;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Upload writer that stores an incoming multipart body as a large object.
 * <p><strong>Why:</strong> Upload handlers receive chunks over many requests; each chunk is committed on its own so
 * an interrupted upload keeps what already arrived.</p>
 * <p><strong>Lifecycle:</strong> {@link #init()} creates an empty object, {@link #writeChunk(byte[], UploadState)}
 * appends in a fresh scope per chunk, {@link #meta(UploadState)} exposes the object id and
 * {@link #close(UploadState, CloseReason)} hands the state back unchanged.</p>
 * <p><strong>Thread-safety:</strong> Stateless; the per-upload state travels in {@link UploadState}.</p>
 *
 * @since PGLO 0.1-doc
 */
public final class LargeObjectUploadWriter implements UploadWriterPort<LargeObjectUploadWriter.UploadState> {
  private static final Logger log = LoggerFactory.getLogger(LargeObjectUploadWriter.class);

  /**
   * Per-upload progress.
   *
   * @param objectId id of the object receiving the upload
   * @param bytesWritten bytes appended so far
   * @param chunks chunks appended so far
   */
  public record UploadState(long objectId, long bytesWritten, int chunks) {
    UploadState append(int length) {
      return new UploadState(objectId, bytesWritten + length, chunks + 1);
    }
  }

  private final TransactionPort transactions;
  private final MetricsPort metrics;
  private final TransferOptions options;

  /**
   * Creates a writer.
   *
   * @param transactions scope provider; every call opens its own scope
   * @param metrics metrics sink for {@code lob.upload.*}
   * @param options timeout applied to each scope
   */
  public LargeObjectUploadWriter(TransactionPort transactions, MetricsPort metrics, TransferOptions options) {
    this.transactions = Objects.requireNonNull(transactions, "transactions");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.options = Objects.requireNonNull(options, "options");
  }

  @Override
  public UploadState init() throws IOException {
    long objectId = transactions.inTransaction(options.timeout(), backend -> {
      LargeObject lob = LargeObject.create(backend);
      lob.close();
      return lob.objectId();
    });
    log.debug("Upload started into large object {}", objectId);
    return new UploadState(objectId, 0L, 0);
  }

  @Override
  public Map<String, Object> meta(UploadState state) {
    return Map.of("objectId", state.objectId());
  }

  @Override
  public UploadState writeChunk(byte[] data, UploadState state) throws IOException {
    Objects.requireNonNull(data, "data");
    Objects.requireNonNull(state, "state");
    OpenOptions append = new OpenOptions(OpenMode.APPEND, options.bufferSize());
    transactions.inTransaction(options.timeout(), backend ->
        LargeObject.withOpen(backend, state.objectId(), append, lob -> {
          lob.write(data);
          return null;
        }));
    metrics.increment("lob.upload.chunks");
    metrics.observe("lob.upload.bytes", data.length);
    return state.append(data.length);
  }

  @Override
  public UploadState close(UploadState state, CloseReason reason) {
    log.debug("Upload into large object {} closed ({}) after {} chunks, {} bytes",
        state.objectId(), reason, state.chunks(), state.bytesWritten());
    return state;
  }
}
