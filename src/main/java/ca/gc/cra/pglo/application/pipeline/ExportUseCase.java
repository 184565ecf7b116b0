package ca.gc.cra.pglo.application.pipeline;

import ca.gc.cra.pglo.application.lob.LargeObject;
import ca.gc.cra.pglo.application.lob.OpenOptions;
import ca.gc.cra.pglo.application.port.ChunkSink;
import ca.gc.cra.pglo.application.port.ClockPort;
import ca.gc.cra.pglo.application.port.MetricsPort;
import ca.gc.cra.pglo.application.port.TransactionPort;
import ca.gc.cra.pglo.application.stream.ByteArrayChunkSink;
import ca.gc.cra.pglo.application.stream.ChunkPump;
import ca.gc.cra.pglo.application.stream.OutputStreamChunkSink;
import ca.gc.cra.pglo.domain.error.LargeObjectException;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Streams an existing large object into memory or into a caller-supplied sink.
 * <p><strong>Role:</strong> Application use case on the read side.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open the object read-only with the requested chunk size.</li>
 *   <li>Drain it through the producer adapter, one {@code bufferSize} read per chunk.</li>
 *   <li>Raise {@code NOT_FOUND} for a missing object; an empty object exports as zero bytes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from injected collaborators.</p>
 * <p><strong>Observability:</strong> Emits {@code lob.export.success|failure}, {@code lob.export.bytes} and
 * {@code lob.export.latencyMillis}.</p>
 *
 * @since PGLO 0.1-doc
 */
public final class ExportUseCase {
  private static final Logger log = LoggerFactory.getLogger(ExportUseCase.class);

  private final TransactionPort transactions;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates the use case.
   *
   * @param transactions scope provider
   * @param metrics metrics sink
   * @param clock time source for latency metrics
   */
  public ExportUseCase(TransactionPort transactions, MetricsPort metrics, ClockPort clock) {
    this.transactions = Objects.requireNonNull(transactions, "transactions");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Exports the whole object into memory.
   *
   * @param objectId object to export
   * @param options chunk size and timeout
   * @return object contents; empty for an empty object
   * @throws IOException {@code NOT_FOUND} when the object does not exist, or any transfer failure
   */
  public byte[] exportBytes(long objectId, TransferOptions options) throws IOException {
    ByteArrayChunkSink sink = new ByteArrayChunkSink();
    exportTo(objectId, sink, options);
    return sink.toByteArray();
  }

  /**
   * Exports the object into {@code out}; the stream is flushed but not closed.
   *
   * @param objectId object to export
   * @param out destination
   * @param options chunk size and timeout
   * @return number of bytes written
   * @throws IOException {@code NOT_FOUND} when the object does not exist, or any transfer failure
   */
  public long exportTo(long objectId, OutputStream out, TransferOptions options) throws IOException {
    return exportTo(objectId, new OutputStreamChunkSink(out), options);
  }

  /**
   * Exports the object into {@code sink}.
   *
   * @param objectId object to export
   * @param sink consumer; completed on success, aborted on failure
   * @param options chunk size and timeout
   * @return number of bytes delivered
   * @throws IOException {@code NOT_FOUND} when the object does not exist, or any transfer failure
   */
  public long exportTo(long objectId, ChunkSink sink, TransferOptions options) throws IOException {
    Objects.requireNonNull(sink, "sink");
    Objects.requireNonNull(options, "options");
    long startedAt = clock.nowMillis();
    try {
      long bytes = transactions.inTransaction(options.timeout(), backend -> {
        LargeObject lob;
        try {
          lob = LargeObject.open(backend, objectId, OpenOptions.forOpen().withBufferSize(options.bufferSize()));
        } catch (LargeObjectException ex) {
          sink.abort(ex);
          throw ex;
        }
        return ChunkPump.drain(lob.reader(), sink);
      });
      long elapsed = clock.nowMillis() - startedAt;
      metrics.increment("lob.export.success");
      metrics.observe("lob.export.bytes", bytes);
      metrics.observe("lob.export.latencyMillis", elapsed);
      log.info("Exported {} bytes from large object {} in {} ms", bytes, objectId, elapsed);
      return bytes;
    } catch (IOException | RuntimeException ex) {
      metrics.increment("lob.export.failure");
      log.debug("Export of large object {} failed", objectId, ex);
      throw ex;
    }
  }
}
