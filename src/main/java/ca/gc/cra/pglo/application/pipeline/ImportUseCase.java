package ca.gc.cra.pglo.application.pipeline;

import ca.gc.cra.pglo.application.lob.LargeObject;
import ca.gc.cra.pglo.application.lob.OpenOptions;
import ca.gc.cra.pglo.application.port.ChunkSource;
import ca.gc.cra.pglo.application.port.ClockPort;
import ca.gc.cra.pglo.application.port.MetricsPort;
import ca.gc.cra.pglo.application.port.TransactionPort;
import ca.gc.cra.pglo.application.stream.ByteArrayChunkSource;
import ca.gc.cra.pglo.application.stream.ChunkPump;
import ca.gc.cra.pglo.application.stream.InputStreamChunkSource;
import ca.gc.cra.pglo.application.stream.IterableChunkSource;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Streams an arbitrary byte source into a newly created large object.
 * <p><strong>Why:</strong> Callers hand over a buffer, an {@link InputStream} or a lazy chunk sequence and get back
 * an object id, with memory bounded by one chunk.</p>
 * <p><strong>Role:</strong> Application use case on the write side.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Re-chunk single buffers into {@code bufferSize} pieces.</li>
 *   <li>Create the object and drain the source into it through the consumer adapter.</li>
 *   <li>Run everything in one scope with the configured timeout; any failure rolls the scope back so no partial
 *   object survives.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from injected collaborators; concurrent imports run in separate
 * scopes.</p>
 * <p><strong>Observability:</strong> Emits {@code lob.import.success|failure}, {@code lob.import.bytes} and
 * {@code lob.import.latencyMillis}; logs completed imports at INFO.</p>
 *
 * @since PGLO 0.1-doc
 */
public final class ImportUseCase {
  private static final Logger log = LoggerFactory.getLogger(ImportUseCase.class);

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
  public ImportUseCase(TransactionPort transactions, MetricsPort metrics, ClockPort clock) {
    this.transactions = Objects.requireNonNull(transactions, "transactions");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Imports a single buffer, split into {@code options.bufferSize()} chunks.
   *
   * @param data payload; may be empty
   * @param options chunk size and timeout
   * @return id of the new object
   * @throws IOException if the import fails; the scope is rolled back
   */
  public long importBytes(byte[] data, TransferOptions options) throws IOException {
    Objects.requireNonNull(options, "options");
    return importFrom(new ByteArrayChunkSource(data, options.bufferSize()), options);
  }

  /**
   * Imports everything readable from {@code in}; the stream is closed afterwards.
   *
   * @param in payload stream
   * @param options chunk size and timeout
   * @return id of the new object
   * @throws IOException if reading or importing fails; the scope is rolled back
   */
  public long importFrom(InputStream in, TransferOptions options) throws IOException {
    Objects.requireNonNull(options, "options");
    return importFrom(new InputStreamChunkSource(in, options.bufferSize()), options);
  }

  /**
   * Imports a chunk sequence, preserving its chunk boundaries.
   *
   * @param chunks payload chunks
   * @param options timeout; the chunk size is not applied to pre-chunked input
   * @return id of the new object
   * @throws IOException if the import fails; the scope is rolled back
   */
  public long importFrom(Iterable<byte[]> chunks, TransferOptions options) throws IOException {
    return importFrom(new IterableChunkSource(chunks), options);
  }

  /**
   * Imports a chunk source; the source is closed afterwards.
   *
   * @param source payload producer
   * @param options chunk size and timeout
   * @return id of the new object
   * @throws IOException if the import fails; the scope is rolled back
   */
  public long importFrom(ChunkSource source, TransferOptions options) throws IOException {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(options, "options");
    long startedAt = clock.nowMillis();
    try (source) {
      Transfer transfer = transactions.inTransaction(options.timeout(), backend -> {
        LargeObject lob = LargeObject.create(backend, OpenOptions.forCreate().withBufferSize(options.bufferSize()));
        long bytes = ChunkPump.drain(source, lob.writer());
        return new Transfer(lob.objectId(), bytes);
      });
      long elapsed = clock.nowMillis() - startedAt;
      metrics.increment("lob.import.success");
      metrics.observe("lob.import.bytes", transfer.bytes());
      metrics.observe("lob.import.latencyMillis", elapsed);
      log.info("Imported {} bytes into large object {} in {} ms", transfer.bytes(), transfer.objectId(), elapsed);
      return transfer.objectId();
    } catch (IOException | RuntimeException ex) {
      metrics.increment("lob.import.failure");
      log.debug("Import failed after {} ms; scope rolled back", clock.nowMillis() - startedAt, ex);
      throw ex;
    }
  }

  private record Transfer(long objectId, long bytes) {}
}
