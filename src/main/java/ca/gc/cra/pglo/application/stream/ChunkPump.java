package ca.gc.cra.pglo.application.stream;

import ca.gc.cra.pglo.application.port.ChunkSink;
import ca.gc.cra.pglo.application.port.ChunkSource;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains a {@link ChunkSource} into a {@link ChunkSink}, moving one chunk at a time so memory stays bounded by the
 * largest chunk.
 *
 * <p>On normal end the sink is completed and the source closed. On failure the sink is aborted, the source closed,
 * and the first failure rethrown with any cleanup failure attached as suppressed.</p>
 *
 * @since PGLO 0.1-doc
 */
public final class ChunkPump {
  private static final Logger log = LoggerFactory.getLogger(ChunkPump.class);

  private ChunkPump() {
    // Utility
  }

  /**
   * Moves every chunk from {@code source} to {@code sink}.
   *
   * @param source producer; closed before this method returns
   * @param sink consumer; completed on success, aborted on failure
   * @return number of bytes moved
   * @throws IOException failure of the source or the sink
   */
  public static long drain(ChunkSource source, ChunkSink sink) throws IOException {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(sink, "sink");
    long total = 0L;
    long chunks = 0L;
    try {
      byte[] chunk;
      while ((chunk = source.next()) != null) {
        sink.accept(chunk);
        total += chunk.length;
        chunks++;
      }
      sink.complete();
    } catch (IOException | RuntimeException ex) {
      sink.abort(ex);
      closeAfterFailure(source, ex);
      throw ex;
    }
    source.close();
    log.debug("Pumped {} bytes in {} chunks", total, chunks);
    return total;
  }

  private static void closeAfterFailure(ChunkSource source, Throwable failure) {
    try {
      source.close();
    } catch (IOException | RuntimeException ex) {
      failure.addSuppressed(ex);
      log.warn("Failed to close chunk source after failure", ex);
    }
  }
}
