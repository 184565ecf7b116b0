package ca.gc.cra.pglo.application.port;

import java.io.IOException;

/**
 * <strong>What:</strong> Pull-based, forward-only producer of byte chunks.
 * <p><strong>Why:</strong> Lets generic stream-processing code consume a large object (or feed one) without knowing
 * where the bytes come from.</p>
 * <p><strong>Role:</strong> Producer side of the chunked stream adapters.</p>
 * <p><strong>Thread-safety:</strong> Single consumer; not thread-safe.</p>
 *
 * @since PGLO 0.1-doc
 * @see ChunkSink
 */
public interface ChunkSource extends AutoCloseable {
  /**
   * Returns the next chunk.
   *
   * @return next non-empty chunk, or {@code null} once the source is exhausted
   * @throws IOException if producing the chunk fails
   */
  byte[] next() throws IOException;

  /**
   * Releases resources held by the source. Safe to call more than once; calling it before exhaustion cancels the
   * remaining iteration.
   *
   * @throws IOException if releasing fails
   */
  @Override
  void close() throws IOException;
}
