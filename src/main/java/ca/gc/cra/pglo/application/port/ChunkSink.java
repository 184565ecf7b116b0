package ca.gc.cra.pglo.application.port;

import java.io.IOException;

/**
 * <strong>What:</strong> Push-based consumer of byte chunks.
 * <p><strong>Why:</strong> Lets any producer stream into a large object, a file or memory through one contract.</p>
 * <p><strong>Role:</strong> Consumer side of the chunked stream adapters.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>{@link #accept(byte[])} once per chunk, chunk sizes as produced upstream.</li>
 *   <li>{@link #complete()} exactly once on normal end of stream.</li>
 *   <li>{@link #abort(Throwable)} on abrupt termination; must attempt to release resources.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Single producer; not thread-safe.</p>
 *
 * @since PGLO 0.1-doc
 * @see ChunkSource
 */
public interface ChunkSink {
  /**
   * Consumes one chunk.
   *
   * @param chunk bytes to consume; must not be {@code null}
   * @throws IOException if the chunk cannot be consumed
   */
  void accept(byte[] chunk) throws IOException;

  /**
   * Signals normal end of stream.
   *
   * @throws IOException if finishing fails
   */
  void complete() throws IOException;

  /**
   * Signals abrupt termination. Cleanup failures are attached to {@code cause} as suppressed exceptions rather than
   * thrown.
   *
   * @param cause failure or cancellation that ended the stream
   */
  void abort(Throwable cause);
}
