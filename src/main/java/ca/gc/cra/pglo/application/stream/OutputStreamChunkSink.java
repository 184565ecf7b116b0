package ca.gc.cra.pglo.application.stream;

import ca.gc.cra.pglo.application.port.ChunkSink;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * Writes chunks to an {@link OutputStream}. The stream is flushed on completion and left open; its owner closes it.
 *
 * @since PGLO 0.1-doc
 */
public final class OutputStreamChunkSink implements ChunkSink {
  private final OutputStream out;

  /**
   * Creates a sink over {@code out}.
   *
   * @param out destination stream; not closed by the sink
   */
  public OutputStreamChunkSink(OutputStream out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  @Override
  public void accept(byte[] chunk) throws IOException {
    out.write(chunk);
  }

  @Override
  public void complete() throws IOException {
    out.flush();
  }

  @Override
  public void abort(Throwable cause) {
    // Nothing to release; the owner decides what to do with a partially written stream.
  }
}
