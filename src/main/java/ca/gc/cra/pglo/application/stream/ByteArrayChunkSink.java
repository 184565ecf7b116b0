package ca.gc.cra.pglo.application.stream;

import ca.gc.cra.pglo.application.port.ChunkSink;
import java.io.ByteArrayOutputStream;
import java.util.Objects;

/**
 * Accumulates chunks into one in-memory buffer.
 *
 * @since PGLO 0.1-doc
 */
public final class ByteArrayChunkSink implements ChunkSink {
  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
  private boolean completed;

  @Override
  public void accept(byte[] chunk) {
    buffer.writeBytes(Objects.requireNonNull(chunk, "chunk"));
  }

  @Override
  public void complete() {
    completed = true;
  }

  @Override
  public void abort(Throwable cause) {
    buffer.reset();
  }

  /**
   * Returns everything accepted so far.
   *
   * @return copy of the accumulated bytes
   * @throws IllegalStateException if the stream has not completed
   */
  public byte[] toByteArray() {
    if (!completed) {
      throw new IllegalStateException("sink has not completed");
    }
    return buffer.toByteArray();
  }
}
