package ca.gc.cra.pglo.application.stream;

import ca.gc.cra.pglo.application.port.ChunkSource;
import ca.gc.cra.pglo.domain.lob.ChunkMath;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Reads an {@link InputStream} in chunks of at most {@code chunkSize} bytes. Closing the source closes the stream.
 *
 * @since PGLO 0.1-doc
 */
public final class InputStreamChunkSource implements ChunkSource {
  private final InputStream in;
  private final int chunkSize;
  private boolean exhausted;

  /**
   * Creates a source over {@code in}.
   *
   * @param in stream to drain; owned by the source from now on
   * @param chunkSize maximum chunk size; must be positive
   */
  public InputStreamChunkSource(InputStream in, int chunkSize) {
    this.in = Objects.requireNonNull(in, "in");
    this.chunkSize = ChunkMath.requireBufferSize(chunkSize);
  }

  @Override
  public byte[] next() throws IOException {
    if (exhausted) {
      return null;
    }
    byte[] chunk = in.readNBytes(chunkSize);
    if (chunk.length == 0) {
      exhausted = true;
      return null;
    }
    return chunk;
  }

  @Override
  public void close() throws IOException {
    exhausted = true;
    in.close();
  }
}
