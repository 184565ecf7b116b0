package ca.gc.cra.pglo.application.stream;

import ca.gc.cra.pglo.application.port.ChunkSource;
import ca.gc.cra.pglo.domain.lob.ChunkMath;
import java.util.Arrays;
import java.util.Objects;

/**
 * Re-chunks a single in-memory buffer into pieces of at most {@code chunkSize} bytes, bounding the payload of each
 * backend call. An empty buffer yields no chunks.
 *
 * @since PGLO 0.1-doc
 */
public final class ByteArrayChunkSource implements ChunkSource {
  private final byte[] data;
  private final int chunkSize;
  private int position;

  /**
   * Creates a source over {@code data}. The array is not copied and must not be mutated while the source is read.
   *
   * @param data buffer to split
   * @param chunkSize maximum chunk size; must be positive
   */
  public ByteArrayChunkSource(byte[] data, int chunkSize) {
    this.data = Objects.requireNonNull(data, "data");
    this.chunkSize = ChunkMath.requireBufferSize(chunkSize);
  }

  @Override
  public byte[] next() {
    if (position >= data.length) {
      return null;
    }
    int end = (int) Math.min((long) position + chunkSize, data.length);
    byte[] chunk = Arrays.copyOfRange(data, position, end);
    position = end;
    return chunk;
  }

  @Override
  public void close() {
    position = data.length;
  }
}
