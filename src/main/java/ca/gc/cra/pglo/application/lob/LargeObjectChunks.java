package ca.gc.cra.pglo.application.lob;

import ca.gc.cra.pglo.domain.error.LargeObjectException;
import ca.gc.cra.pglo.domain.lob.ChunkMath;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Indexed view over a {@link LargeObject} split into {@code bufferSize} chunks.
 *
 * <p>Chunk {@code i} covers bytes {@code [i * bufferSize, (i + 1) * bufferSize)}. Every indexed read seeks explicitly
 * first, so results do not depend on where the cursor was left. The view moves the handle's cursor.</p>
 *
 * @since PGLO 0.1-doc
 */
public final class LargeObjectChunks {
  private final LargeObject lob;

  LargeObjectChunks(LargeObject lob) {
    this.lob = Objects.requireNonNull(lob, "lob");
  }

  /**
   * Number of chunks, {@code ceil(size / bufferSize)}.
   *
   * @return chunk count
   * @throws LargeObjectException if the size query fails
   */
  public long count() throws LargeObjectException {
    return ChunkMath.chunkCount(lob.size(), lob.bufferSize());
  }

  /**
   * Reads chunk {@code index}.
   *
   * @param index zero-based chunk index
   * @return chunk bytes; shorter for the last chunk, empty past the end
   * @throws LargeObjectException if seeking or reading fails
   */
  public byte[] get(long index) throws LargeObjectException {
    ChunkMath.requireNonNegative("index", index);
    lob.seek(Math.multiplyExact(index, (long) lob.bufferSize()));
    return lob.read();
  }

  /**
   * Reads {@code length} consecutive chunks starting at {@code start}.
   *
   * @param start first chunk index
   * @param length number of chunks
   * @return chunks in order
   * @throws LargeObjectException if seeking or reading fails
   */
  public List<byte[]> slice(long start, int length) throws LargeObjectException {
    return slice(start, length, 1);
  }

  /**
   * Reads chunks {@code start, start + step, ...} that fall within {@code length} chunks of {@code start}.
   *
   * @param start first chunk index
   * @param length span of chunk indexes covered
   * @param step distance between selected chunks; must be positive
   * @return selected chunks in order
   * @throws LargeObjectException if seeking or reading fails
   */
  public List<byte[]> slice(long start, int length, int step) throws LargeObjectException {
    ChunkMath.requireNonNegative("start", start);
    ChunkMath.requireNonNegative("length", length);
    if (step <= 0) {
      throw new IllegalArgumentException("step must be positive (was " + step + ")");
    }
    List<byte[]> chunks = new ArrayList<>((length + step - 1) / step);
    for (int i = 0; i < length; i += step) {
      chunks.add(get(start + i));
    }
    return chunks;
  }
}
