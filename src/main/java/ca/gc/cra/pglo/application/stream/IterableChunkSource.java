package ca.gc.cra.pglo.application.stream;

import ca.gc.cra.pglo.application.port.ChunkSource;
import java.util.Iterator;
import java.util.Objects;

/**
 * Adapts an {@link Iterable} of byte arrays, such as a list or a lazily generated sequence, to a
 * {@link ChunkSource}. Empty elements are skipped; chunk boundaries are otherwise preserved.
 *
 * @since PGLO 0.1-doc
 */
public final class IterableChunkSource implements ChunkSource {
  private final Iterator<byte[]> iterator;
  private boolean closed;

  /**
   * Creates a source over {@code chunks}.
   *
   * @param chunks chunk sequence; elements must not be {@code null}
   */
  public IterableChunkSource(Iterable<byte[]> chunks) {
    this.iterator = Objects.requireNonNull(chunks, "chunks").iterator();
  }

  @Override
  public byte[] next() {
    while (!closed && iterator.hasNext()) {
      byte[] chunk = Objects.requireNonNull(iterator.next(), "chunk");
      if (chunk.length > 0) {
        return chunk;
      }
    }
    return null;
  }

  @Override
  public void close() {
    closed = true;
  }
}
