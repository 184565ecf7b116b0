package ca.gc.cra.pglo.application.lob;

import ca.gc.cra.pglo.application.port.ChunkSource;
import ca.gc.cra.pglo.domain.error.LargeObjectException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * <strong>What:</strong> Producer adapter turning a {@link LargeObject} into a lazy sequence of chunks.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Issue one {@code read(bufferSize)} per pull, starting at the handle's current cursor.</li>
 *   <li>End the sequence, without error, on the first empty read.</li>
 *   <li>Close the handle on exhaustion, on early {@link #close()} and on read failure.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Single consumer only.</p>
 * <p>The sequence is single-pass; iterating again requires opening the object again.</p>
 *
 * @since PGLO 0.1-doc
 */
public final class LargeObjectReader implements ChunkSource {
  private final LargeObject lob;
  private boolean started;
  private boolean finished;

  LargeObjectReader(LargeObject lob) {
    this.lob = Objects.requireNonNull(lob, "lob");
  }

  @Override
  public byte[] next() throws LargeObjectException {
    started = true;
    if (finished) {
      return null;
    }
    byte[] chunk;
    try {
      chunk = lob.read();
    } catch (LargeObjectException ex) {
      finished = true;
      lob.closeAfterFailure(ex);
      throw ex;
    }
    if (chunk.length == 0) {
      close();
      return null;
    }
    return chunk;
  }

  /**
   * Ends the iteration and closes the handle if that has not happened yet.
   *
   * @throws LargeObjectException if closing the descriptor fails
   */
  @Override
  public void close() throws LargeObjectException {
    if (finished) {
      return;
    }
    finished = true;
    if (!lob.isClosed()) {
      lob.close();
    }
  }

  /**
   * Exposes the remaining chunks as a sequential stream. Closing the stream closes the handle; read failures surface
   * as {@link UncheckedIOException}.
   *
   * @return stream of chunks
   * @throws IllegalStateException if iteration already started
   */
  public Stream<byte[]> stream() {
    if (started || finished) {
      throw new IllegalStateException("large object reader is single-pass; reopen the object to read again");
    }
    started = true;
    Iterator<byte[]> iterator = new Iterator<>() {
      private byte[] pending;

      @Override
      public boolean hasNext() {
        if (pending == null) {
          try {
            pending = LargeObjectReader.this.next();
          } catch (IOException ex) {
            throw new UncheckedIOException(ex);
          }
        }
        return pending != null;
      }

      @Override
      public byte[] next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        byte[] chunk = pending;
        pending = null;
        return chunk;
      }
    };
    Spliterator<byte[]> spliterator =
        Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL);
    return StreamSupport.stream(spliterator, false).onClose(() -> {
      try {
        close();
      } catch (IOException ex) {
        throw new UncheckedIOException(ex);
      }
    });
  }
}
