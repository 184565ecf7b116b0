package ca.gc.cra.pglo.application.lob;

import ca.gc.cra.pglo.application.port.ChunkSink;
import ca.gc.cra.pglo.domain.error.LargeObjectException;
import java.util.Objects;

/**
 * <strong>What:</strong> Consumer adapter writing pushed chunks into a {@link LargeObject}.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Issue one {@code write} per accepted chunk, whatever its size.</li>
 *   <li>Close the handle on {@link #complete()}.</li>
 *   <li>Attempt a close on {@link #abort(Throwable)}; a failing close is attached to the cause, not thrown.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Single producer only.</p>
 *
 * @since PGLO 0.1-doc
 */
public final class LargeObjectWriter implements ChunkSink {
  private final LargeObject lob;
  private boolean finished;

  LargeObjectWriter(LargeObject lob) {
    this.lob = Objects.requireNonNull(lob, "lob");
  }

  @Override
  public void accept(byte[] chunk) throws LargeObjectException {
    Objects.requireNonNull(chunk, "chunk");
    if (finished) {
      throw new IllegalStateException("writer for large object " + lob.objectId() + " already finished");
    }
    lob.write(chunk);
  }

  @Override
  public void complete() throws LargeObjectException {
    if (finished) {
      return;
    }
    finished = true;
    if (!lob.isClosed()) {
      lob.close();
    }
  }

  @Override
  public void abort(Throwable cause) {
    if (finished) {
      return;
    }
    finished = true;
    lob.closeAfterFailure(cause);
  }
}
