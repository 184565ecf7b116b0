package ca.gc.cra.pglo.application.lob;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * {@link OutputStream} writing into a {@link LargeObject} at its cursor. Each {@code write} call is one round-trip;
 * wrap in a {@link java.io.BufferedOutputStream} to batch small writes.
 *
 * @since PGLO 0.1-doc
 */
public final class LargeObjectOutputStream extends OutputStream {
  private final LargeObject lob;

  LargeObjectOutputStream(LargeObject lob) {
    this.lob = Objects.requireNonNull(lob, "lob");
  }

  @Override
  public void write(int b) throws IOException {
    lob.write(new byte[] {(byte) b});
  }

  @Override
  public void write(byte[] buffer, int offset, int length) throws IOException {
    if (length == 0) {
      return;
    }
    lob.write(buffer, offset, length);
  }

  @Override
  public void close() throws IOException {
    if (!lob.isClosed()) {
      lob.close();
    }
  }
}
