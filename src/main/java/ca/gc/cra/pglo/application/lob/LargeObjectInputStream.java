package ca.gc.cra.pglo.application.lob;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * {@link InputStream} reading a {@link LargeObject} from its cursor. Each {@code read} call is one round-trip;
 * wrap in a {@link java.io.BufferedInputStream} for byte-at-a-time consumers.
 *
 * @since PGLO 0.1-doc
 */
public final class LargeObjectInputStream extends InputStream {
  private final LargeObject lob;

  LargeObjectInputStream(LargeObject lob) {
    this.lob = Objects.requireNonNull(lob, "lob");
  }

  @Override
  public int read() throws IOException {
    byte[] data = lob.read(1);
    return data.length == 0 ? -1 : data[0] & 0xFF;
  }

  @Override
  public int read(byte[] buffer, int offset, int length) throws IOException {
    Objects.checkFromIndexSize(offset, length, buffer.length);
    if (length == 0) {
      return 0;
    }
    byte[] data = lob.read(length);
    if (data.length == 0) {
      return -1;
    }
    System.arraycopy(data, 0, buffer, offset, data.length);
    return data.length;
  }

  @Override
  public void close() throws IOException {
    if (!lob.isClosed()) {
      lob.close();
    }
  }
}
