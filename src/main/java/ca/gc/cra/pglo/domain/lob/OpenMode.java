package ca.gc.cra.pglo.domain.lob;

import ca.gc.cra.pglo.domain.error.InvalidModeException;
import java.util.Locale;

/**
 * <strong>What:</strong> Access mode requested when opening a large object.
 * <p><strong>Why:</strong> Determines the flag bits passed to {@code lo_open} and therefore which operations the
 * descriptor permits.</p>
 * <p><strong>Thread-safety:</strong> Immutable enum.</p>
 *
 * @since PGLO 0.1-doc
 */
public enum OpenMode {
  /** Read-only descriptor. */
  READ(LargeObjectFlags.INV_READ, false),
  /** Write descriptor; the server also permits reads through it. */
  WRITE(LargeObjectFlags.INV_WRITE, false),
  /** Read/write descriptor. */
  READ_WRITE(LargeObjectFlags.INV_READ | LargeObjectFlags.INV_WRITE, false),
  /** Read/write descriptor positioned at end-of-object after opening. */
  APPEND(LargeObjectFlags.INV_READ | LargeObjectFlags.INV_WRITE, true);

  private final int flags;
  private final boolean seekToEnd;

  OpenMode(int flags, boolean seekToEnd) {
    this.flags = flags;
    this.seekToEnd = seekToEnd;
  }

  /**
   * Returns the {@code lo_open} flag word for this mode.
   *
   * @return flag bits
   */
  public int flags() {
    return flags;
  }

  /**
   * Indicates whether the cursor moves to end-of-object right after opening.
   *
   * @return {@code true} for {@link #APPEND}
   */
  public boolean seekToEnd() {
    return seekToEnd;
  }

  /**
   * Indicates whether descriptors opened in this mode accept writes.
   *
   * @return {@code true} when the write bit is set
   */
  public boolean writable() {
    return LargeObjectFlags.writable(flags);
  }

  /**
   * Parses a textual mode such as {@code read}, {@code read_write} or {@code append}.
   *
   * @param value mode text; case-insensitive, hyphens accepted in place of underscores
   * @return parsed mode
   * @throws InvalidModeException if the value names no known mode
   */
  public static OpenMode parse(String value) throws InvalidModeException {
    if (value == null || value.isBlank()) {
      throw new InvalidModeException(String.valueOf(value));
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    for (OpenMode mode : values()) {
      if (mode.name().equals(normalized)) {
        return mode;
      }
    }
    throw new InvalidModeException(value);
  }
}
