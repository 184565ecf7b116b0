package ca.gc.cra.pglo.domain.lob;

/**
 * <strong>What:</strong> Wire constants of the PostgreSQL large object interface.
 * <p><strong>Why:</strong> Flag bits and whence values are fixed by the server ABI ({@code libpq/libpq-fs.h}) and must
 * match exactly.</p>
 * <p><strong>Thread-safety:</strong> Constants only.</p>
 *
 * @since PGLO 0.1-doc
 */
public final class LargeObjectFlags {
  /** Open flag requesting read access. */
  public static final int INV_READ = 0x00040000;
  /** Open flag requesting write access. */
  public static final int INV_WRITE = 0x00020000;
  /** Whence value: offset relative to byte 0. */
  public static final int SEEK_SET = 0;
  /** Whence value: offset relative to the current position. */
  public static final int SEEK_CUR = 1;
  /** Whence value: offset relative to end-of-object. */
  public static final int SEEK_END = 2;

  /** Default chunk size for handles: the server recommends transfers of at most a few megabytes. */
  public static final int DEFAULT_BUFFER_SIZE = 1_048_576;
  /** Default chunk size for import/export. */
  public static final int DEFAULT_TRANSFER_BUFFER_SIZE = 65_536;

  private LargeObjectFlags() {
    // Constants
  }

  /**
   * Reports whether the flag word grants write access.
   *
   * @param flags open flags
   * @return {@code true} when {@link #INV_WRITE} is set
   */
  public static boolean writable(int flags) {
    return (flags & INV_WRITE) != 0;
  }
}
