package ca.gc.cra.pglo.domain.lob;

/**
 * Reference point for a seek, mapped to the server's whence values.
 *
 * @since PGLO 0.1-doc
 */
public enum SeekAnchor {
  /** Offset is absolute and must be non-negative. */
  START(LargeObjectFlags.SEEK_SET),
  /** Offset is relative to the current position. */
  CURRENT(LargeObjectFlags.SEEK_CUR),
  /** Offset is relative to end-of-object and must not be positive. */
  END(LargeObjectFlags.SEEK_END);

  private final int whence;

  SeekAnchor(int whence) {
    this.whence = whence;
  }

  /**
   * Returns the wire whence value.
   *
   * @return {@code SEEK_SET}, {@code SEEK_CUR} or {@code SEEK_END}
   */
  public int whence() {
    return whence;
  }
}
