package ca.gc.cra.pglo.domain.error;

/**
 * Raised when writing or resizing through a descriptor that was not opened for writing.
 *
 * @since PGLO 0.1-doc
 */
public class ReadOnlyObjectException extends LargeObjectException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the failure.
   *
   * @param message human readable description
   * @param objectId object id involved, or {@code null} when unknown
   * @param descriptor descriptor involved, or {@code null} when unknown
   * @param cause underlying failure, may be {@code null}
   */
  public ReadOnlyObjectException(String message, Long objectId, Integer descriptor, Throwable cause) {
    super(ErrorKind.READ_ONLY, message, objectId, descriptor, cause);
  }

  /**
   * Creates the failure without an underlying cause.
   *
   * @param message human readable description
   * @param objectId object id involved, or {@code null} when unknown
   * @param descriptor descriptor involved, or {@code null} when unknown
   */
  public ReadOnlyObjectException(String message, Long objectId, Integer descriptor) {
    this(message, objectId, descriptor, null);
  }
}
