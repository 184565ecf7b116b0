package ca.gc.cra.pglo.domain.error;

/**
 * Raised when an unrecognised open mode is requested.
 *
 * @since PGLO 0.1-doc
 */
public class InvalidModeException extends LargeObjectException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the failure for the rejected mode text.
   *
   * @param mode mode value as supplied by the caller
   */
  public InvalidModeException(String mode) {
    super(ErrorKind.INVALID_MODE, "invalid mode: " + mode, null, null, null);
  }
}
