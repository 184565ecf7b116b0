package ca.gc.cra.pglo.api;

/**
 * Process exit codes shared by every command.
 *
 * @since PGLO 0.1-doc
 */
public enum ExitCode {
  /** Command completed. */
  SUCCESS(0),
  /** Arguments or merged configuration were rejected. */
  INVALID_ARGS(2),
  /** Local file or database I/O failed. */
  IO_ERROR(3),
  /** The configuration file could not be read or the backend could not be configured. */
  CONFIG_ERROR(4),
  /** Unexpected failure. */
  RUNTIME_FAILURE(5),
  /** The requested large object does not exist. */
  NOT_FOUND(6),
  /** The whole-call timeout expired; nothing was committed. */
  TIMEOUT(7);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric code passed to {@link System#exit(int)}.
   *
   * @return exit status
   */
  public int code() {
    return code;
  }
}
