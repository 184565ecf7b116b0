package ca.gc.cra.pglo.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock time to deadline checks and latency metrics.
 * <p><strong>Why:</strong> Tests inject a controllable clock to exercise scope timeouts deterministically.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since PGLO 0.1-doc
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
