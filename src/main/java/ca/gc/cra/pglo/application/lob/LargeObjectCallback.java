package ca.gc.cra.pglo.application.lob;

import java.io.IOException;

/**
 * Work run against an open {@link LargeObject} by {@link LargeObject#withOpen}.
 *
 * @param <T> result type
 * @since PGLO 0.1-doc
 */
@FunctionalInterface
public interface LargeObjectCallback<T> {
  /**
   * Runs the work.
   *
   * @param lob open handle; closed by the caller after this method returns
   * @return result
   * @throws IOException to abort the work
   */
  T apply(LargeObject lob) throws IOException;
}
