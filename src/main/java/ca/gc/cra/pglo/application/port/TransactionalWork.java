package ca.gc.cra.pglo.application.port;

import java.io.IOException;

/**
 * Unit of work executed inside one transactional scope.
 *
 * @param <T> result type
 * @since PGLO 0.1-doc
 */
@FunctionalInterface
public interface TransactionalWork<T> {
  /**
   * Runs the work against the scope's backend.
   *
   * <p>The backend and every descriptor opened through it are invalid once this method returns; they must not be
   * stored in fields or handed to other threads.</p>
   *
   * @param backend backend bound to the scope
   * @return result committed with the scope
   * @throws IOException to abort the scope
   */
  T execute(LargeObjectBackend backend) throws IOException;
}
