package ca.gc.cra.pglo.application.port;

import java.io.IOException;
import java.time.Duration;

/**
 * <strong>What:</strong> Port binding large object work to a transactional scope.
 * <p><strong>Why:</strong> Descriptors are only valid inside a transaction; a failed import must not leave a
 * partially written object visible.</p>
 * <p><strong>Role:</strong> Lifecycle binding implemented by the JDBC transaction manager and the in-memory store.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Begin a scope, hand its backend to the work, commit on normal return.</li>
 *   <li>Roll back on any exception and rethrow it unchanged.</li>
 *   <li>Invalidate every descriptor when the scope ends.</li>
 *   <li>Enforce the optional whole-scope timeout.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations accept concurrent scopes; each scope is single-threaded.</p>
 * <p><strong>Observability:</strong> Implementations log commit and rollback at DEBUG.</p>
 *
 * @since PGLO 0.1-doc
 */
public interface TransactionPort {
  /**
   * Runs {@code work} inside a new scope.
   *
   * @param timeout deadline for the whole scope; {@code null} disables the deadline
   * @param work unit of work; must not be {@code null}
   * @param <T> result type
   * @return value returned by {@code work}
   * @throws IOException failure raised by {@code work}, by commit, or a
   *     {@link ca.gc.cra.pglo.domain.error.ScopeTimeoutException} when the deadline passes
   */
  <T> T inTransaction(Duration timeout, TransactionalWork<T> work) throws IOException;

  /**
   * Runs {@code work} inside a new scope without a deadline.
   *
   * @param work unit of work
   * @param <T> result type
   * @return value returned by {@code work}
   * @throws IOException failure raised by {@code work} or by commit
   */
  default <T> T inTransaction(TransactionalWork<T> work) throws IOException {
    return inTransaction(null, work);
  }
}
