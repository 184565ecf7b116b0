package ca.gc.cra.pglo.infrastructure.jdbc;

import ca.gc.cra.pglo.application.lob.Deadline;
import ca.gc.cra.pglo.application.lob.DeadlineBackend;
import ca.gc.cra.pglo.application.port.ClockPort;
import ca.gc.cra.pglo.application.port.TransactionPort;
import ca.gc.cra.pglo.application.port.TransactionalWork;
import ca.gc.cra.pglo.domain.error.BackendFailureException;
import ca.gc.cra.pglo.domain.error.LargeObjectException;
import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link TransactionPort} that runs each scope on a fresh JDBC connection inside one
 * database transaction.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open a connection, switch auto-commit off and hand the work a deadline-guarded backend.</li>
 *   <li>Commit when the work returns, roll back when it throws; descriptors never outlive the scope.</li>
 *   <li>Close the connection on every path.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent scopes as long as the factory hands out distinct
 * connections.</p>
 *
 * @since PGLO 0.1-doc
 */
public final class JdbcTransactionManager implements TransactionPort {
  private static final Logger log = LoggerFactory.getLogger(JdbcTransactionManager.class);

  private final ConnectionFactory connections;
  private final ClockPort clock;

  /**
   * Creates a manager.
   *
   * @param connections connection source; one connection per scope
   * @param clock time source for deadlines
   */
  public JdbcTransactionManager(ConnectionFactory connections, ClockPort clock) {
    this.connections = Objects.requireNonNull(connections, "connections");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public <T> T inTransaction(Duration timeout, TransactionalWork<T> work) throws IOException {
    Objects.requireNonNull(work, "work");
    Deadline deadline = Deadline.after(timeout, clock);
    Connection connection = connect();
    Throwable failure = null;
    try {
      connection.setAutoCommit(false);
      T result = work.execute(new DeadlineBackend(new JdbcLargeObjectBackend(connection, deadline), deadline));
      connection.commit();
      return result;
    } catch (SQLException ex) {
      LargeObjectException mapped = SqlStateMapper.map(ex, "transaction", null, null);
      failure = mapped;
      rollback(connection, mapped);
      throw mapped;
    } catch (IOException | RuntimeException ex) {
      failure = ex;
      rollback(connection, ex);
      throw ex;
    } finally {
      release(connection, failure);
    }
  }

  private Connection connect() throws BackendFailureException {
    try {
      return connections.open();
    } catch (SQLException ex) {
      throw new BackendFailureException("unable to open connection: " + ex.getMessage(), null, null, ex);
    }
  }

  private static void rollback(Connection connection, Throwable primary) {
    try {
      connection.rollback();
      log.debug("Rolled back scope after {}", primary.toString());
    } catch (SQLException ex) {
      primary.addSuppressed(ex);
      log.warn("Rollback failed after {}", primary.toString(), ex);
    }
  }

  private static void release(Connection connection, Throwable primary) {
    try {
      connection.close();
    } catch (SQLException ex) {
      if (primary != null) {
        primary.addSuppressed(ex);
      }
      log.warn("Failed to close connection", ex);
    }
  }
}
