package ca.gc.cra.pglo.infrastructure.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Supplies one JDBC connection per transactional scope; the caller closes it.
 *
 * @since PGLO 0.1-doc
 */
@FunctionalInterface
public interface ConnectionFactory {
  /**
   * Opens a connection.
   *
   * @return open connection
   * @throws SQLException if the database cannot be reached
   */
  Connection open() throws SQLException;
}
