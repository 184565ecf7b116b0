package ca.gc.cra.pglo.infrastructure.jdbc;

import ca.gc.cra.pglo.domain.error.LargeObjectException;
import ca.gc.cra.pglo.validation.Strings;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Set-based large-object statements built from {@link LargeObjectSql} fragments.
 *
 * @since PGLO 0.1-doc
 */
public final class BulkLargeObjectOperations {
  private static final Logger log = LoggerFactory.getLogger(BulkLargeObjectOperations.class);

  private BulkLargeObjectOperations() {
    // Utility
  }

  /**
   * Unlinks every object referenced by {@code oidColumn} in the rows of {@code table} matching
   * {@code whereClause}, in a single statement. Rows themselves are left in place.
   *
   * <p>{@code table} and {@code oidColumn} must be plain identifiers. {@code whereClause} is trusted SQL; pass
   * user input through {@code params} bound to its {@code ?} placeholders.</p>
   *
   * @param connection connection; runs in its current transaction
   * @param table table holding the references, optionally schema-qualified
   * @param oidColumn column of type {@code oid}
   * @param whereClause filter without the {@code WHERE} keyword
   * @param params values for the placeholders, in order
   * @return number of objects unlinked
   * @throws LargeObjectException {@code NOT_FOUND} if any referenced object is already gone, otherwise a backend
   *     failure; nothing is unlinked in that case once the transaction rolls back
   */
  public static long unlinkWhere(
      Connection connection, String table, String oidColumn, String whereClause, List<?> params)
      throws LargeObjectException {
    Objects.requireNonNull(connection, "connection");
    String safeTable = Strings.requireSqlIdentifier("table", table);
    String safeColumn = Strings.requireSqlIdentifier("oidColumn", oidColumn);
    String filter = Strings.requireNonBlank("whereClause", whereClause);
    String sql = "SELECT count(" + LargeObjectSql.loUnlink(safeColumn) + ") FROM " + safeTable
        + " WHERE " + safeColumn + " IS NOT NULL AND (" + filter + ")";
    try (PreparedStatement statement = connection.prepareStatement(sql)) {
      List<?> values = params == null ? List.of() : params;
      for (int i = 0; i < values.size(); i++) {
        statement.setObject(i + 1, values.get(i));
      }
      try (ResultSet rs = statement.executeQuery()) {
        long unlinked = rs.next() ? rs.getLong(1) : 0L;
        log.debug("Unlinked {} large objects referenced from {}.{}", unlinked, safeTable, safeColumn);
        return unlinked;
      }
    } catch (SQLException ex) {
      throw SqlStateMapper.map(ex, "lo_unlink", null, null);
    }
  }
}
