package ca.gc.cra.pglo.infrastructure.jdbc;

import ca.gc.cra.pglo.application.lob.Deadline;
import ca.gc.cra.pglo.application.port.LargeObjectBackend;
import ca.gc.cra.pglo.domain.error.BackendFailureException;
import ca.gc.cra.pglo.domain.error.LargeObjectException;
import ca.gc.cra.pglo.domain.lob.SeekAnchor;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;

/**
 * <strong>What:</strong> {@link LargeObjectBackend} that calls the PostgreSQL server-side large-object functions
 * over JDBC.
 * <p><strong>Scope:</strong> Bound to one connection with auto-commit off; descriptors returned by
 * {@code lo_open} die with the surrounding transaction, which {@link JdbcTransactionManager} owns.</p>
 * <p><strong>Timeouts:</strong> Every statement gets a query timeout equal to the time left on the scope deadline,
 * rounded up to whole seconds; the server cancels with SQLSTATE 57014, which surfaces as a timeout failure.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe, like the connection it wraps.</p>
 *
 * @since PGLO 0.1-doc
 */
public final class JdbcLargeObjectBackend implements LargeObjectBackend {
  private static final String CREATE = LargeObjectSql.select(LargeObjectSql.loCreate());
  private static final String UNLINK = LargeObjectSql.select(LargeObjectSql.loUnlink());
  private static final String OPEN = LargeObjectSql.select(LargeObjectSql.loOpen());
  private static final String CLOSE = LargeObjectSql.select(LargeObjectSql.loClose());
  private static final String WRITE = LargeObjectSql.select(LargeObjectSql.loWrite());
  private static final String READ = LargeObjectSql.select(LargeObjectSql.loRead());
  private static final String SEEK = LargeObjectSql.select(LargeObjectSql.loLseek64());
  private static final String TELL = LargeObjectSql.select(LargeObjectSql.loTell64());
  private static final String TRUNCATE = LargeObjectSql.select(LargeObjectSql.loTruncate64());

  private final Connection connection;
  private final Deadline deadline;

  /**
   * Creates a backend over {@code connection}.
   *
   * @param connection open connection inside a transaction
   * @param deadline scope deadline used for statement timeouts
   */
  public JdbcLargeObjectBackend(Connection connection, Deadline deadline) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.deadline = Objects.requireNonNull(deadline, "deadline");
  }

  @Override
  public long create(long desiredId) throws LargeObjectException {
    return query("lo_create", CREATE, desiredId, null, ps -> ps.setLong(1, desiredId), rs -> rs.getLong(1));
  }

  @Override
  public void unlink(long objectId) throws LargeObjectException {
    query("lo_unlink", UNLINK, objectId, null, ps -> ps.setLong(1, objectId), rs -> rs.getInt(1));
  }

  @Override
  public int open(long objectId, int flags) throws LargeObjectException {
    return query("lo_open", OPEN, objectId, null, ps -> {
      ps.setLong(1, objectId);
      ps.setInt(2, flags);
    }, rs -> rs.getInt(1));
  }

  @Override
  public void close(int descriptor) throws LargeObjectException {
    query("lo_close", CLOSE, null, descriptor, ps -> ps.setInt(1, descriptor), rs -> rs.getInt(1));
  }

  @Override
  public void write(int descriptor, byte[] data) throws LargeObjectException {
    int written = query("lowrite", WRITE, null, descriptor, ps -> {
      ps.setInt(1, descriptor);
      ps.setBytes(2, data);
    }, rs -> rs.getInt(1));
    if (written != data.length) {
      throw new BackendFailureException(
          "lowrite stored " + written + " of " + data.length + " bytes", null, descriptor);
    }
  }

  @Override
  public byte[] read(int descriptor, int length) throws LargeObjectException {
    byte[] data = query("loread", READ, null, descriptor, ps -> {
      ps.setInt(1, descriptor);
      ps.setInt(2, length);
    }, rs -> rs.getBytes(1));
    return data == null ? new byte[0] : data;
  }

  @Override
  public long seek(int descriptor, long offset, SeekAnchor anchor) throws LargeObjectException {
    return query("lo_lseek64", SEEK, null, descriptor, ps -> {
      ps.setInt(1, descriptor);
      ps.setLong(2, offset);
      ps.setInt(3, anchor.whence());
    }, rs -> rs.getLong(1));
  }

  @Override
  public long tell(int descriptor) throws LargeObjectException {
    return query("lo_tell64", TELL, null, descriptor, ps -> ps.setInt(1, descriptor), rs -> rs.getLong(1));
  }

  @Override
  public void resize(int descriptor, long size) throws LargeObjectException {
    query("lo_truncate64", TRUNCATE, null, descriptor, ps -> {
      ps.setInt(1, descriptor);
      ps.setLong(2, size);
    }, rs -> rs.getInt(1));
  }

  private <T> T query(
      String function, String sql, Long objectId, Integer descriptor, Binder binder, Extractor<T> extractor)
      throws LargeObjectException {
    try (PreparedStatement statement = connection.prepareStatement(sql)) {
      int timeoutSeconds = timeoutSeconds();
      if (timeoutSeconds > 0) {
        statement.setQueryTimeout(timeoutSeconds);
      }
      binder.bind(statement);
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) {
          throw new BackendFailureException(function + " returned no row", objectId, descriptor);
        }
        return extractor.extract(rs);
      }
    } catch (SQLException ex) {
      throw SqlStateMapper.map(ex, function, objectId, descriptor);
    }
  }

  private int timeoutSeconds() {
    if (!deadline.bounded()) {
      return 0;
    }
    long remaining = deadline.remainingMillis();
    long seconds = Math.max(1L, (remaining + 999L) / 1000L);
    return (int) Math.min(Integer.MAX_VALUE, seconds);
  }

  @FunctionalInterface
  private interface Binder {
    void bind(PreparedStatement statement) throws SQLException;
  }

  @FunctionalInterface
  private interface Extractor<T> {
    T extract(ResultSet rs) throws SQLException;
  }
}
