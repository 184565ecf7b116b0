package ca.gc.cra.pglo.infrastructure.jdbc;

import java.util.Objects;

/**
 * SQL fragments for the server-side large-object functions, one per backend primitive.
 *
 * <p>Each builder takes the argument expressions to embed, so the same fragment serves both a parameterised
 * single call ({@code lo_open(?, ?)}) and a set-based query over a column ({@code lo_unlink(t.blob)}). The no-argument
 * overloads return the placeholder form used by {@link JdbcLargeObjectBackend}.</p>
 *
 * @since PGLO 0.1-doc
 */
public final class LargeObjectSql {
  private static final String P = "?";

  private LargeObjectSql() {
    // Utility
  }

  public static String loCreate(String objectId) {
    return call("lo_create", oid(objectId));
  }

  public static String loUnlink(String objectId) {
    return call("lo_unlink", oid(objectId));
  }

  public static String loOpen(String objectId, String flags) {
    return call("lo_open", oid(objectId), flags);
  }

  public static String loClose(String descriptor) {
    return call("lo_close", descriptor);
  }

  public static String loWrite(String descriptor, String data) {
    return call("lowrite", descriptor, data);
  }

  public static String loRead(String descriptor, String length) {
    return call("loread", descriptor, length);
  }

  public static String loLseek64(String descriptor, String offset, String whence) {
    return call("lo_lseek64", descriptor, offset, whence);
  }

  public static String loTell64(String descriptor) {
    return call("lo_tell64", descriptor);
  }

  public static String loTruncate64(String descriptor, String size) {
    return call("lo_truncate64", descriptor, size);
  }

  static String loCreate() {
    return loCreate(P);
  }

  static String loUnlink() {
    return loUnlink(P);
  }

  static String loOpen() {
    return loOpen(P, P);
  }

  static String loClose() {
    return loClose(P);
  }

  static String loWrite() {
    return loWrite(P, P);
  }

  static String loRead() {
    return loRead(P, P);
  }

  static String loLseek64() {
    return loLseek64(P, P, P);
  }

  static String loTell64() {
    return loTell64(P);
  }

  static String loTruncate64() {
    return loTruncate64(P, P);
  }

  /**
   * Wraps a fragment in a single-row {@code SELECT}.
   *
   * @param fragment function call expression
   * @return executable statement text
   */
  public static String select(String fragment) {
    return "SELECT " + Objects.requireNonNull(fragment, "fragment");
  }

  // JDBC binds longs as int8; PostgreSQL only casts int8 to oid on assignment.
  private static String oid(String expression) {
    return P.equals(expression) ? "?::oid" : expression;
  }

  private static String call(String function, String... args) {
    StringBuilder sql = new StringBuilder(function).append('(');
    for (int i = 0; i < args.length; i++) {
      if (i > 0) {
        sql.append(", ");
      }
      sql.append(Objects.requireNonNull(args[i], "argument"));
    }
    return sql.append(')').toString();
  }
}
