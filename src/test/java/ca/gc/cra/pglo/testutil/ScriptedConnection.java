package ca.gc.cra.pglo.testutil;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * JDBC connection double built with {@link Proxy}. Each {@code executeQuery} consumes the next scripted response:
 * a single-row, single-column result, an empty result, or a failure.
 */
public final class ScriptedConnection {
  private static final Object NO_ROWS = new Object();
  private static final Object SQL_NULL = new Object();

  private final Deque<Object> responses = new ArrayDeque<>();
  private final List<Executed> executed = new ArrayList<>();
  private boolean autoCommit = true;
  private int commits;
  private int rollbacks;
  private boolean closed;
  private SQLException commitFailure;

  /** Statement observed by the double. */
  public static final class Executed {
    private final String sql;
    private final Map<Integer, Object> parameters = new TreeMap<>();
    private int queryTimeout;
    private boolean closed;

    private Executed(String sql) {
      this.sql = sql;
    }

    public String sql() {
      return sql;
    }

    public Map<Integer, Object> parameters() {
      return parameters;
    }

    public int queryTimeout() {
      return queryTimeout;
    }

    public boolean closed() {
      return closed;
    }
  }

  public ScriptedConnection returning(Object value) {
    responses.add(value);
    return this;
  }

  public ScriptedConnection returningNoRows() {
    responses.add(NO_ROWS);
    return this;
  }

  public ScriptedConnection returningNull() {
    responses.add(SQL_NULL);
    return this;
  }

  public ScriptedConnection failing(String sqlState) {
    responses.add(new SQLException("scripted failure " + sqlState, sqlState));
    return this;
  }

  public ScriptedConnection failingCommit(String sqlState) {
    commitFailure = new SQLException("scripted commit failure " + sqlState, sqlState);
    return this;
  }

  public List<Executed> executed() {
    return executed;
  }

  public Executed last() {
    return executed.get(executed.size() - 1);
  }

  public boolean autoCommit() {
    return autoCommit;
  }

  public int commits() {
    return commits;
  }

  public int rollbacks() {
    return rollbacks;
  }

  public boolean closed() {
    return closed;
  }

  public Connection connection() {
    InvocationHandler handler = (proxy, method, args) -> {
      switch (method.getName()) {
        case "prepareStatement":
          return statement(new Executed((String) args[0]));
        case "setAutoCommit":
          autoCommit = (Boolean) args[0];
          return null;
        case "getAutoCommit":
          return autoCommit;
        case "commit":
          if (commitFailure != null) {
            throw commitFailure;
          }
          commits++;
          return null;
        case "rollback":
          rollbacks++;
          return null;
        case "close":
          closed = true;
          return null;
        case "isClosed":
          return closed;
        default:
          return objectMethod(proxy, method.getName(), args, "Connection");
      }
    };
    return (Connection) Proxy.newProxyInstance(
        getClass().getClassLoader(), new Class<?>[] {Connection.class}, handler);
  }

  private PreparedStatement statement(Executed statement) {
    executed.add(statement);
    InvocationHandler handler = (proxy, method, args) -> {
      String name = method.getName();
      if (name.startsWith("set") && args != null && args.length == 2 && args[0] instanceof Integer index) {
        statement.parameters.put(index, args[1]);
        return null;
      }
      switch (name) {
        case "setQueryTimeout":
          statement.queryTimeout = (Integer) args[0];
          return null;
        case "executeQuery":
          Object response = responses.poll();
          if (response instanceof SQLException failure) {
            throw failure;
          }
          if (response == null) {
            throw new IllegalStateException("no scripted response for " + statement.sql);
          }
          return resultSet(response);
        case "close":
          statement.closed = true;
          return null;
        default:
          return objectMethod(proxy, name, args, "PreparedStatement");
      }
    };
    return (PreparedStatement) Proxy.newProxyInstance(
        getClass().getClassLoader(), new Class<?>[] {PreparedStatement.class}, handler);
  }

  private ResultSet resultSet(Object value) {
    boolean[] consumed = {value == NO_ROWS};
    InvocationHandler handler = (proxy, method, args) -> {
      switch (method.getName()) {
        case "next":
          boolean hasRow = !consumed[0];
          consumed[0] = true;
          return hasRow;
        case "getLong":
          return ((Number) value).longValue();
        case "getInt":
          return ((Number) value).intValue();
        case "getBytes":
          return value == SQL_NULL ? null : value;
        case "close":
          return null;
        default:
          return objectMethod(proxy, method.getName(), args, "ResultSet");
      }
    };
    return (ResultSet) Proxy.newProxyInstance(
        getClass().getClassLoader(), new Class<?>[] {ResultSet.class}, handler);
  }

  private static Object objectMethod(Object proxy, String name, Object[] args, String type) {
    switch (name) {
      case "toString":
        return "Scripted" + type;
      case "hashCode":
        return System.identityHashCode(proxy);
      case "equals":
        return proxy == args[0];
      default:
        throw new UnsupportedOperationException(type + "." + name);
    }
  }
}
