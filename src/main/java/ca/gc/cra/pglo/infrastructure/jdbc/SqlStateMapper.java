package ca.gc.cra.pglo.infrastructure.jdbc;

import ca.gc.cra.pglo.domain.error.BackendFailureException;
import ca.gc.cra.pglo.domain.error.InvalidOffsetException;
import ca.gc.cra.pglo.domain.error.LargeObjectException;
import ca.gc.cra.pglo.domain.error.ObjectAlreadyExistsException;
import ca.gc.cra.pglo.domain.error.ObjectNotFoundException;
import ca.gc.cra.pglo.domain.error.ReadOnlyObjectException;
import ca.gc.cra.pglo.domain.error.ScopeTimeoutException;
import java.sql.SQLException;

/**
 * Translates PostgreSQL SQLSTATE codes raised by the large-object functions into typed failures.
 *
 * <table>
 *   <caption>SQLSTATE mapping</caption>
 *   <tr><th>SQLSTATE</th><th>Condition</th><th>Failure</th></tr>
 *   <tr><td>42704</td><td>undefined_object</td><td>{@link ObjectNotFoundException}</td></tr>
 *   <tr><td>23505</td><td>unique_violation</td><td>{@link ObjectAlreadyExistsException}</td></tr>
 *   <tr><td>55000</td><td>object_not_in_prerequisite_state</td><td>{@link ReadOnlyObjectException}</td></tr>
 *   <tr><td>22023</td><td>invalid_parameter_value, seek only</td><td>{@link InvalidOffsetException}</td></tr>
 *   <tr><td>57014</td><td>query_canceled</td><td>{@link ScopeTimeoutException}</td></tr>
 * </table>
 * Anything else becomes {@link BackendFailureException}.
 *
 * @since PGLO 0.1-doc
 */
public final class SqlStateMapper {
  static final String UNDEFINED_OBJECT = "42704";
  static final String UNIQUE_VIOLATION = "23505";
  static final String NOT_IN_PREREQUISITE_STATE = "55000";
  static final String INVALID_PARAMETER_VALUE = "22023";
  static final String QUERY_CANCELED = "57014";

  private SqlStateMapper() {
    // Utility
  }

  /**
   * Maps {@code ex} to a typed failure carrying the call context.
   *
   * @param ex driver failure
   * @param function server function that failed, e.g. {@code lo_open}
   * @param objectId object involved, if known
   * @param descriptor descriptor involved, if known
   * @return typed failure with {@code ex} as cause
   */
  public static LargeObjectException map(SQLException ex, String function, Long objectId, Integer descriptor) {
    String state = ex.getSQLState();
    String message = function + " failed: " + ex.getMessage();
    if (state == null) {
      return new BackendFailureException(message, objectId, descriptor, ex);
    }
    switch (state) {
      case UNDEFINED_OBJECT:
        return new ObjectNotFoundException(message, objectId, descriptor, ex);
      case UNIQUE_VIOLATION:
        return new ObjectAlreadyExistsException(message, objectId, descriptor, ex);
      case NOT_IN_PREREQUISITE_STATE:
        return new ReadOnlyObjectException(message, objectId, descriptor, ex);
      case QUERY_CANCELED:
        return new ScopeTimeoutException(message, objectId, descriptor, ex);
      case INVALID_PARAMETER_VALUE:
        if (function.startsWith("lo_lseek")) {
          return new InvalidOffsetException(message, objectId, descriptor, ex);
        }
        return new BackendFailureException(message, objectId, descriptor, ex);
      default:
        return new BackendFailureException(message, objectId, descriptor, ex);
    }
  }
}
