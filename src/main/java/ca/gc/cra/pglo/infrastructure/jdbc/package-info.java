/**
 * PostgreSQL backend: the server-side {@code lo_*} functions over JDBC, one transaction per scope.
 * <p>SQLSTATE codes are translated by {@link ca.gc.cra.pglo.infrastructure.jdbc.SqlStateMapper}; statements carry
 * the remaining scope time as their query timeout.</p>
 */
package ca.gc.cra.pglo.infrastructure.jdbc;
