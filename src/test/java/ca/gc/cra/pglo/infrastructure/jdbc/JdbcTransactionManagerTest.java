package ca.gc.cra.pglo.infrastructure.jdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pglo.application.lob.LargeObject;
import ca.gc.cra.pglo.domain.error.BackendFailureException;
import ca.gc.cra.pglo.domain.error.ObjectNotFoundException;
import ca.gc.cra.pglo.domain.error.ScopeTimeoutException;
import ca.gc.cra.pglo.testutil.ManualClock;
import ca.gc.cra.pglo.testutil.ScriptedConnection;
import java.io.IOException;
import java.sql.SQLException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class JdbcTransactionManagerTest {
  private final ScriptedConnection db = new ScriptedConnection();
  private final ManualClock clock = new ManualClock(0);
  private final JdbcTransactionManager manager = new JdbcTransactionManager(db::connection, clock);

  @Test
  void commitsAndClosesOnSuccess() throws IOException {
    db.returning(16_400L).returning(0).returning(0);

    long objectId = manager.inTransaction(backend -> {
      LargeObject lob = LargeObject.create(backend);
      lob.close();
      return lob.objectId();
    });

    assertEquals(16_400L, objectId);
    assertFalse(db.autoCommit());
    assertEquals(1, db.commits());
    assertEquals(0, db.rollbacks());
    assertTrue(db.closed());
  }

  @Test
  void rollsBackWhenWorkFails() {
    db.failing("42704");

    assertThrows(ObjectNotFoundException.class, () -> manager.inTransaction(backend -> {
      LargeObject.remove(backend, 123L);
      return null;
    }));

    assertEquals(0, db.commits());
    assertEquals(1, db.rollbacks());
    assertTrue(db.closed());
  }

  @Test
  void commitFailureIsMappedAndRolledBack() {
    db.failingCommit("40001");

    BackendFailureException ex = assertThrows(BackendFailureException.class,
        () -> manager.inTransaction(backend -> null));

    assertTrue(ex.getMessage().startsWith("transaction failed"));
    assertEquals(1, db.rollbacks());
    assertTrue(db.closed());
  }

  @Test
  void expiredDeadlineStopsBeforeNextCall() {
    db.returning(16_401L);

    assertThrows(ScopeTimeoutException.class, () -> manager.inTransaction(Duration.ofSeconds(1), backend -> {
      backend.create(0L);
      clock.advance(1_000);
      return backend.open(16_401L, 0x60000);
    }));

    assertEquals(1, db.executed().size());
    assertEquals(1, db.rollbacks());
  }

  @Test
  void connectFailureIsBackendFailure() {
    SQLException refused = new SQLException("connection refused", "08001");
    JdbcTransactionManager unreachable = new JdbcTransactionManager(() -> {
      throw refused;
    }, clock);

    BackendFailureException ex = assertThrows(BackendFailureException.class,
        () -> unreachable.inTransaction(backend -> null));
    assertSame(refused, ex.getCause());
  }
}
