package ca.gc.cra.pglo.infrastructure.jdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pglo.domain.error.ErrorKind;
import ca.gc.cra.pglo.domain.error.LargeObjectException;
import java.sql.SQLException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SqlStateMapperTest {

  @ParameterizedTest
  @CsvSource({
      "42704, lo_open, NOT_FOUND",
      "23505, lo_create, ALREADY_EXISTS",
      "55000, lowrite, READ_ONLY",
      "22023, lo_lseek64, INVALID_OFFSET",
      "22023, loread, BACKEND",
      "57014, loread, TIMEOUT",
      "08006, lo_tell64, BACKEND"
  })
  void mapsSqlStateToKind(String sqlState, String function, ErrorKind expected) {
    SQLException cause = new SQLException("server said no", sqlState);

    LargeObjectException mapped = SqlStateMapper.map(cause, function, 42L, 3);

    assertEquals(expected, mapped.kind());
    assertSame(cause, mapped.getCause());
    assertEquals(42L, mapped.objectId().getAsLong());
    assertEquals(3, mapped.descriptor().getAsInt());
    assertTrue(mapped.getMessage().startsWith(function + " failed: "));
  }

  @Test
  void missingSqlStateIsBackendFailure() {
    LargeObjectException mapped = SqlStateMapper.map(new SQLException("connection reset"), "lo_close", null, 1);

    assertEquals(ErrorKind.BACKEND, mapped.kind());
    assertTrue(mapped.objectId().isEmpty());
  }
}
