package ca.gc.cra.pglo.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PgloConfigTest {

  @Test
  void defaultsUseSixtyFourKilobyteBufferAndOneMinuteTimeout() {
    PgloConfig config = PgloConfig.fromMap(Map.of(), Map.of());

    assertNull(config.jdbcUrl());
    assertEquals(65_536, config.bufferSize());
    assertEquals(Duration.ofSeconds(60), config.timeout());
  }

  @Test
  void optionsWinOverEnvironment() {
    PgloConfig config = PgloConfig.fromMap(
        Map.of("url", "jdbc:postgresql://db/app", "bufferSize", "4096", "timeoutMs", "1500"),
        Map.of(PgloConfig.ENV_URL, "jdbc:postgresql://other/app", PgloConfig.ENV_USER, "loader"));

    assertEquals("jdbc:postgresql://db/app", config.requireJdbcUrl());
    assertEquals("loader", config.user());
    assertEquals(4096, config.transferOptions().bufferSize());
    assertEquals(Duration.ofMillis(1500), config.transferOptions().timeout());
    assertFalse(config.usesMemoryStore());
  }

  @Test
  void zeroTimeoutMeansUnbounded() {
    PgloConfig config = PgloConfig.fromMap(Map.of("url", "mem:", "timeoutMs", "0"), Map.of());

    assertNull(config.timeout());
    assertTrue(config.usesMemoryStore());
  }

  @Test
  void invalidValuesAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> PgloConfig.fromMap(Map.of("bufferSize", "0"), Map.of()));
    assertThrows(IllegalArgumentException.class,
        () -> PgloConfig.fromMap(Map.of("timeoutMs", "soon"), Map.of()));
    IllegalArgumentException missing = assertThrows(IllegalArgumentException.class,
        () -> PgloConfig.fromMap(Map.of(), Map.of()).requireJdbcUrl());
    assertTrue(missing.getMessage().contains("PGLO_JDBC_URL"));
  }

  @Test
  void toStringRedactsPassword() {
    PgloConfig config = PgloConfig.fromMap(
        Map.of("url", "jdbc:postgresql://db/app?password=hunter2", "password", "hunter2"), Map.of());

    assertFalse(config.toString().contains("hunter2"));
  }
}
