package ca.gc.cra.pglo.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pglo.domain.error.BackendFailureException;
import ca.gc.cra.pglo.domain.error.ObjectNotFoundException;
import ca.gc.cra.pglo.domain.error.ReadOnlyObjectException;
import ca.gc.cra.pglo.domain.error.ScopeTimeoutException;
import ca.gc.cra.pglo.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.pglo.infrastructure.metrics.TelemetrySettings;
import java.io.IOException;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CommandSupportTest {

  @Test
  void failuresMapToExitCodes() {
    assertEquals(ExitCode.NOT_FOUND,
        CommandSupport.failure("export", new ObjectNotFoundException("gone", 1L, null)));
    assertEquals(ExitCode.TIMEOUT,
        CommandSupport.failure("export", new ScopeTimeoutException("late", null, null)));
    assertEquals(ExitCode.IO_ERROR,
        CommandSupport.failure("import", new ReadOnlyObjectException("ro", 1L, 0)));
    assertEquals(ExitCode.IO_ERROR,
        CommandSupport.failure("import", new BackendFailureException("down", null, null)));
    assertEquals(ExitCode.IO_ERROR, CommandSupport.failure("import", new IOException("disk")));
    assertEquals(ExitCode.CONFIG_ERROR, CommandSupport.failure("import", new IllegalArgumentException("bad")));
    assertEquals(ExitCode.RUNTIME_FAILURE, CommandSupport.failure("import", new IllegalStateException("bug")));
  }

  @Test
  void disabledExporterUsesNoOpMetrics() {
    assertTrue(CommandSupport.openMetrics(TelemetrySettings.disabled()) instanceof NoOpMetricsAdapter);
  }

  @Test
  void telemetrySettingsAreValidated() {
    TelemetrySettings settings = TelemetryConfigurator.settings(
        Map.of("metricsExporter", "OTLP", "otelEndpoint", "https://collector:4317"));
    assertEquals("otlp", settings.exporter());
    assertEquals("https://collector:4317", settings.endpoint());

    assertEquals("none", TelemetryConfigurator.settings(Map.of()).exporter());
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.settings(Map.of("metricsExporter", "prometheus")));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.settings(Map.of("otelEndpoint", "ftp://collector")));
  }
}
