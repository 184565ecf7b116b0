package ca.gc.cra.pglo.api;

import ca.gc.cra.pglo.application.port.ClockPort;
import ca.gc.cra.pglo.application.port.MetricsPort;
import ca.gc.cra.pglo.application.port.TransactionPort;
import ca.gc.cra.pglo.config.CompositionRoot;
import ca.gc.cra.pglo.config.ConfigMerger;
import ca.gc.cra.pglo.config.DefaultsForMode;
import ca.gc.cra.pglo.config.PgloConfig;
import ca.gc.cra.pglo.config.YamlConfigLoader;
import ca.gc.cra.pglo.domain.error.LargeObjectException;
import ca.gc.cra.pglo.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.pglo.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.pglo.infrastructure.metrics.TelemetrySettings;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Steps shared by the import, export and remove commands: configuration layering, metrics lifecycle, wiring and
 * failure-to-exit-code mapping.
 */
final class CommandSupport {
  private static final Logger log = LoggerFactory.getLogger(CommandSupport.class);
  private static volatile TransactionPort transactionsOverride;

  private CommandSupport() {}

  /**
   * Merges defaults, the optional {@code config=} YAML file and CLI arguments.
   *
   * @param mode command name
   * @param cliArgs parsed CLI arguments; not modified
   * @return effective settings
   * @throws IOException if the YAML file cannot be read
   * @throws IllegalArgumentException if the YAML or a merged value is invalid
   */
  static Map<String, String> effectiveConfig(String mode, Map<String, String> cliArgs) throws IOException {
    Map<String, String> cli = new LinkedHashMap<>(cliArgs);
    String configPath = ConfigCliUtils.extractConfigPath(cli);
    Map<String, String> yaml = configPath == null ? Map.of() : YamlConfigLoader.load(Path.of(configPath), mode);
    return ConfigMerger.buildEffectiveConfig(mode, yaml, cli, DefaultsForMode.asFlatMap(mode), log::warn);
  }

  static MetricsPort openMetrics(TelemetrySettings settings) {
    if ("none".equals(settings.exporter())) {
      return new NoOpMetricsAdapter();
    }
    return new OpenTelemetryMetricsAdapter(settings);
  }

  static void closeMetrics(MetricsPort metrics) {
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.forceFlush();
      otel.close();
    }
  }

  static CompositionRoot root(PgloConfig config, MetricsPort metrics) {
    return new CompositionRoot(config, metrics, ClockPort.SYSTEM, transactionsOverride);
  }

  static ExitCode failure(String command, Exception ex) {
    if (ex instanceof LargeObjectException lob) {
      switch (lob.kind()) {
        case NOT_FOUND:
          log.error("{} failed: {}", command, lob.getMessage());
          return ExitCode.NOT_FOUND;
        case TIMEOUT:
          log.error("{} timed out; nothing was committed: {}", command, lob.getMessage());
          return ExitCode.TIMEOUT;
        default:
          log.error("{} failed ({})", command, lob.kind(), lob);
          return ExitCode.IO_ERROR;
      }
    }
    if (ex instanceof IOException) {
      log.error("{} I/O failure", command, ex);
      return ExitCode.IO_ERROR;
    }
    if (ex instanceof IllegalArgumentException) {
      log.error("{} configuration error: {}", command, ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    }
    log.error("Unexpected failure in {}", command, ex);
    return ExitCode.RUNTIME_FAILURE;
  }

  static void setTransactionsForTesting(TransactionPort transactions) {
    transactionsOverride = transactions;
  }

  static void clearTestTransactions() {
    transactionsOverride = null;
  }
}
