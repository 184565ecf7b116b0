package ca.gc.cra.pglo.api;

import ca.gc.cra.pglo.application.port.MetricsPort;
import ca.gc.cra.pglo.config.PgloConfig;
import ca.gc.cra.pglo.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.pglo.logging.Logs;
import ca.gc.cra.pglo.logging.LoggingConfigurator;
import ca.gc.cra.pglo.validation.Paths;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code pglo import}: streams a file into a new large object and prints its id.
 *
 * @since PGLO 0.1-doc
 */
public final class ImportCli {
  private static final Logger log = LoggerFactory.getLogger(ImportCli.class);
  private static final String SUMMARY_USAGE =
      "usage: import in=FILE [url=JDBC_URL] [user=NAME] [password=SECRET] [bufferSize=BYTES] [timeoutMs=MS] "
          + "[config=FILE] [--dry-run]";
  private static final String HELP_TEXT = """
      pglo import

      Usage:
        import in=FILE [options]

      Streams FILE into a new large object in one transaction and prints the new object id.

      Options:
        in=FILE             File to import (required)
        url=JDBC_URL        jdbc:postgresql://HOST/DB, or mem: for the in-process store (env PGLO_JDBC_URL)
        user=NAME           Login role (env PGLO_USER)
        password=SECRET     Password (env PGLO_PASSWORD)
        bufferSize=BYTES    Bytes per lowrite call, 1..67108864 (default 65536)
        timeoutMs=MS        Whole-import timeout, 0 for none (default 60000)
        config=FILE         YAML file with common/import sections
        metricsExporter=otlp|none  Metrics export (default none)
        --dry-run           Validate and print the plan without connecting
        --verbose           Enable DEBUG logging
        --help              Show this message
      """;

  private ImportCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.usage(HELP_TEXT);
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for import CLI");
    }

    Map<String, String> effective;
    try {
      effective = CommandSupport.effectiveConfig("import", CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid import configuration: {}", ex.getMessage());
      CliPrinter.usage(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    PgloConfig config;
    TelemetrySettings telemetry;
    Path in;
    try {
      config = PgloConfig.fromMap(effective);
      config.requireJdbcUrl();
      telemetry = TelemetryConfigurator.settings(effective);
      in = Paths.requireReadableFile(Path.of(ConfigCliUtils.require(effective, "in")));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid import arguments: {}", ex.getMessage());
      CliPrinter.usage(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (input.hasFlag("--dry-run")) {
      Map<String, Object> rows = new LinkedHashMap<>();
      rows.put("Input", in);
      rows.put("Database", Logs.redactUrl(config.jdbcUrl()));
      rows.put("Buffer size", config.bufferSize());
      rows.put("Timeout", config.timeout() == null ? "none" : config.timeout().toMillis() + " ms");
      CliPrinter.dryRun("import", "written", rows);
      return ExitCode.SUCCESS;
    }

    MetricsPort metrics = CommandSupport.openMetrics(telemetry);
    try (InputStream stream = Files.newInputStream(in)) {
      long objectId = CommandSupport.root(config, metrics)
          .importUseCase()
          .importFrom(stream, config.transferOptions());
      CliPrinter.objectId(objectId);
      return ExitCode.SUCCESS;
    } catch (IOException | RuntimeException ex) {
      return CommandSupport.failure("import", ex);
    } finally {
      CommandSupport.closeMetrics(metrics);
    }
  }
}
