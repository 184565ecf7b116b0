package ca.gc.cra.pglo.api;

import ca.gc.cra.pglo.application.port.MetricsPort;
import ca.gc.cra.pglo.config.PgloConfig;
import ca.gc.cra.pglo.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.pglo.logging.Logs;
import ca.gc.cra.pglo.logging.LoggingConfigurator;
import ca.gc.cra.pglo.validation.Numbers;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code pglo remove}: deletes a large object.
 *
 * @since PGLO 0.1-doc
 */
public final class RemoveCli {
  private static final Logger log = LoggerFactory.getLogger(RemoveCli.class);
  private static final String SUMMARY_USAGE =
      "usage: remove oid=N [url=JDBC_URL] [user=NAME] [password=SECRET] [timeoutMs=MS] [config=FILE] [--dry-run]";
  private static final String HELP_TEXT = """
      pglo remove

      Usage:
        remove oid=N [options]

      Deletes large object N and all of its data.

      Options:
        oid=N               Object id to delete (required)
        url=JDBC_URL        jdbc:postgresql://HOST/DB, or mem: for the in-process store (env PGLO_JDBC_URL)
        user=NAME           Login role (env PGLO_USER)
        password=SECRET     Password (env PGLO_PASSWORD)
        timeoutMs=MS        Timeout, 0 for none (default 60000)
        config=FILE         YAML file with common/remove sections
        --dry-run           Validate and print the plan without connecting
        --verbose           Enable DEBUG logging
        --help              Show this message

      Exit status 6 means the object does not exist.
      """;

  private RemoveCli() {}

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
      log.debug("Verbose logging enabled for remove CLI");
    }

    Map<String, String> effective;
    try {
      effective = CommandSupport.effectiveConfig("remove", CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid remove configuration: {}", ex.getMessage());
      CliPrinter.usage(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    PgloConfig config;
    TelemetrySettings telemetry;
    long objectId;
    try {
      config = PgloConfig.fromMap(effective);
      config.requireJdbcUrl();
      telemetry = TelemetryConfigurator.settings(effective);
      objectId = Numbers.parseLong("oid", ConfigCliUtils.require(effective, "oid"));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid remove arguments: {}", ex.getMessage());
      CliPrinter.usage(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (input.hasFlag("--dry-run")) {
      Map<String, Object> rows = new LinkedHashMap<>();
      rows.put("Object id", objectId);
      rows.put("Database", Logs.redactUrl(config.jdbcUrl()));
      CliPrinter.dryRun("remove", "deleted", rows);
      return ExitCode.SUCCESS;
    }

    MetricsPort metrics = CommandSupport.openMetrics(telemetry);
    try {
      CommandSupport.root(config, metrics).repository().removeLargeObject(objectId);
      log.info("Removed large object {}", objectId);
      return ExitCode.SUCCESS;
    } catch (IOException | RuntimeException ex) {
      return CommandSupport.failure("remove", ex);
    } finally {
      CommandSupport.closeMetrics(metrics);
    }
  }
}
