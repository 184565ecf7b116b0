package ca.gc.cra.pglo.api;

import ca.gc.cra.pglo.application.port.MetricsPort;
import ca.gc.cra.pglo.config.PgloConfig;
import ca.gc.cra.pglo.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.pglo.logging.Logs;
import ca.gc.cra.pglo.logging.LoggingConfigurator;
import ca.gc.cra.pglo.validation.Numbers;
import ca.gc.cra.pglo.validation.Paths;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code pglo export}: writes a large object to a file.
 *
 * <p>The object is streamed into a temporary file beside the target, which is moved into place only after the
 * export succeeded, so a failed export never leaves a truncated file behind.</p>
 *
 * @since PGLO 0.1-doc
 */
public final class ExportCli {
  private static final Logger log = LoggerFactory.getLogger(ExportCli.class);
  private static final String SUMMARY_USAGE =
      "usage: export oid=N out=FILE [url=JDBC_URL] [user=NAME] [password=SECRET] [bufferSize=BYTES] "
          + "[timeoutMs=MS] [config=FILE] [--allow-overwrite] [--dry-run]";
  private static final String HELP_TEXT = """
      pglo export

      Usage:
        export oid=N out=FILE [options]

      Streams large object N into FILE.

      Options:
        oid=N               Object id to export (required)
        out=FILE            Destination file (required)
        url=JDBC_URL        jdbc:postgresql://HOST/DB, or mem: for the in-process store (env PGLO_JDBC_URL)
        user=NAME           Login role (env PGLO_USER)
        password=SECRET     Password (env PGLO_PASSWORD)
        bufferSize=BYTES    Bytes per loread call, 1..67108864 (default 65536)
        timeoutMs=MS        Whole-export timeout, 0 for none (default 60000)
        config=FILE         YAML file with common/export sections
        metricsExporter=otlp|none  Metrics export (default none)
        --allow-overwrite   Replace FILE if it exists
        --dry-run           Validate and print the plan without connecting
        --verbose           Enable DEBUG logging
        --help              Show this message

      Exit status 6 means the object does not exist.
      """;

  private ExportCli() {}

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
      log.debug("Verbose logging enabled for export CLI");
    }
    boolean allowOverwrite = input.hasFlag("--allow-overwrite");

    Map<String, String> effective;
    try {
      effective = CommandSupport.effectiveConfig("export", CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid export configuration: {}", ex.getMessage());
      CliPrinter.usage(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    PgloConfig config;
    TelemetrySettings telemetry;
    long objectId;
    Path out;
    try {
      config = PgloConfig.fromMap(effective);
      config.requireJdbcUrl();
      telemetry = TelemetryConfigurator.settings(effective);
      objectId = Numbers.parseLong("oid", ConfigCliUtils.require(effective, "oid"));
      out = Paths.requireWritableFile(Path.of(ConfigCliUtils.require(effective, "out")), allowOverwrite);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid export arguments: {}", ex.getMessage());
      CliPrinter.usage(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (input.hasFlag("--dry-run")) {
      Map<String, Object> rows = new LinkedHashMap<>();
      rows.put("Object id", objectId);
      rows.put("Output", out);
      rows.put("Database", Logs.redactUrl(config.jdbcUrl()));
      rows.put("Buffer size", config.bufferSize());
      rows.put("Allow overwrite", allowOverwrite);
      CliPrinter.dryRun("export", "written", rows);
      return ExitCode.SUCCESS;
    }

    MetricsPort metrics = CommandSupport.openMetrics(telemetry);
    Path partial = null;
    try {
      partial = Files.createTempFile(out.getParent(), "." + out.getFileName(), ".part");
      long bytes;
      try (OutputStream stream = Files.newOutputStream(partial)) {
        bytes = CommandSupport.root(config, metrics)
            .exportUseCase()
            .exportTo(objectId, stream, config.transferOptions());
      }
      if (allowOverwrite) {
        Files.move(partial, out, StandardCopyOption.REPLACE_EXISTING);
      } else {
        Files.move(partial, out);
      }
      log.info("Wrote {} bytes of large object {} to {}", bytes, objectId, out);
      return ExitCode.SUCCESS;
    } catch (IOException | RuntimeException ex) {
      discard(partial, ex);
      return CommandSupport.failure("export", ex);
    } finally {
      CommandSupport.closeMetrics(metrics);
    }
  }

  private static void discard(Path partial, Exception primary) {
    if (partial == null) {
      return;
    }
    try {
      Files.deleteIfExists(partial);
    } catch (IOException ex) {
      primary.addSuppressed(ex);
      log.warn("Unable to delete partial export {}", partial, ex);
    }
  }
}
