package ca.gc.cra.pglo.api;

import ca.gc.cra.pglo.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command dispatcher for {@code pglo <import|export|remove>}.
 *
 * @since PGLO 0.1-doc
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: pglo <import|export|remove> [options]";
  private static final String HELP_TEXT = """
      pglo: PostgreSQL large-object transfer

      Usage:
        pglo <command> [options]

      Commands:
        import   Stream a file into a new large object and print its id
        export   Stream a large object into a file
        remove   Delete a large object

      Run pglo <command> --help for command options.

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandIndex = firstCommandIndex(safeArgs);
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(safeArgs);
      if (input.help()) {
        CliPrinter.usage(HELP_TEXT);
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.usage(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    CliInput global = CliInput.parse(Arrays.copyOfRange(safeArgs, 0, commandIndex));
    if (global.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(safeArgs, commandIndex + 1, safeArgs.length);
    return switch (command) {
      case "import" -> ImportCli.run(delegateArgs);
      case "export" -> ExportCli.run(delegateArgs);
      case "remove" -> RemoveCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.usage(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static int firstCommandIndex(String[] args) {
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (arg != null && !arg.isBlank() && !arg.trim().startsWith("-") && !arg.contains("=")
          && !"help".equalsIgnoreCase(arg.trim())) {
        return i;
      }
    }
    return -1;
  }
}
