package ca.gc.cra.pglo.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits raw arguments into {@code key=value} pairs and {@code --flags}.
 *
 * <p>{@code --help}, {@code -h} and {@code help} request help; {@code --verbose}, {@code -v} and {@code --debug}
 * request DEBUG logging. Other dash-prefixed tokens without {@code =} are kept as lower-case flags.</p>
 *
 * @since PGLO 0.1-doc
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final List<String> keyValueArgs;
  private final Set<String> flags;

  private CliInput(List<String> keyValueArgs, Set<String> flags) {
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
  }

  /**
   * Parses {@code args}; {@code null} entries and blanks are skipped.
   *
   * @param args raw arguments, possibly {@code null}
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        if (raw == null || raw.isBlank()) {
          continue;
        }
        String arg = raw.trim();
        String lower = arg.toLowerCase(Locale.ROOT);
        if (HELP_FLAGS.contains(lower)) {
          flags.add("--help");
        } else if (VERBOSE_FLAGS.contains(lower)) {
          flags.add("--verbose");
        } else if (arg.startsWith("-") && !arg.contains("=")) {
          flags.add(lower);
        } else {
          kv.add(arg);
        }
      }
    }
    return new CliInput(List.copyOf(kv), Set.copyOf(flags));
  }

  public String[] keyValueArgs() {
    return keyValueArgs.toArray(String[]::new);
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks for a flag, ignoring case.
   *
   * @param flag flag including its dashes, e.g. {@code --dry-run}
   * @return {@code true} if present
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }
}
