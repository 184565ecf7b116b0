package ca.gc.cra.pglo.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

/**
 * Console output for the {@code pglo} subcommands.
 *
 * <p>Standard output carries only what a caller may script against: usage text, the object id returned by
 * {@code import}, and dry-run summaries. Diagnostics go to standard error through Logback. The writer wraps the
 * native stdout descriptor so redirecting {@code System.out} in a logging setup does not capture command results.</p>
 *
 * @since PGLO 0.1-doc
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints usage or help text without its trailing blank lines.
   *
   * @param text usage block; ignored when {@code null}
   */
  public static void usage(String text) {
    if (text == null) {
      return;
    }
    PrintWriter writer = writer();
    writer.println(text.stripTrailing());
    writer.flush();
  }

  /**
   * Prints a large-object id on its own line, the only output of a successful {@code import}.
   *
   * @param objectId id assigned by the backend
   */
  public static void objectId(long objectId) {
    PrintWriter writer = writer();
    writer.println(objectId);
    writer.flush();
  }

  /**
   * Prints what a subcommand would do, one aligned {@code label : value} row per entry.
   *
   * @param subcommand subcommand name, e.g. {@code import}
   * @param effect what is skipped, e.g. {@code written} or {@code deleted}
   * @param rows labels to values in display order
   */
  public static void dryRun(String subcommand, String effect, Map<String, ?> rows) {
    int width = 0;
    for (String label : rows.keySet()) {
      width = Math.max(width, label.length());
    }
    PrintWriter writer = writer();
    writer.println(capitalize(subcommand) + " dry-run: nothing will be " + effect + ".");
    for (Map.Entry<String, ?> row : rows.entrySet()) {
      writer.println(" " + pad(row.getKey(), width) + " : " + row.getValue());
    }
    writer.println(" Re-run without --dry-run to " + subcommand + ".");
    writer.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }

  private static String pad(String label, int width) {
    StringBuilder sb = new StringBuilder(width).append(label);
    while (sb.length() < width) {
      sb.append(' ');
    }
    return sb.toString();
  }

  private static String capitalize(String word) {
    if (word.isEmpty()) {
      return word;
    }
    return word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1);
  }
}
