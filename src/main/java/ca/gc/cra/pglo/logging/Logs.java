package ca.gc.cra.pglo.logging;

import java.util.regex.Pattern;

/**
 * Formatting helpers that keep secrets out of log lines.
 *
 * @since PGLO 0.1-doc
 */
public final class Logs {
  private static final String REDACTED = "[REDACTED]";
  private static final Pattern URL_PASSWORD = Pattern.compile("(?i)(password=)[^&;]*");

  private Logs() {
    // Utility
  }

  /**
   * Masks a secret.
   *
   * @param value secret, possibly {@code null}
   * @return {@code <none>} when absent, otherwise a fixed placeholder
   */
  public static String redact(String value) {
    return value == null || value.isEmpty() ? "<none>" : REDACTED;
  }

  /**
   * Masks {@code password=} parameters embedded in a JDBC URL.
   *
   * @param jdbcUrl URL, possibly {@code null}
   * @return URL safe to log
   */
  public static String redactUrl(String jdbcUrl) {
    if (jdbcUrl == null) {
      return "<none>";
    }
    return URL_PASSWORD.matcher(jdbcUrl).replaceAll("$1" + REDACTED);
  }
}
