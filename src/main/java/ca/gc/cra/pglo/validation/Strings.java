package ca.gc.cra.pglo.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * String guards for CLI input and SQL identifiers.
 *
 * @since PGLO 0.1-doc
 */
public final class Strings {
  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*(\\.[A-Za-z_][A-Za-z0-9_$]*)?");

  private Strings() {
    // Utility
  }

  /**
   * Trims {@code value} and rejects blanks and control characters.
   *
   * @param name label used in error messages
   * @param value candidate
   * @return trimmed value
   * @throws IllegalArgumentException if blank or containing control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, label(name));
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException(label(name) + " must not contain control characters");
      }
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    return trimmed;
  }

  /**
   * Accepts an unquoted SQL identifier, optionally schema-qualified ({@code schema.table}).
   *
   * @param name label used in error messages
   * @param value candidate identifier
   * @return the identifier, trimmed
   * @throws IllegalArgumentException if {@code value} is not a plain identifier
   */
  public static String requireSqlIdentifier(String name, String value) {
    String trimmed = requireNonBlank(name, value);
    if (!IDENTIFIER.matcher(trimmed).matches()) {
      throw new IllegalArgumentException(label(name) + " must be a plain SQL identifier (was '" + trimmed + "')");
    }
    return trimmed;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
