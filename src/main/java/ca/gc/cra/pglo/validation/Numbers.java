package ca.gc.cra.pglo.validation;

/**
 * Numeric range guards shared by configuration and CLI parsing.
 *
 * @since PGLO 0.1-doc
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Ensures {@code min <= value <= max}.
   *
   * @param name label used in error messages
   * @param value candidate
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value}
   * @throws IllegalArgumentException when out of range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal long, naming the offending key on failure.
   *
   * @param name label used in error messages
   * @param raw text to parse
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not a number
   */
  public static long parseLong(String name, String raw) {
    String text = Strings.requireNonBlank(name, raw);
    try {
      return Long.parseLong(text);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be a whole number (was '" + text + "')", ex);
    }
  }
}
