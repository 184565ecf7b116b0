package ca.gc.cra.pglo.api;

import java.util.Map;

final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config=} (or {@code --config=}) argument so it is not merged as a setting.
   *
   * @param args mutable CLI map
   * @return trimmed path, or {@code null} if absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String path = null;
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        path = value.trim();
      }
    }
    return path;
  }

  /**
   * Returns a required, non-blank setting.
   *
   * @param effective merged settings
   * @param key setting name
   * @return trimmed value
   * @throws IllegalArgumentException when missing or blank
   */
  static String require(Map<String, String> effective, String key) {
    String value = effective.get(key);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(key + " is required");
    }
    return value.trim();
  }
}
