package ca.gc.cra.pglo.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Flattened defaults for each command, the lowest layer under YAML and CLI values.
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns common defaults merged with the defaults of {@code mode}.
   *
   * @param mode {@code import}, {@code export} or {@code remove}
   * @return unmodifiable map
   * @throws IllegalArgumentException for an unknown mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    switch (mode.trim().toLowerCase(Locale.ROOT)) {
      case "import" -> defaults.put("in", "");
      case "export" -> {
        defaults.put("oid", "");
        defaults.put("out", "");
      }
      case "remove" -> defaults.put("oid", "");
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    }
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    PgloConfig defaults = PgloConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("url", "");
    map.put("user", "");
    map.put("password", "");
    map.put("bufferSize", Integer.toString(defaults.bufferSize()));
    map.put("timeoutMs", Long.toString(defaults.timeout().toMillis()));
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    return Map.copyOf(map);
  }
}
