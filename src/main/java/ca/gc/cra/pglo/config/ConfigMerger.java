package ca.gc.cra.pglo.config;

import ca.gc.cra.pglo.validation.Numbers;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Layers defaults, YAML and CLI settings with precedence CLI &gt; YAML &gt; defaults, then validates the result.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective settings for one command.
   *
   * @param mode command name
   * @param yaml flattened YAML settings; may be empty
   * @param cli CLI {@code key=value} settings; may be empty
   * @param defaults defaults for the command
   * @param warn receives a message whenever a CLI value replaces a YAML value
   * @return immutable merged map
   * @throws IllegalArgumentException when a merged value is invalid
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Map<String, String> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> yamlCopy = yaml == null ? Map.of() : yaml;
    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    if (cli != null) {
      for (Map.Entry<String, String> entry : cli.entrySet()) {
        if (entry.getKey() == null || entry.getValue() == null) {
          continue;
        }
        if (yamlCopy.containsKey(entry.getKey()) && warn != null) {
          warn.accept("CLI overrides YAML for key: " + entry.getKey());
        }
        merged.put(entry.getKey(), entry.getValue());
      }
    }
    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    // Range checks only; connection settings may still come from the environment.
    PgloConfig.fromMap(effective, Map.of());
    String oid = effective.get("oid");
    if (oid != null && !oid.isBlank()) {
      Numbers.requireRange("oid", Numbers.parseLong("oid", oid), 1, 0xFFFF_FFFFL);
    }
  }
}
