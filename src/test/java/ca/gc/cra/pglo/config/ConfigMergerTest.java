package ca.gc.cra.pglo.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlOverridesDefaults() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        "export",
        Map.of("bufferSize", "8192", "oid", "16384"),
        Map.of("oid", "16385"),
        DefaultsForMode.asFlatMap("export"),
        warnings::add);

    assertEquals("8192", effective.get("bufferSize"));
    assertEquals("16385", effective.get("oid"));
    assertEquals("60000", effective.get("timeoutMs"));
    assertEquals(List.of("CLI overrides YAML for key: oid"), warnings);
  }

  @Test
  void invalidMergedValuesAreRejected() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("remove");

    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig("remove", Map.of(), Map.of("oid", "0"), defaults, null));
    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig("remove", Map.of(), Map.of("oid", "4294967296"), defaults, null));
    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig("remove", Map.of("bufferSize", "-1"), Map.of(), defaults, null));
  }
}
