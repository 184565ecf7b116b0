package ca.gc.cra.pglo.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void commonDefaultsPresentForEveryMode() {
    for (String mode : new String[] {"import", "export", "remove"}) {
      Map<String, String> defaults = DefaultsForMode.asFlatMap(mode);
      assertEquals("65536", defaults.get("bufferSize"));
      assertEquals("60000", defaults.get("timeoutMs"));
      assertEquals("none", defaults.get("metricsExporter"));
    }
  }

  @Test
  void modeSpecificKeys() {
    assertTrue(DefaultsForMode.asFlatMap("import").containsKey("in"));
    assertTrue(DefaultsForMode.asFlatMap("EXPORT").containsKey("out"));
    assertFalse(DefaultsForMode.asFlatMap("remove").containsKey("out"));
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("vacuum"));
  }
}
