package ca.gc.cra.pglo.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void parsesKeyValuePairsAndKeepsLastDuplicate() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"oid=1", " out = a.bin ", "oid=2"});

    assertEquals("2", map.get("oid"));
    assertEquals("a.bin", map.get("out"));
  }

  @Test
  void valueMayContainEquals() {
    assertEquals("jdbc:postgresql://db/app?ssl=true",
        CliArgsParser.toMap(new String[] {"url=jdbc:postgresql://db/app?ssl=true"}).get("url"));
  }

  @Test
  void rejectsMalformedTokens() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"oid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=5"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"o id=5"}));
  }

  @Test
  void cliInputSeparatesFlags() {
    CliInput input = CliInput.parse(new String[] {"oid=1", "--Dry-Run", "-v", "-h"});

    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.verbose());
    assertTrue(input.help());
    assertFalse(input.hasFlag("--allow-overwrite"));
    assertEquals(1, input.keyValueArgs().length);
  }
}
