package ca.gc.cra.pglo.api;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CliPrinterTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void dryRunAlignsLabelsInInsertionOrder() {
    Map<String, Object> rows = new LinkedHashMap<>();
    rows.put("Object id", 16384L);
    rows.put("Allow overwrite", false);

    CliPrinter.dryRun("export", "written", rows);

    assertEquals(String.join(System.lineSeparator(),
        "Export dry-run: nothing will be written.",
        " Object id       : 16384",
        " Allow overwrite : false",
        " Re-run without --dry-run to export.",
        ""), buffer.toString());
  }

  @Test
  void objectIdIsPrintedAlone() {
    CliPrinter.objectId(16385L);

    assertEquals("16385" + System.lineSeparator(), buffer.toString());
  }

  @Test
  void usageDropsTrailingBlankLines() {
    CliPrinter.usage("usage: remove oid=N\n\n");
    CliPrinter.usage(null);

    assertEquals("usage: remove oid=N" + System.lineSeparator(), buffer.toString());
  }
}
