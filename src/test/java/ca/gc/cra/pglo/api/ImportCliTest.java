package ca.gc.cra.pglo.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pglo.infrastructure.memory.InMemoryLargeObjectStore;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ImportCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;
  private StringWriter buffer;
  private InMemoryLargeObjectStore store;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(ImportCli.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    store = new InMemoryLargeObjectStore();
    CommandSupport.setTransactionsForTesting(store);
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
      appender.stop();
      logger.setAdditive(originalAdditive);
      logger.setLevel(originalLevel);
    }
    CliPrinter.clearTestWriter();
    CommandSupport.clearTestTransactions();
  }

  @Test
  void importPrintsNewObjectId() throws IOException {
    byte[] payload = new byte[200_000];
    for (int i = 0; i < payload.length; i++) {
      payload[i] = (byte) i;
    }
    Path in = Files.write(tempDir.resolve("payload.bin"), payload);

    ExitCode code = ImportCli.run(new String[] {"in=" + in, "url=mem:", "bufferSize=4096"});

    assertEquals(ExitCode.SUCCESS, code);
    long objectId = Long.parseLong(buffer.toString().trim());
    assertArrayEquals(payload, store.contents(objectId).orElseThrow());
  }

  @Test
  void missingInputReturnsUsageAndInvalidArgs() {
    ExitCode code = ImportCli.run(new String[] {"url=mem:"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: import"));
    boolean logged = appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("Invalid import arguments")
            && event.getFormattedMessage().contains("in is required"));
    assertTrue(logged, "Expected validation error to be logged");
  }

  @Test
  void outOfRangeBufferSizeIsRejected() throws IOException {
    Path in = Files.writeString(tempDir.resolve("small.txt"), "x");

    ExitCode code = ImportCli.run(new String[] {"in=" + in, "url=mem:", "bufferSize=0"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertEquals(0, store.size());
  }

  @Test
  void dryRunPrintsPlanWithoutImporting() throws IOException {
    Path in = Files.writeString(tempDir.resolve("plan.txt"), "hello");

    ExitCode code = ImportCli.run(new String[] {
        "in=" + in, "url=jdbc:postgresql://db/app?password=hunter2", "timeoutMs=0", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("Import dry-run"));
    assertTrue(output.contains("Timeout     : none"));
    assertFalse(output.contains("hunter2"));
    assertEquals(0, store.size());
  }

  @Test
  void yamlConfigSuppliesSettings() throws IOException {
    Path in = Files.writeString(tempDir.resolve("data.txt"), "from yaml");
    Path yaml = tempDir.resolve("pglo.yaml");
    Files.writeString(yaml, """
        common:
          url: "mem:"
        import:
          in: %s
        """.formatted(in));

    ExitCode code = ImportCli.run(new String[] {"config=" + yaml});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(1, store.size());
  }

  @Test
  void missingConfigFileIsConfigError() {
    ExitCode code = ImportCli.run(new String[] {"config=" + tempDir.resolve("absent.yaml")});

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void helpPrintsOptions() {
    assertEquals(ExitCode.SUCCESS, ImportCli.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("in=FILE"));
  }
}
