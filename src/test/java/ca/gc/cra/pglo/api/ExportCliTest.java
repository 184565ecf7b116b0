package ca.gc.cra.pglo.api;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pglo.application.pipeline.ImportUseCase;
import ca.gc.cra.pglo.application.pipeline.TransferOptions;
import ca.gc.cra.pglo.application.port.ClockPort;
import ca.gc.cra.pglo.infrastructure.memory.InMemoryLargeObjectStore;
import ca.gc.cra.pglo.testutil.RecordingMetricsPort;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ExportCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;
  private StringWriter buffer;
  private InMemoryLargeObjectStore store;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(ExportCli.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    logger.setLevel(Level.INFO);
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
  void exportWritesObjectToFile() throws IOException {
    long objectId = seed("exported contents");
    Path out = tempDir.resolve("out.txt");

    ExitCode code = ExportCli.run(new String[] {"oid=" + objectId, "out=" + out, "url=mem:", "bufferSize=3"});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals("exported contents", Files.readString(out, UTF_8));
    assertTrue(appender.list.stream().anyMatch(event -> event.getFormattedMessage().startsWith("Wrote 17 bytes")));
    assertNoPartialFiles();
  }

  @Test
  void existingFileNeedsAllowOverwrite() throws IOException {
    long objectId = seed("new");
    Path out = Files.writeString(tempDir.resolve("existing.txt"), "old");

    ExitCode refused = ExportCli.run(new String[] {"oid=" + objectId, "out=" + out, "url=mem:"});
    assertEquals(ExitCode.INVALID_ARGS, refused);
    assertTrue(buffer.toString().contains("usage: export"));
    assertEquals("old", Files.readString(out, UTF_8));

    ExitCode replaced = ExportCli.run(new String[] {"oid=" + objectId, "out=" + out, "url=mem:", "--allow-overwrite"});
    assertEquals(ExitCode.SUCCESS, replaced);
    assertEquals("new", Files.readString(out, UTF_8));
  }

  @Test
  void missingObjectReturnsNotFoundAndLeavesNoFile() throws IOException {
    Path out = tempDir.resolve("missing.bin");

    ExitCode code = ExportCli.run(new String[] {"oid=424242", "out=" + out, "url=mem:"});

    assertEquals(ExitCode.NOT_FOUND, code);
    assertFalse(Files.exists(out));
    assertNoPartialFiles();
  }

  @Test
  void invalidObjectIdIsRejected() {
    ExitCode code = ExportCli.run(new String[] {"oid=abc", "out=" + tempDir.resolve("x.bin"), "url=mem:"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    boolean logged = appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("Invalid export configuration"));
    assertTrue(logged, "Expected oid validation error to be logged");
  }

  @Test
  void dryRunDoesNotCreateFile() {
    Path out = tempDir.resolve("plan.bin");

    ExitCode code = ExportCli.run(new String[] {"oid=16384", "out=" + out, "url=mem:", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Export dry-run"));
    assertFalse(Files.exists(out));
  }

  private long seed(String text) throws IOException {
    return new ImportUseCase(store, new RecordingMetricsPort(), ClockPort.SYSTEM)
        .importBytes(text.getBytes(UTF_8), TransferOptions.defaults());
  }

  private void assertNoPartialFiles() throws IOException {
    try (Stream<Path> files = Files.list(tempDir)) {
      assertTrue(files.noneMatch(path -> path.getFileName().toString().endsWith(".part")));
    }
  }
}
