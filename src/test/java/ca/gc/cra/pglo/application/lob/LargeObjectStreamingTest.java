package ca.gc.cra.pglo.application.lob;

import static java.nio.charset.StandardCharsets.US_ASCII;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pglo.domain.lob.OpenMode;
import ca.gc.cra.pglo.infrastructure.memory.InMemoryLargeObjectStore;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LargeObjectStreamingTest {
  private InMemoryLargeObjectStore store;
  private long objectId;

  @BeforeEach
  void setUp() throws IOException {
    store = new InMemoryLargeObjectStore();
    objectId = store.inTransaction(backend -> {
      LargeObject lob = LargeObject.create(backend);
      lob.write("abcdefghij".getBytes(US_ASCII));
      lob.close();
      return lob.objectId();
    });
  }

  @Test
  void readerYieldsBufferSizedChunksThenClosesHandle() throws IOException {
    store.inTransaction(backend -> {
      LargeObject lob = LargeObject.open(backend, objectId, OpenOptions.forOpen().withBufferSize(4));
      LargeObjectReader reader = lob.reader();
      assertEquals("abcd", new String(reader.next(), US_ASCII));
      assertEquals("efgh", new String(reader.next(), US_ASCII));
      assertEquals("ij", new String(reader.next(), US_ASCII));
      assertNull(reader.next());
      assertTrue(lob.isClosed());
      assertNull(reader.next());
      return null;
    });
  }

  @Test
  void readerStreamIsSinglePass() throws IOException {
    store.inTransaction(backend -> {
      LargeObject lob = LargeObject.open(backend, objectId, OpenOptions.forOpen().withBufferSize(3));
      LargeObjectReader reader = lob.reader();
      List<String> chunks;
      try (Stream<byte[]> stream = reader.stream()) {
        chunks = stream.map(chunk -> new String(chunk, US_ASCII)).collect(Collectors.toList());
      }
      assertEquals(List.of("abc", "def", "ghi", "j"), chunks);
      assertTrue(lob.isClosed());
      assertThrows(IllegalStateException.class, reader::stream);
      return null;
    });
  }

  @Test
  void closingReaderEarlyClosesHandle() throws IOException {
    store.inTransaction(backend -> {
      LargeObject lob = LargeObject.open(backend, objectId, OpenOptions.forOpen().withBufferSize(2));
      LargeObjectReader reader = lob.reader();
      reader.next();
      reader.close();
      assertTrue(lob.isClosed());
      assertNull(reader.next());
      return null;
    });
  }

  @Test
  void writerAppendsChunksAndClosesOnComplete() throws IOException {
    store.inTransaction(backend -> {
      LargeObject lob = LargeObject.open(backend, objectId, OpenOptions.forOpen().withMode(OpenMode.APPEND));
      LargeObjectWriter writer = lob.writer();
      writer.accept("12".getBytes(US_ASCII));
      writer.accept(new byte[0]);
      writer.accept("345".getBytes(US_ASCII));
      writer.complete();
      assertTrue(lob.isClosed());
      assertThrows(IllegalStateException.class, () -> writer.accept(new byte[] {1}));
      return null;
    });

    assertEquals("abcdefghij12345", new String(store.contents(objectId).orElseThrow(), US_ASCII));
  }

  @Test
  void chunksSupportIndexAndSlice() throws IOException {
    store.inTransaction(backend -> {
      LargeObject lob = LargeObject.open(backend, objectId, OpenOptions.forOpen().withBufferSize(3));
      LargeObjectChunks chunks = lob.chunks();
      assertEquals(4, chunks.count());
      assertEquals("ghi", new String(chunks.get(2), US_ASCII));
      assertEquals("j", new String(chunks.get(3), US_ASCII));
      assertEquals(0, chunks.get(4).length);
      List<String> odd = chunks.slice(1, 3, 2).stream()
          .map(chunk -> new String(chunk, US_ASCII))
          .collect(Collectors.toList());
      assertEquals(List.of("def", "j"), odd);
      assertEquals(2, chunks.slice(0, 2).size());
      assertThrows(IllegalArgumentException.class, () -> chunks.slice(0, 2, 0));
      lob.close();
      return null;
    });
  }

  @Test
  void streamsReadAndWriteThroughHandle() throws IOException {
    store.inTransaction(backend -> {
      LargeObject lob = LargeObject.open(backend, objectId, OpenOptions.forOpen().withMode(OpenMode.READ_WRITE));
      try (OutputStream out = lob.outputStream()) {
        out.write('A');
        out.write("BC".getBytes(US_ASCII));
      }
      assertTrue(lob.isClosed());
      return null;
    });

    byte[] read = store.inTransaction(backend -> {
      LargeObject lob = LargeObject.open(backend, objectId);
      ByteArrayOutputStream copy = new ByteArrayOutputStream();
      try (InputStream in = lob.inputStream()) {
        assertEquals('A', in.read());
        in.transferTo(copy);
        assertEquals(-1, in.read());
      }
      return copy.toByteArray();
    });

    assertArrayEquals("BCdefghij".getBytes(US_ASCII), read);
  }
}
