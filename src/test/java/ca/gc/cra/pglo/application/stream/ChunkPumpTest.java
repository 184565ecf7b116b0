package ca.gc.cra.pglo.application.stream;

import static java.nio.charset.StandardCharsets.US_ASCII;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pglo.application.port.ChunkSink;
import ca.gc.cra.pglo.application.port.ChunkSource;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ChunkPumpTest {

  @Test
  void drainsByteArrayInBoundedChunks() throws IOException {
    ByteArrayChunkSink sink = new ByteArrayChunkSink();
    long moved = ChunkPump.drain(new ByteArrayChunkSource("abcdefg".getBytes(US_ASCII), 3), sink);

    assertEquals(7, moved);
    assertEquals("abcdefg", new String(sink.toByteArray(), US_ASCII));
  }

  @Test
  void emptySourceCompletesSinkWithoutChunks() throws IOException {
    RecordingSink sink = new RecordingSink();
    assertEquals(0, ChunkPump.drain(new ByteArrayChunkSource(new byte[0], 8), sink));
    assertTrue(sink.completed);
    assertTrue(sink.chunks.isEmpty());
  }

  @Test
  void iterableSourceSkipsEmptyChunks() throws IOException {
    RecordingSink sink = new RecordingSink();
    ChunkPump.drain(new IterableChunkSource(List.of(new byte[] {1}, new byte[0], new byte[] {2, 3})), sink);

    assertEquals(2, sink.chunks.size());
    assertArrayEquals(new byte[] {2, 3}, sink.chunks.get(1));
  }

  @Test
  void inputStreamSourceIsClosedAfterDrain() throws IOException {
    TrackingInputStream in = new TrackingInputStream(new byte[10]);
    ByteArrayOutputStream out = new ByteArrayOutputStream();

    assertEquals(10, ChunkPump.drain(new InputStreamChunkSource(in, 4), new OutputStreamChunkSink(out)));
    assertTrue(in.closed);
    assertEquals(10, out.size());
  }

  @Test
  void sinkFailureAbortsSinkAndClosesSource() {
    IOException boom = new IOException("sink failed");
    RecordingSink sink = new RecordingSink();
    sink.failOn = 2;
    TrackingSource source = new TrackingSource(new ByteArrayChunkSource(new byte[9], 3));

    IOException ex = assertThrows(IOException.class, () -> ChunkPump.drain(source, sink.failingWith(boom)));

    assertSame(boom, ex);
    assertSame(boom, sink.abortCause);
    assertFalse(sink.completed);
    assertTrue(source.closed);
  }

  @Test
  void closeFailureAfterSourceFailureIsSuppressed() {
    ChunkSource source = new ChunkSource() {
      @Override
      public byte[] next() throws IOException {
        throw new IOException("read failed");
      }

      @Override
      public void close() throws IOException {
        throw new IOException("close failed");
      }
    };

    IOException ex = assertThrows(IOException.class, () -> ChunkPump.drain(source, new RecordingSink()));

    assertEquals("read failed", ex.getMessage());
    assertEquals("close failed", ex.getSuppressed()[0].getMessage());
  }

  private static final class RecordingSink implements ChunkSink {
    private final List<byte[]> chunks = new ArrayList<>();
    private boolean completed;
    private Throwable abortCause;
    private int failOn = -1;
    private IOException failure;

    RecordingSink failingWith(IOException failure) {
      this.failure = failure;
      return this;
    }

    @Override
    public void accept(byte[] chunk) throws IOException {
      if (chunks.size() + 1 == failOn) {
        throw failure;
      }
      chunks.add(chunk);
    }

    @Override
    public void complete() {
      completed = true;
    }

    @Override
    public void abort(Throwable cause) {
      abortCause = cause;
    }
  }

  private static final class TrackingSource implements ChunkSource {
    private final ChunkSource delegate;
    private boolean closed;

    TrackingSource(ChunkSource delegate) {
      this.delegate = delegate;
    }

    @Override
    public byte[] next() throws IOException {
      return delegate.next();
    }

    @Override
    public void close() throws IOException {
      closed = true;
      delegate.close();
    }
  }

  private static final class TrackingInputStream extends ByteArrayInputStream {
    private boolean closed;

    TrackingInputStream(byte[] data) {
      super(data);
    }

    @Override
    public void close() throws IOException {
      closed = true;
      super.close();
    }
  }
}
