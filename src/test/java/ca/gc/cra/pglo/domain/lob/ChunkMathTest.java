package ca.gc.cra.pglo.domain.lob;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class ChunkMathTest {

  @Test
  void chunkCountRoundsUp() {
    assertEquals(0, ChunkMath.chunkCount(0, 4));
    assertEquals(1, ChunkMath.chunkCount(4, 4));
    assertEquals(3, ChunkMath.chunkCount(10, 4));
  }

  @Test
  void guardsRejectProgrammerErrors() {
    assertThrows(IllegalArgumentException.class, () -> ChunkMath.requireObjectId(0));
    assertThrows(IllegalArgumentException.class, () -> ChunkMath.requireBufferSize(0));
    assertThrows(IllegalArgumentException.class, () -> ChunkMath.requireNonNegative("length", -1));
    assertThrows(IllegalArgumentException.class, () -> ChunkMath.chunkCount(-1, 4));
  }
}
