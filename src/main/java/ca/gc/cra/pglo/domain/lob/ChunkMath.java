package ca.gc.cra.pglo.domain.lob;

/**
 * Arithmetic and argument guards shared by handles and stream adapters.
 *
 * @since PGLO 0.1-doc
 */
public final class ChunkMath {
  private ChunkMath() {
    // Utility
  }

  /**
   * Number of {@code bufferSize} chunks needed to cover {@code size} bytes.
   *
   * @param size object size in bytes; must be non-negative
   * @param bufferSize chunk size; must be positive
   * @return {@code ceil(size / bufferSize)}
   */
  public static long chunkCount(long size, int bufferSize) {
    requireNonNegative("size", size);
    requireBufferSize(bufferSize);
    return size / bufferSize + (size % bufferSize == 0 ? 0 : 1);
  }

  /**
   * Validates an object id.
   *
   * @param objectId candidate id
   * @return the id
   * @throws IllegalArgumentException if the id is not positive
   */
  public static long requireObjectId(long objectId) {
    if (objectId <= 0) {
      throw new IllegalArgumentException("objectId must be positive (was " + objectId + ")");
    }
    return objectId;
  }

  /**
   * Validates a chunk size.
   *
   * @param bufferSize candidate size
   * @return the size
   * @throws IllegalArgumentException if the size is not positive
   */
  public static int requireBufferSize(int bufferSize) {
    if (bufferSize <= 0) {
      throw new IllegalArgumentException("bufferSize must be positive (was " + bufferSize + ")");
    }
    return bufferSize;
  }

  /**
   * Validates a length, size or position.
   *
   * @param name parameter name for diagnostics
   * @param value candidate value
   * @return the value
   * @throws IllegalArgumentException if the value is negative
   */
  public static long requireNonNegative(String name, long value) {
    if (value < 0) {
      throw new IllegalArgumentException(name + " must not be negative (was " + value + ")");
    }
    return value;
  }
}
