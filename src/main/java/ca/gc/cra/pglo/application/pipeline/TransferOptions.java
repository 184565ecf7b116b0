package ca.gc.cra.pglo.application.pipeline;

import ca.gc.cra.pglo.domain.lob.ChunkMath;
import ca.gc.cra.pglo.domain.lob.LargeObjectFlags;
import java.time.Duration;

/**
 * Chunk size and whole-call timeout for import and export.
 *
 * @param bufferSize bytes per backend call; must be positive
 * @param timeout deadline for the entire transfer; {@code null} disables it
 * @since PGLO 0.1-doc
 */
public record TransferOptions(int bufferSize, Duration timeout) {
  /** Default whole-call timeout. */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

  /**
   * Validates the options.
   *
   * @throws IllegalArgumentException if {@code bufferSize} is not positive or {@code timeout} is negative
   */
  public TransferOptions {
    ChunkMath.requireBufferSize(bufferSize);
    if (timeout != null && timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must not be negative");
    }
  }

  /**
   * 64 KiB chunks, 60 second timeout.
   *
   * @return default options
   */
  public static TransferOptions defaults() {
    return new TransferOptions(LargeObjectFlags.DEFAULT_TRANSFER_BUFFER_SIZE, DEFAULT_TIMEOUT);
  }

  /**
   * Returns a copy with a different chunk size.
   *
   * @param newBufferSize replacement chunk size
   * @return updated options
   */
  public TransferOptions withBufferSize(int newBufferSize) {
    return new TransferOptions(newBufferSize, timeout);
  }

  /**
   * Returns a copy with a different timeout.
   *
   * @param newTimeout replacement timeout, {@code null} for none
   * @return updated options
   */
  public TransferOptions withTimeout(Duration newTimeout) {
    return new TransferOptions(bufferSize, newTimeout);
  }
}
