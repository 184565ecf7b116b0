package ca.gc.cra.pglo.application.lob;

import ca.gc.cra.pglo.domain.lob.ChunkMath;
import ca.gc.cra.pglo.domain.lob.LargeObjectFlags;
import ca.gc.cra.pglo.domain.lob.OpenMode;
import java.util.Objects;

/**
 * Mode and chunk size used when creating or opening a {@link LargeObject}.
 *
 * @param mode access mode; must not be {@code null}
 * @param bufferSize chunk size for streaming reads; must be positive
 * @since PGLO 0.1-doc
 */
public record OpenOptions(OpenMode mode, int bufferSize) {

  /**
   * Validates the options.
   *
   * @throws IllegalArgumentException if {@code bufferSize} is not positive
   */
  public OpenOptions {
    Objects.requireNonNull(mode, "mode");
    ChunkMath.requireBufferSize(bufferSize);
  }

  /**
   * Defaults for {@link LargeObject#create}: read/write with a 1 MiB buffer.
   *
   * @return create defaults
   */
  public static OpenOptions forCreate() {
    return new OpenOptions(OpenMode.READ_WRITE, LargeObjectFlags.DEFAULT_BUFFER_SIZE);
  }

  /**
   * Defaults for {@link LargeObject#open}: read-only with a 1 MiB buffer.
   *
   * @return open defaults
   */
  public static OpenOptions forOpen() {
    return new OpenOptions(OpenMode.READ, LargeObjectFlags.DEFAULT_BUFFER_SIZE);
  }

  /**
   * Returns a copy with a different mode.
   *
   * @param newMode replacement mode
   * @return updated options
   */
  public OpenOptions withMode(OpenMode newMode) {
    return new OpenOptions(newMode, bufferSize);
  }

  /**
   * Returns a copy with a different chunk size.
   *
   * @param newBufferSize replacement chunk size
   * @return updated options
   */
  public OpenOptions withBufferSize(int newBufferSize) {
    return new OpenOptions(mode, newBufferSize);
  }
}
