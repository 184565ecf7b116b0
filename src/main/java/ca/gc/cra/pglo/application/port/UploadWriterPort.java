package ca.gc.cra.pglo.application.port;

import java.io.IOException;
import java.util.Map;

/**
 * <strong>What:</strong> Push-based writer driven by an external upload pipeline.
 * <p><strong>Why:</strong> Upload frameworks deliver chunks over time without a long-lived transaction spanning the
 * upload; the writer threads its own state between calls.</p>
 * <p><strong>Role:</strong> Inbound port implemented by
 * {@link ca.gc.cra.pglo.application.pipeline.LargeObjectUploadWriter}.</p>
 * <p><strong>Thread-safety:</strong> Calls for one upload arrive sequentially.</p>
 *
 * @param <S> writer state threaded through the lifecycle
 * @since PGLO 0.1-doc
 */
public interface UploadWriterPort<S> {
  /** Why an upload ended. */
  enum CloseReason {
    /** All chunks were delivered. */
    DONE,
    /** The client cancelled the upload. */
    CANCELLED,
    /** The upload pipeline failed. */
    FAILED
  }

  /**
   * Starts an upload.
   *
   * @return initial state
   * @throws IOException if the upload target cannot be prepared
   */
  S init() throws IOException;

  /**
   * Metadata exposed to the upload consumer once the upload completes.
   *
   * @param state current state
   * @return metadata entries
   */
  Map<String, Object> meta(S state);

  /**
   * Writes one chunk.
   *
   * @param data chunk bytes
   * @param state current state
   * @return next state
   * @throws IOException if the chunk cannot be stored
   */
  S writeChunk(byte[] data, S state) throws IOException;

  /**
   * Ends the upload.
   *
   * @param state current state
   * @param reason why the upload ended
   * @return final state
   * @throws IOException if finishing fails
   */
  S close(S state, CloseReason reason) throws IOException;
}
