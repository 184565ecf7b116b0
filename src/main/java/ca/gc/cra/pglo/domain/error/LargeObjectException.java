package ca.gc.cra.pglo.domain.error;

import java.io.IOException;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> Base checked failure for every large object operation.
 * <p><strong>Why:</strong> Each primitive either succeeds or raises exactly one typed failure carrying the object id
 * and/or descriptor that caused it.</p>
 * <p><strong>Role:</strong> Domain error propagated unchanged through handles, stream adapters and use cases.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction (aside from suppressed exceptions).</p>
 *
 * @implNote Extends {@link IOException} so handles work with {@code try-with-resources}, {@code java.io} streams and
 * {@link java.io.UncheckedIOException}.
 * @since PGLO 0.1-doc
 */
public class LargeObjectException extends IOException {
  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;
  private final Long objectId;
  private final Integer descriptor;

  /**
   * Creates a failure of the given kind.
   *
   * @param kind failure classification; must not be {@code null}
   * @param message human readable description
   * @param objectId object id involved, or {@code null} when unknown
   * @param descriptor descriptor involved, or {@code null} when unknown
   * @param cause underlying failure, may be {@code null}
   */
  public LargeObjectException(
      ErrorKind kind, String message, Long objectId, Integer descriptor, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.objectId = objectId;
    this.descriptor = descriptor;
  }

  /**
   * Returns the failure classification.
   *
   * @return error kind; never {@code null}
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the object id that caused the failure, when known.
   *
   * @return object id or empty
   */
  public OptionalLong objectId() {
    return objectId == null ? OptionalLong.empty() : OptionalLong.of(objectId);
  }

  /**
   * Returns the descriptor that caused the failure, when known.
   *
   * @return descriptor or empty
   */
  public OptionalInt descriptor() {
    return descriptor == null ? OptionalInt.empty() : OptionalInt.of(descriptor);
  }
}
