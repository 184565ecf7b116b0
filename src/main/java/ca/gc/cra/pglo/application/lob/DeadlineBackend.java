package ca.gc.cra.pglo.application.lob;

import ca.gc.cra.pglo.application.port.LargeObjectBackend;
import ca.gc.cra.pglo.domain.error.LargeObjectException;
import ca.gc.cra.pglo.domain.lob.SeekAnchor;
import java.util.Objects;

/**
 * Backend decorator refusing further primitive calls once the scope deadline has passed.
 *
 * <p>The timeout covers the whole import or export; a transfer that runs out of time fails between chunks with
 * {@link ca.gc.cra.pglo.domain.error.ScopeTimeoutException}, which makes the enclosing scope roll back.</p>
 *
 * @since PGLO 0.1-doc
 */
public final class DeadlineBackend implements LargeObjectBackend {
  private final LargeObjectBackend delegate;
  private final Deadline deadline;

  /**
   * Wraps a scope-bound backend.
   *
   * @param delegate backend bound to the scope
   * @param deadline deadline of the scope
   */
  public DeadlineBackend(LargeObjectBackend delegate, Deadline deadline) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.deadline = Objects.requireNonNull(deadline, "deadline");
  }

  @Override
  public long create(long desiredId) throws LargeObjectException {
    deadline.check("lo_create");
    return delegate.create(desiredId);
  }

  @Override
  public void unlink(long objectId) throws LargeObjectException {
    deadline.check("lo_unlink");
    delegate.unlink(objectId);
  }

  @Override
  public int open(long objectId, int flags) throws LargeObjectException {
    deadline.check("lo_open");
    return delegate.open(objectId, flags);
  }

  @Override
  public void close(int descriptor) throws LargeObjectException {
    // Releasing a descriptor stays allowed after expiry.
    delegate.close(descriptor);
  }

  @Override
  public void write(int descriptor, byte[] data) throws LargeObjectException {
    deadline.check("lowrite");
    delegate.write(descriptor, data);
  }

  @Override
  public byte[] read(int descriptor, int length) throws LargeObjectException {
    deadline.check("loread");
    return delegate.read(descriptor, length);
  }

  @Override
  public long seek(int descriptor, long offset, SeekAnchor anchor) throws LargeObjectException {
    deadline.check("lo_lseek64");
    return delegate.seek(descriptor, offset, anchor);
  }

  @Override
  public long tell(int descriptor) throws LargeObjectException {
    deadline.check("lo_tell64");
    return delegate.tell(descriptor);
  }

  @Override
  public void resize(int descriptor, long size) throws LargeObjectException {
    deadline.check("lo_truncate64");
    delegate.resize(descriptor, size);
  }
}
