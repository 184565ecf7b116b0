package ca.gc.cra.pglo.infrastructure.memory;

import ca.gc.cra.pglo.application.lob.Deadline;
import ca.gc.cra.pglo.application.lob.DeadlineBackend;
import ca.gc.cra.pglo.application.port.ClockPort;
import ca.gc.cra.pglo.application.port.TransactionPort;
import ca.gc.cra.pglo.application.port.TransactionalWork;
import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Process-local large-object store with transactional scopes.
 * <p><strong>Why:</strong> Exercises handles, adapters and use cases without a PostgreSQL server, and serves local
 * development.</p>
 * <p><strong>Scopes:</strong> Each {@link #inTransaction(Duration, TransactionalWork)} call works on a snapshot;
 * returning normally publishes the snapshot, throwing discards it. Scopes are serialized, and object ids are never
 * reused even when the scope that allocated them rolls back.</p>
 *
 * @since PGLO 0.1-doc
 */
public final class InMemoryLargeObjectStore implements TransactionPort {
  private static final Logger log = LoggerFactory.getLogger(InMemoryLargeObjectStore.class);
  /** First id handed out, matching PostgreSQL's first user oid. */
  public static final long FIRST_OBJECT_ID = 16_384L;

  private final ClockPort clock;
  private final ReentrantLock lock = new ReentrantLock();
  private final AtomicLong nextId = new AtomicLong(FIRST_OBJECT_ID);
  private Map<Long, ObjectData> committed = new HashMap<>();

  /** Creates an empty store on the system clock. */
  public InMemoryLargeObjectStore() {
    this(ClockPort.SYSTEM);
  }

  /**
   * Creates an empty store.
   *
   * @param clock time source for scope deadlines
   */
  public InMemoryLargeObjectStore(ClockPort clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public <T> T inTransaction(Duration timeout, TransactionalWork<T> work) throws IOException {
    Objects.requireNonNull(work, "work");
    Deadline deadline = Deadline.after(timeout, clock);
    lock.lock();
    try {
      InMemoryLargeObjectBackend scope = new InMemoryLargeObjectBackend(this, committed);
      try {
        T result = work.execute(new DeadlineBackend(scope, deadline));
        committed = scope.objects();
        return result;
      } catch (IOException | RuntimeException ex) {
        log.debug("Discarding in-memory scope after {}", ex.toString());
        throw ex;
      } finally {
        scope.end();
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Reports whether {@code objectId} exists in committed state.
   *
   * @param objectId object id
   * @return {@code true} if committed
   */
  public boolean exists(long objectId) {
    lock.lock();
    try {
      return committed.containsKey(objectId);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Copies the committed contents of {@code objectId}.
   *
   * @param objectId object id
   * @return contents, or empty when the object does not exist
   */
  public Optional<byte[]> contents(long objectId) {
    lock.lock();
    try {
      ObjectData data = committed.get(objectId);
      return data == null ? Optional.empty() : Optional.of(data.toByteArray());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Counts committed objects.
   *
   * @return number of objects
   */
  public int size() {
    lock.lock();
    try {
      return committed.size();
    } finally {
      lock.unlock();
    }
  }

  long allocateId() {
    return nextId.getAndIncrement();
  }
}
