package ca.gc.cra.pglo.infrastructure.memory;

import ca.gc.cra.pglo.application.port.LargeObjectBackend;
import ca.gc.cra.pglo.domain.error.BackendFailureException;
import ca.gc.cra.pglo.domain.error.InvalidOffsetException;
import ca.gc.cra.pglo.domain.error.LargeObjectException;
import ca.gc.cra.pglo.domain.error.ObjectAlreadyExistsException;
import ca.gc.cra.pglo.domain.error.ObjectNotFoundException;
import ca.gc.cra.pglo.domain.error.ReadOnlyObjectException;
import ca.gc.cra.pglo.domain.lob.LargeObjectFlags;
import ca.gc.cra.pglo.domain.lob.SeekAnchor;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * <strong>What:</strong> Scope-bound backend working on a private copy of an {@link InMemoryLargeObjectStore}.
 * <p><strong>Semantics:</strong> Follows the PostgreSQL server functions: descriptors are numbered from 0 per
 * scope; writes on a descriptor opened without {@code INV_WRITE} fail with {@code READ_ONLY}; seeking before byte 0
 * fails with {@code INVALID_OFFSET}; extending through write or resize zero-fills; any descriptor whose object was
 * unlinked, and every descriptor once the scope ended, fails with {@code NOT_FOUND}.</p>
 * <p><strong>Copy-on-write:</strong> Committed objects are shared until first modified in this scope.</p>
 * <p><strong>Thread-safety:</strong> Confined to the thread running the scope.</p>
 *
 * @since PGLO 0.1-doc
 */
public final class InMemoryLargeObjectBackend implements LargeObjectBackend {
  static final long MAX_OBJECT_SIZE = 4L * 1024 * 1024 * 1024 * 1024;

  private final InMemoryLargeObjectStore store;
  private final Map<Long, ObjectData> objects;
  private final Set<Long> owned = new HashSet<>();
  private final Map<Integer, Descriptor> descriptors = new HashMap<>();
  private int nextDescriptor;
  private boolean ended;

  InMemoryLargeObjectBackend(InMemoryLargeObjectStore store, Map<Long, ObjectData> snapshot) {
    this.store = store;
    this.objects = new HashMap<>(snapshot);
  }

  @Override
  public long create(long desiredId) throws LargeObjectException {
    ensureActive();
    if (desiredId < 0) {
      throw new IllegalArgumentException("desiredId must not be negative");
    }
    long objectId;
    if (desiredId == 0) {
      do {
        objectId = store.allocateId();
      } while (objects.containsKey(objectId));
    } else {
      if (objects.containsKey(desiredId)) {
        throw new ObjectAlreadyExistsException("large object " + desiredId + " already exists", desiredId, null);
      }
      objectId = desiredId;
    }
    objects.put(objectId, new ObjectData());
    owned.add(objectId);
    return objectId;
  }

  @Override
  public void unlink(long objectId) throws LargeObjectException {
    ensureActive();
    if (objects.remove(objectId) == null) {
      throw new ObjectNotFoundException("large object " + objectId + " does not exist", objectId, null);
    }
    owned.remove(objectId);
  }

  @Override
  public int open(long objectId, int flags) throws LargeObjectException {
    ensureActive();
    if ((flags & (LargeObjectFlags.INV_READ | LargeObjectFlags.INV_WRITE)) == 0) {
      throw new BackendFailureException("invalid flags for opening a large object: " + flags, objectId, null);
    }
    if (!objects.containsKey(objectId)) {
      throw new ObjectNotFoundException("large object " + objectId + " does not exist", objectId, null);
    }
    int descriptor = nextDescriptor++;
    descriptors.put(descriptor, new Descriptor(objectId, LargeObjectFlags.writable(flags)));
    return descriptor;
  }

  @Override
  public void close(int descriptor) throws LargeObjectException {
    ensureActive();
    lookup(descriptor);
    descriptors.remove(descriptor);
  }

  @Override
  public void write(int descriptor, byte[] data) throws LargeObjectException {
    Descriptor d = writable(descriptor);
    if (d.position + data.length > MAX_OBJECT_SIZE) {
      throw new InvalidOffsetException("write would exceed the maximum object size", d.objectId, descriptor);
    }
    if (data.length > 0 && d.position + data.length > ObjectData.CAPACITY) {
      throw beyondCapacity(d.position + data.length, d.objectId, descriptor);
    }
    mutable(d.objectId).write(d.position, data);
    d.position += data.length;
  }

  @Override
  public byte[] read(int descriptor, int length) throws LargeObjectException {
    if (length < 0) {
      throw new IllegalArgumentException("length must not be negative");
    }
    Descriptor d = lookup(descriptor);
    byte[] data = objects.get(d.objectId).read(d.position, length);
    d.position += data.length;
    return data;
  }

  @Override
  public long seek(int descriptor, long offset, SeekAnchor anchor) throws LargeObjectException {
    Descriptor d = lookup(descriptor);
    long base;
    switch (anchor) {
      case START:
        base = 0L;
        break;
      case CURRENT:
        base = d.position;
        break;
      default:
        base = objects.get(d.objectId).length();
        break;
    }
    long target = base + offset;
    if (target < 0 || target > MAX_OBJECT_SIZE) {
      throw new InvalidOffsetException("invalid seek offset: " + target, d.objectId, descriptor);
    }
    d.position = target;
    return target;
  }

  @Override
  public long tell(int descriptor) throws LargeObjectException {
    return lookup(descriptor).position;
  }

  @Override
  public void resize(int descriptor, long size) throws LargeObjectException {
    Descriptor d = writable(descriptor);
    if (size < 0 || size > MAX_OBJECT_SIZE) {
      throw new BackendFailureException("invalid large object truncation target: " + size, d.objectId, descriptor);
    }
    if (size > ObjectData.CAPACITY) {
      throw beyondCapacity(size, d.objectId, descriptor);
    }
    mutable(d.objectId).resize(size);
  }

  private static BackendFailureException beyondCapacity(long length, long objectId, int descriptor) {
    return new BackendFailureException(
        "in-memory objects are limited to " + ObjectData.CAPACITY + " bytes (requested " + length + ")",
        objectId, descriptor);
  }

  Map<Long, ObjectData> objects() {
    return objects;
  }

  void end() {
    ended = true;
    descriptors.clear();
  }

  private Descriptor lookup(int descriptor) throws LargeObjectException {
    ensureActive();
    Descriptor d = descriptors.get(descriptor);
    if (d == null) {
      throw new ObjectNotFoundException("invalid large-object descriptor: " + descriptor, null, descriptor);
    }
    if (!objects.containsKey(d.objectId)) {
      throw new ObjectNotFoundException(
          "large object " + d.objectId + " was removed", d.objectId, descriptor);
    }
    return d;
  }

  private Descriptor writable(int descriptor) throws LargeObjectException {
    Descriptor d = lookup(descriptor);
    if (!d.writable) {
      throw new ReadOnlyObjectException(
          "large object descriptor " + descriptor + " was not opened for writing", d.objectId, descriptor);
    }
    return d;
  }

  private ObjectData mutable(long objectId) {
    if (owned.add(objectId)) {
      objects.put(objectId, objects.get(objectId).copy());
    }
    return objects.get(objectId);
  }

  private void ensureActive() throws ObjectNotFoundException {
    if (ended) {
      throw new ObjectNotFoundException("scope has ended; descriptors are no longer valid", null, null);
    }
  }

  private static final class Descriptor {
    private final long objectId;
    private final boolean writable;
    private long position;

    private Descriptor(long objectId, boolean writable) {
      this.objectId = objectId;
      this.writable = writable;
    }
  }
}
