package ca.gc.cra.pglo.infrastructure.memory;

import java.util.Arrays;

/** Growable byte buffer holding one object's contents. */
final class ObjectData {
  /** Largest length a heap-backed object can reach. */
  static final long CAPACITY = Integer.MAX_VALUE - 8L;

  private byte[] bytes;
  private int length;

  ObjectData() {
    this(new byte[0], 0);
  }

  private ObjectData(byte[] bytes, int length) {
    this.bytes = bytes;
    this.length = length;
  }

  ObjectData copy() {
    return new ObjectData(Arrays.copyOf(bytes, length), length);
  }

  int length() {
    return length;
  }

  byte[] read(long position, int max) {
    if (position >= length) {
      return new byte[0];
    }
    int from = (int) position;
    int count = Math.min(max, length - from);
    return Arrays.copyOfRange(bytes, from, from + count);
  }

  void write(long position, byte[] data) {
    if (data.length == 0) {
      return;
    }
    long end = position + data.length;
    ensureLength(end);
    System.arraycopy(data, 0, bytes, (int) position, data.length);
  }

  void resize(long size) {
    if (size < length) {
      Arrays.fill(bytes, (int) size, length, (byte) 0);
      length = (int) size;
    } else {
      ensureLength(size);
    }
  }

  byte[] toByteArray() {
    return Arrays.copyOf(bytes, length);
  }

  private void ensureLength(long size) {
    if (size > CAPACITY) {
      throw new IllegalArgumentException("in-memory objects are limited to 2 GiB (requested " + size + ")");
    }
    if (size > bytes.length) {
      int capacity = (int) Math.min(CAPACITY, Math.max(size, bytes.length * 2L));
      bytes = Arrays.copyOf(bytes, capacity);
    }
    // Bytes between the old length and size are already zero: truncation clears them.
    if (size > length) {
      length = (int) size;
    }
  }
}
