package com.booking.codec;

import java.util.Arrays;

/**
 * A growable byte buffer exposing its backing array.
 * <p>
 * Only the first {@link #length} bytes of {@link #array} are meaningful.
 */
public class ByteArray {
  // largest array size the VMs reliably allocate
  static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

  public byte[] array;
  public int length;

  public ByteArray(int capacity) {
    this(new byte[capacity], 0);
  }

  public ByteArray(byte[] array, int length) {
    this.array = array;
    this.length = length;
  }

  /** Make room for {@code required} more bytes past {@link #length}. */
  public void ensureAvailable(int required) {
    long total = (long) required + length;

    if (total > array.length) {
      array = Arrays.copyOf(array, grownCapacity(total));
    }
  }

  static int grownCapacity(long required) {
    if (required > MAX_CAPACITY) {
      throw new OutOfMemoryError("Required buffer size " + required + " exceeds " + MAX_CAPACITY);
    }
    return (int) Math.min(Math.max(required * 3 / 2, 16), MAX_CAPACITY);
  }

  public void append(byte value) {
    ensureAvailable(1);
    array[length++] = value;
  }

  public void append(byte[] data, int offset, int count) {
    ensureAvailable(count);
    System.arraycopy(data, offset, array, length, count);
    length += count;
  }

  public void clear() {
    length = 0;
  }

  /** Get a copy of the used part of the buffer. */
  public byte[] toByteArray() {
    return Arrays.copyOf(array, length);
  }
}
