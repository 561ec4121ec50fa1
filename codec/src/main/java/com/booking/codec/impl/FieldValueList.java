package com.booking.codec.impl;

import java.util.ArrayDeque;
import java.util.Arrays;

/**
 * Pool of scratch arrays holding (field, value) pairs while a struct is encoded. Not thread safe: each
 * encoder owns one. Nested structs take further arrays from the pool.
 */
public final class FieldValueList {
  private static final int MIN_PAIRS = 16;

  private final ArrayDeque<Object[]> free = new ArrayDeque<>();

  /** An array with room for at least {@code pairs} pairs, field at even and value at odd index. */
  public Object[] get(int pairs) {
    Object[] array = free.poll();
    if (array == null || array.length < pairs * 2) {
      array = new Object[Math.max(pairs, MIN_PAIRS) * 2];
    }
    return array;
  }

  public void put(Object[] array) {
    Arrays.fill(array, null);
    free.push(array);
  }
}
