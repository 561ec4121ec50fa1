package com.booking.codec;

/**
 * How the declared field names of a struct are written as map keys. The numeric types parse the name, so
 * {@code @CodecField("12")} with {@link #INT} writes the integer 12.
 */
public enum KeyType {
  STRING, INT, UINT, FLOAT
}
