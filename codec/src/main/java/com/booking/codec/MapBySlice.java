package com.booking.codec;

/**
 * Marks a {@link java.util.Collection} (or {@link Channel}) holding alternating keys and values, which is
 * encoded as a map. An odd number of elements fails with
 * {@link CodecException.ErrorKind#MALFORMED_FLATTENED_SEQUENCE}.
 */
public interface MapBySlice {
}
