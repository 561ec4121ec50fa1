package com.booking.codec;

/**
 * A type that encodes itself by driving the {@link Encoder} directly.
 * <p>
 * Takes precedence over every other way of encoding the type. Implementations typically call
 * {@link Encoder#mustEncode(Object)} for their parts; those nested calls do not end the document.
 */
public interface Selfer {
  void codecEncodeSelf(Encoder encoder);
}
