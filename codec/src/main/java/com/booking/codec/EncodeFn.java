package com.booking.codec;

/** Encodes a value of the type described by {@code info}. */
@FunctionalInterface
interface EncodeFn {
  void encode(Encoder encoder, CodecFnInfo info, Object value);
}
