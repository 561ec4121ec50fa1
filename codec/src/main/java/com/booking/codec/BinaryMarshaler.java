package com.booking.codec;

import java.io.IOException;

/** A type that marshals itself to opaque bytes, encoded as a raw byte string. */
public interface BinaryMarshaler {
  byte[] marshalBinary() throws IOException;
}
