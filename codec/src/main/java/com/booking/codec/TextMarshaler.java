package com.booking.codec;

import java.io.IOException;

/** A type that marshals itself to text, encoded as a string. */
public interface TextMarshaler {
  String marshalText() throws IOException;
}
