package com.booking.codec;

import java.io.IOException;

/**
 * A type that marshals itself to a JSON document. The bytes are written verbatim, so this is only
 * meaningful for drivers producing JSON.
 */
public interface JsonMarshaler {
  byte[] marshalJson() throws IOException;
}
