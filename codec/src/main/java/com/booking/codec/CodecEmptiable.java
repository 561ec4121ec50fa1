package com.booking.codec;

/** A type deciding on its own whether it counts as empty for omit-empty fields. */
public interface CodecEmptiable {
  boolean isCodecEmpty();
}
