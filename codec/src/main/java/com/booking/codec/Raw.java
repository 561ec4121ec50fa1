package com.booking.codec;

import java.util.Arrays;
import java.util.Objects;

/**
 * Already encoded bytes, written to the output verbatim when {@link EncoderOptions#raw()} is enabled.
 */
public final class Raw {
  private final byte[] bytes;

  public Raw(byte[] bytes) {
    this.bytes = Objects.requireNonNull(bytes, "bytes");
  }

  public byte[] bytes() {
    return bytes;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Raw && Arrays.equals(bytes, ((Raw) o).bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }
}
