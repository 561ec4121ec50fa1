package com.booking.codec;

import java.util.Arrays;
import java.util.Objects;

/**
 * An extension value the caller already encoded: a tag plus either the encoded {@code data} or a
 * {@code value} the driver can encode itself.
 */
public final class RawExt {
  private final long tag;
  private final byte[] data;
  private final Object value;

  public RawExt(long tag, byte[] data) {
    this(tag, data, null);
  }

  public RawExt(long tag, byte[] data, Object value) {
    this.tag = tag;
    this.data = data;
    this.value = value;
  }

  public long tag() {
    return tag;
  }

  /** Encoded form, may be {@code null}. */
  public byte[] data() {
    return data;
  }

  /** Value to encode when there is no {@link #data()}, may be {@code null}. */
  public Object value() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof RawExt)) {
      return false;
    }
    RawExt other = (RawExt) o;
    return tag == other.tag && Arrays.equals(data, other.data) && Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(tag, Arrays.hashCode(data), value);
  }
}
