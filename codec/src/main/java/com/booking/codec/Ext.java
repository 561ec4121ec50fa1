package com.booking.codec;

/**
 * Extension encoding registered for a type on a {@link Handle}, see {@link Handle#setExt(Class, long, Ext)}.
 */
public interface Ext {
  /** Bytes written under the extension tag, for formats with native extension support. */
  byte[] writeExt(Object value);

  /**
   * A substitute value encoded in place of {@code value}, for formats without native extensions.
   * Defaults to the {@link #writeExt(Object)} bytes.
   */
  default Object convertExt(Object value) {
    return writeExt(value);
  }
}
