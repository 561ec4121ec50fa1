package com.booking.codec;

import java.io.OutputStream;

/**
 * Output sink of an {@link Encoder}. Drivers write the encoded form through it.
 * <p>
 * Implementations report I/O failures as {@link java.io.UncheckedIOException}.
 */
public interface EncWriter {
  void writeByte(byte b);

  void writeBytes(byte[] data, int offset, int length);

  default void writeBytes(byte[] data) {
    writeBytes(data, 0, data.length);
  }

  /** Called once the outermost encode call completes. */
  void end();

  /**
   * A stream view of this writer, for drivers built on stream based generators. Closing the returned
   * stream does not close the underlying target.
   */
  OutputStream asOutputStream();
}
