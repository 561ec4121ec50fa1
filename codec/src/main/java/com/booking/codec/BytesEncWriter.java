package com.booking.codec;

import java.io.OutputStream;

/** Writes into a growable in-memory buffer. */
public class BytesEncWriter implements EncWriter {
  private static final int DEFAULT_CAPACITY = 1024;

  private final ByteArray buffer;
  private final OutputStream stream = new OutputStream() {
    @Override
    public void write(int b) {
      buffer.append((byte) b);
    }

    @Override
    public void write(byte[] data, int offset, int length) {
      buffer.append(data, offset, length);
    }
  };

  public BytesEncWriter(int initialCapacity) {
    buffer = new ByteArray(initialCapacity > 0 ? initialCapacity : DEFAULT_CAPACITY);
  }

  @Override
  public void writeByte(byte b) {
    buffer.append(b);
  }

  @Override
  public void writeBytes(byte[] data, int offset, int length) {
    buffer.append(data, offset, length);
  }

  @Override
  public void end() {
  }

  @Override
  public OutputStream asOutputStream() {
    return stream;
  }

  public void clear() {
    buffer.clear();
  }

  /** Get the encoded bytes (no copy). */
  public ByteArray getDataReference() {
    return new ByteArray(buffer.array, buffer.length);
  }

  /** Get a copy of the encoded bytes. */
  public byte[] getData() {
    return buffer.toByteArray();
  }
}
