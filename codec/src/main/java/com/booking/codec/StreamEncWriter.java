package com.booking.codec;

import java.io.BufferedOutputStream;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;

/**
 * Writes to an {@link OutputStream}, optionally through a buffer of {@link EncoderOptions#writerBufferSize()}
 * bytes. The buffer is flushed at the end of every top level encode; the target stream is never closed.
 */
public class StreamEncWriter implements EncWriter {
  private final OutputStream out;
  private final OutputStream view;

  public StreamEncWriter(OutputStream target, int bufferSize) {
    out = bufferSize > 0 ? new BufferedOutputStream(target, bufferSize) : target;
    view = new FilterOutputStream(out) {
      @Override
      public void write(byte[] data, int offset, int length) throws IOException {
        out.write(data, offset, length);
      }

      @Override
      public void close() throws IOException {
        flush();
      }
    };
  }

  @Override
  public void writeByte(byte b) {
    try {
      out.write(b);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public void writeBytes(byte[] data, int offset, int length) {
    try {
      out.write(data, offset, length);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public void end() {
    try {
      out.flush();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public OutputStream asOutputStream() {
    return view;
  }
}
