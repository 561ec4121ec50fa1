package com.booking.codec;

import java.time.Instant;

/**
 * Format specific writer of primitive values and container boundaries.
 * <p>
 * An {@link Encoder} walks a value and calls these methods in nesting order: every
 * {@link #writeArrayStart(int)} is matched by {@link #writeArrayEnd()} after exactly that many elements, every
 * {@link #writeMapStart(int)} by {@link #writeMapEnd()} after that many key/value pairs. Drivers write through
 * {@link Encoder#writer()} and may report failures as {@link java.io.UncheckedIOException} or
 * {@link CodecRuntimeException}.
 * <p>
 * Drivers that need to see element boundaries also implement {@link ContainerTracker}.
 */
public interface EncDriver {
  void encodeNil();

  void encodeInt(long value);

  /** {@code value} holds an unsigned 64 bit quantity. */
  void encodeUint(long value);

  void encodeBool(boolean value);

  void encodeFloat32(float value);

  void encodeFloat64(double value);

  void encodeRawExt(RawExt value);

  /**
   * Encode {@code value} through the extension registered for its type under {@code tag}.
   */
  void encodeExt(Object value, long tag, Ext ext);

  void encodeString(String value);

  /**
   * Encode a struct field name in key position. {@code asciiAlphaNum} tells that the name has no characters
   * needing escapes.
   */
  default void encodeFieldName(String name, boolean asciiAlphaNum) {
    encodeString(name);
  }

  /** Encode uninterpreted bytes. */
  void encodeStringBytesRaw(byte[] value);

  void encodeTime(Instant value);

  /** Write already encoded bytes as the next value. */
  void writeRaw(byte[] value);

  void writeArrayStart(int length);

  void writeArrayEnd();

  void writeMapStart(int length);

  void writeMapEnd();

  /** The encoder was bound to a new output. */
  void reset();

  /** The outermost encode call completed; flush any pending state. */
  void atEndOfEncode();
}
