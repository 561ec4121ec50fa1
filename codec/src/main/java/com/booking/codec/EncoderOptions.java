package com.booking.codec;

import java.time.Duration;
import java.util.Objects;

public class EncoderOptions {
  private int writerBufferSize = 0;
  private Duration chanRecvTimeout = Duration.ZERO;
  private boolean structToArray = false;
  private boolean canonical = false;
  private boolean checkCircularRef = false;
  private boolean recursiveEmptyCheck = false;
  private boolean raw = false;
  private boolean stringToRaw = false;
  private boolean optimumSize = false;

  /**
   * Size of the buffer placed in front of an {@link java.io.OutputStream} target, and the initial capacity
   * of the in-memory buffer when encoding to bytes. {@code 0} disables the extra buffering of streams.
   *
   * @return writer buffer size in bytes
   */
  public int writerBufferSize() {
    return writerBufferSize;
  }

  /**
   * How long {@link Encoder} keeps receiving from a {@link Channel} before encoding what it got.
   * <ul>
   *   <li>zero: only the elements currently available are consumed, the encoder never blocks</li>
   *   <li>negative: elements are consumed until the channel is closed</li>
   *   <li>positive: elements are consumed until the channel is closed or the timeout elapses</li>
   * </ul>
   *
   * @return channel receive timeout
   */
  public Duration chanRecvTimeout() {
    return chanRecvTimeout;
  }

  /**
   * Encode every struct positionally, as an array of its fields in declaration order, instead of a map.
   */
  public boolean structToArray() {
    return structToArray;
  }

  /**
   * Encoding the same logical content always produces the same sequence of driver calls.
   * <p>
   * This only affects maps (and the order of struct fields): keys with a natural order are sorted in that
   * order, any other key is encoded to bytes first and the byte strings are sorted.
   */
  public boolean canonical() {
    return canonical;
  }

  /**
   * Fail fast when a struct references itself, directly or through one of its fields.
   * <p>
   * This is opt-in as it costs an identity scan for every struct encoded. Without it a self-referencing
   * value recurses until the stack overflows.
   */
  public boolean checkCircularRef() {
    return checkCircularRef;
  }

  /**
   * If set, omit-empty checks descend into pointers and check struct fields one by one. Otherwise a value
   * is empty when it equals its zero value.
   */
  public boolean recursiveEmptyCheck() {
    return recursiveEmptyCheck;
  }

  /**
   * Write {@link Raw} values verbatim. They are not validated, so this must be explicitly enabled; when
   * disabled encoding a {@link Raw} fails.
   */
  public boolean raw() {
    return raw;
  }

  /**
   * Ask the driver to write strings as uninterpreted bytes instead of text, where the format can tell them apart.
   */
  public boolean stringToRaw() {
    return stringToRaw;
  }

  /**
   * Ask the driver for the smallest representation when the format has a size/precision trade-off.
   */
  public boolean optimumSize() {
    return optimumSize;
  }

  public EncoderOptions writerBufferSize(int writerBufferSize) {
    if (writerBufferSize < 0) {
      throw new IllegalArgumentException("Negative writer buffer size " + writerBufferSize);
    }
    this.writerBufferSize = writerBufferSize;

    return this;
  }

  public EncoderOptions chanRecvTimeout(Duration chanRecvTimeout) {
    this.chanRecvTimeout = Objects.requireNonNull(chanRecvTimeout, "chanRecvTimeout");

    return this;
  }

  public EncoderOptions structToArray(boolean structToArray) {
    this.structToArray = structToArray;

    return this;
  }

  public EncoderOptions canonical(boolean canonical) {
    this.canonical = canonical;

    return this;
  }

  public EncoderOptions checkCircularRef(boolean checkCircularRef) {
    this.checkCircularRef = checkCircularRef;

    return this;
  }

  public EncoderOptions recursiveEmptyCheck(boolean recursiveEmptyCheck) {
    this.recursiveEmptyCheck = recursiveEmptyCheck;

    return this;
  }

  public EncoderOptions raw(boolean raw) {
    this.raw = raw;

    return this;
  }

  public EncoderOptions stringToRaw(boolean stringToRaw) {
    this.stringToRaw = stringToRaw;

    return this;
  }

  public EncoderOptions optimumSize(boolean optimumSize) {
    this.optimumSize = optimumSize;

    return this;
  }

  EncoderOptions copy() {
    return new EncoderOptions()
        .writerBufferSize(writerBufferSize)
        .chanRecvTimeout(chanRecvTimeout)
        .structToArray(structToArray)
        .canonical(canonical)
        .checkCircularRef(checkCircularRef)
        .recursiveEmptyCheck(recursiveEmptyCheck)
        .raw(raw)
        .stringToRaw(stringToRaw)
        .optimumSize(optimumSize);
  }
}
