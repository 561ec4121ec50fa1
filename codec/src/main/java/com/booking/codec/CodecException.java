package com.booking.codec;

/**
 * Terminal failure of an {@link Encoder#encode(Object)} call.
 * <p>
 * The {@link ErrorKind} tells what went wrong; the message carries the handle name and the offending type.
 */
@SuppressWarnings("serial")
public class CodecException extends Exception {
  private final ErrorKind kind;

  public CodecException(ErrorKind kind, String msg) {
    super(msg);
    this.kind = kind;
  }

  public CodecException(ErrorKind kind, String msg, Throwable cause) {
    super(msg, cause);
    this.kind = kind;
  }

  public ErrorKind kind() {
    return kind;
  }

  public enum ErrorKind {
    /** An encode was attempted before an output target was configured. */
    UNINITIALIZED_ENCODER,
    /** No encoding strategy exists for the runtime class (e.g. a lambda). */
    UNSUPPORTED_VALUE,
    /** A struct was reached a second time on the current encode path. */
    CIRCULAR_REFERENCE,
    /** A map-by-slice sequence has an odd number of elements. */
    MALFORMED_FLATTENED_SEQUENCE,
    /** A {@link Raw} value was supplied while {@link EncoderOptions#raw()} is off. */
    RAW_DISALLOWED,
    /** A channel without receive capability was encoded. */
    SEND_ONLY_CHANNEL,
    /** A user supplied marshal method or encoding hook threw. */
    CUSTOM_MARSHAL_FAILURE,
    /** A numeric struct key mode could not parse the declared key text. */
    INVALID_KEY_ENCODING,
    /** The driver or the output writer failed. */
    OUTPUT_FAILURE,
    /** The encoding thread was interrupted while draining a channel. */
    INTERRUPTED
  }
}
