package com.booking.codec;

import com.booking.codec.CodecException.ErrorKind;

/**
 * Unchecked carrier of a {@link CodecException}, used to unwind the recursive encode in one step.
 * <p>
 * {@link Encoder#encode(Object)} converts it back into the checked exception; {@link Encoder#mustEncode(Object)}
 * lets it escape to the caller.
 */
@SuppressWarnings("serial")
public class CodecRuntimeException extends RuntimeException {
  public CodecRuntimeException(CodecException cause) {
    super(cause.getMessage(), cause);
  }

  public CodecRuntimeException(ErrorKind kind, String msg) {
    this(new CodecException(kind, msg));
  }

  @Override
  public synchronized CodecException getCause() {
    return (CodecException) super.getCause();
  }

  public ErrorKind kind() {
    return getCause().kind();
  }
}
