package com.booking.codec;

/**
 * Cached encoding strategy of one runtime class, built by {@link Handle#fn(Class)}.
 */
public final class CodecFn {
  private final CodecFnInfo info;
  private final EncodeFn encodeFn;
  private final boolean custom;

  CodecFn(CodecFnInfo info, EncodeFn encodeFn, boolean custom) {
    this.info = info;
    this.encodeFn = encodeFn;
    this.custom = custom;
  }

  public CodecFnInfo info() {
    return info;
  }

  /** {@code true} if a selfer, extension, marshaler or raw pass-through encodes the type, not its kind. */
  public boolean isCustom() {
    return custom;
  }

  void encode(Encoder encoder, Object value) {
    encodeFn.encode(encoder, info, value);
  }
}
