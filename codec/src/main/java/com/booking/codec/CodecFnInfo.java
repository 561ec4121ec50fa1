package com.booking.codec;

/** Static data shared by all invocations of a {@link CodecFn}. */
public final class CodecFnInfo {
  private final TypeInfo typeInfo;
  private final long extTag;
  private final Ext ext;

  CodecFnInfo(TypeInfo typeInfo, long extTag, Ext ext) {
    this.typeInfo = typeInfo;
    this.extTag = extTag;
    this.ext = ext;
  }

  public TypeInfo typeInfo() {
    return typeInfo;
  }

  /** Extension tag, meaningful only if {@link #ext()} is set. */
  public long extTag() {
    return extTag;
  }

  public Ext ext() {
    return ext;
  }
}
