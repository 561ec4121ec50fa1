package com.booking.codec;

import java.util.List;

/**
 * Immutable description of how a runtime class is encoded, built once by {@link TypeRegistry}.
 */
public final class TypeInfo {
  public enum Kind {
    BOOL, INT, UINT, FLOAT32, FLOAT64, STRING, BYTES, TIME, ARRAY, COLLECTION, MAP, CHANNEL, POINTER, STRUCT,
    UNSUPPORTED;

    /** Kinds whose empty value is written as nil in array mode structs. */
    public boolean isReference() {
      switch (this) {
        case ARRAY:
        case COLLECTION:
        case MAP:
        case POINTER:
        case STRUCT:
        case CHANNEL:
        case BYTES:
          return true;
        default:
          return false;
      }
    }
  }

  static final int SELFER = 1;
  static final int BINARY_MARSHALER = 1 << 1;
  static final int TEXT_MARSHALER = 1 << 2;
  static final int JSON_MARSHALER = 1 << 3;
  static final int RAW = 1 << 4;
  static final int RAW_EXT = 1 << 5;
  static final int MISSING_FIELDER = 1 << 6;
  static final int MAP_BY_SLICE = 1 << 7;
  static final int CODEC_EMPTIABLE = 1 << 8;

  private final Class<?> type;
  private final Kind kind;
  private final int flags;
  private final Class<?> elem;
  private final List<FieldInfo> fields;
  private final List<FieldInfo> sortedFields;
  private final boolean toArray;
  private final boolean omitEmpty;
  private final KeyType keyType;

  TypeInfo(Class<?> type, Kind kind, int flags, Class<?> elem, List<FieldInfo> fields, List<FieldInfo> sortedFields,
      boolean toArray, boolean omitEmpty, KeyType keyType) {
    this.type = type;
    this.kind = kind;
    this.flags = flags;
    this.elem = elem;
    this.fields = fields;
    this.sortedFields = sortedFields;
    this.toArray = toArray;
    this.omitEmpty = omitEmpty;
    this.keyType = keyType;
  }

  public Class<?> type() {
    return type;
  }

  public Kind kind() {
    return kind;
  }

  /** Component type of arrays, {@code null} for other kinds. */
  public Class<?> elem() {
    return elem;
  }

  /** Encodable fields in declaration order, empty unless this is a struct. */
  public List<FieldInfo> fields() {
    return fields;
  }

  /** Encodable fields sorted by encoded key. */
  public List<FieldInfo> sortedFields() {
    return sortedFields;
  }

  public boolean toArray() {
    return toArray;
  }

  public boolean omitEmpty() {
    return omitEmpty;
  }

  public KeyType keyType() {
    return keyType;
  }

  public boolean isSelfer() {
    return has(SELFER);
  }

  public boolean isBinaryMarshaler() {
    return has(BINARY_MARSHALER);
  }

  public boolean isTextMarshaler() {
    return has(TEXT_MARSHALER);
  }

  public boolean isJsonMarshaler() {
    return has(JSON_MARSHALER);
  }

  public boolean isRaw() {
    return has(RAW);
  }

  public boolean isRawExt() {
    return has(RAW_EXT);
  }

  public boolean isMissingFielder() {
    return has(MISSING_FIELDER);
  }

  public boolean isMapBySlice() {
    return has(MAP_BY_SLICE);
  }

  public boolean isCodecEmptiable() {
    return has(CODEC_EMPTIABLE);
  }

  private boolean has(int flag) {
    return (flags & flag) != 0;
  }

  @Override
  public String toString() {
    return type.getName() + "(" + kind + ")";
  }
}
