package com.booking.codec;

import com.booking.codec.CodecException.ErrorKind;
import java.lang.reflect.Field;

/** One encodable field of a struct. */
public final class FieldInfo {
  private final String encName;
  private final Field[] path;
  private final boolean omitEmpty;
  private final boolean asciiAlphaNum;
  private final int depth;
  private final boolean nilWhenEmpty;

  FieldInfo(String encName, Field[] path, boolean omitEmpty, int depth) {
    this.encName = encName;
    this.path = path;
    this.omitEmpty = omitEmpty;
    this.asciiAlphaNum = isAsciiAlphaNum(encName);
    this.depth = depth;

    Class<?> type = type();
    this.nilWhenEmpty = type == Object.class || type.isInterface() || TypeRegistry.kindOf(type).isReference();
  }

  /** Key written for this field. */
  public String encName() {
    return encName;
  }

  public boolean omitEmpty() {
    return omitEmpty;
  }

  /** {@code true} if the key only has ASCII letters, digits and underscores; drivers may skip escaping. */
  public boolean asciiAlphaNum() {
    return asciiAlphaNum;
  }

  /** Number of inline fields this field was flattened through. */
  public int depth() {
    return depth;
  }

  /** An empty omit-empty value of this field is written as nil when the struct is encoded as an array. */
  public boolean nilWhenEmpty() {
    return nilWhenEmpty;
  }

  /** Declared type of the field. */
  public Class<?> type() {
    return path[path.length - 1].getType();
  }

  /**
   * Read the field from {@code struct}, following inline fields. Returns {@code null} if one of the
   * enclosing inline fields is {@code null}.
   */
  public Object get(Object struct) {
    Object value = struct;
    for (Field field : path) {
      if (value == null) {
        return null;
      }
      try {
        value = field.get(value);
      } catch (IllegalAccessException e) {
        throw new CodecRuntimeException(
            new CodecException(ErrorKind.UNSUPPORTED_VALUE, "Cannot read field " + field, e));
      }
    }
    return value;
  }

  static boolean isAsciiAlphaNum(String name) {
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (!((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_')) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return encName;
  }
}
