package com.booking.codec;

import java.lang.ref.Reference;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Emptiness test behind omit-empty fields.
 * <p>
 * The shallow test treats a value as empty when it is {@code null}, {@code false}, zero, {@code '\0'}, an empty
 * string, a zero length array, collection or map, or an empty pointer wrapper. A struct is empty when every
 * field holds {@code null} or a zero primitive. The recursive test descends into pointer wrappers and applies
 * itself to every struct field. Types implementing {@link CodecEmptiable} decide for themselves.
 */
public final class EmptyValues {
  private EmptyValues() {
  }

  public static boolean isEmpty(Object value, TypeRegistry registry, boolean recursive) {
    if (value == null) {
      return true;
    }
    if (value instanceof CodecEmptiable) {
      return ((CodecEmptiable) value).isCodecEmpty();
    }

    TypeInfo ti = registry.typeInfoFor(value.getClass());
    switch (ti.kind()) {
      case BOOL:
        return value instanceof AtomicBoolean ? !((AtomicBoolean) value).get() : !((Boolean) value);
      case INT:
      case UINT:
        return ((Number) value).longValue() == 0;
      case FLOAT32:
      case FLOAT64:
        return ((Number) value).doubleValue() == 0;
      case STRING:
        return isEmptyString(value);
      case BYTES:
      case ARRAY:
        return Array.getLength(value) == 0;
      case COLLECTION:
        return ((Collection<?>) value).isEmpty();
      case MAP:
        return ((Map<?, ?>) value).isEmpty();
      case POINTER:
        Object referent = referent(value);
        if (referent == null) {
          return true;
        }
        return recursive && isEmpty(referent, registry, true);
      case STRUCT:
        for (FieldInfo field : ti.fields()) {
          Object fieldValue = field.get(value);
          boolean empty = recursive
              ? isEmpty(fieldValue, registry, true)
              : fieldValue == null || (field.type().isPrimitive() && isEmpty(fieldValue, registry, false));
          if (!empty) {
            return false;
          }
        }
        return true;
      default:
        // channels, times and enums are only empty when null
        return false;
    }
  }

  private static boolean isEmptyString(Object value) {
    if (value instanceof CharSequence) {
      return ((CharSequence) value).length() == 0;
    } else if (value instanceof Character) {
      return (Character) value == '\0';
    } else if (value instanceof char[]) {
      return ((char[]) value).length == 0;
    } else if (value instanceof BigInteger) {
      return ((BigInteger) value).signum() == 0;
    } else if (value instanceof BigDecimal) {
      return ((BigDecimal) value).signum() == 0;
    }
    return false;
  }

  static boolean isPointer(Object value) {
    return value instanceof Optional || value instanceof AtomicReference || value instanceof Reference;
  }

  static Object referent(Object pointer) {
    if (pointer instanceof Optional) {
      return ((Optional<?>) pointer).orElse(null);
    } else if (pointer instanceof AtomicReference) {
      return ((AtomicReference<?>) pointer).get();
    } else if (pointer instanceof Reference) {
      return ((Reference<?>) pointer).get();
    }
    throw new IllegalArgumentException("Not a pointer: " + pointer.getClass().getName());
  }
}
