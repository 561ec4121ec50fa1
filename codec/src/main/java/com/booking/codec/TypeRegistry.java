package com.booking.codec;

import com.booking.codec.TypeInfo.Kind;
import com.booking.codec.impl.CanonicalKeys;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.primitives.Primitives;
import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;
import java.lang.ref.Reference;
import java.lang.reflect.Field;
import java.lang.reflect.InaccessibleObjectException;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds and caches {@link TypeInfo} descriptors. Safe for concurrent use; descriptors are immutable.
 */
public class TypeRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(TypeRegistry.class);
  private static final TypeRegistry DEFAULT = new TypeRegistry();

  private final ConcurrentHashMap<Class<?>, TypeInfo> infos = new ConcurrentHashMap<>();

  /** The process-wide registry used by handles unless configured otherwise. */
  public static TypeRegistry getDefault() {
    return DEFAULT;
  }

  public TypeInfo typeInfoFor(Class<?> type) {
    TypeInfo info = infos.get(type);
    if (info != null) {
      return info;
    }
    info = build(type);
    TypeInfo previous = infos.putIfAbsent(type, info);
    return previous != null ? previous : info;
  }

  /** Kind of a class, without building its field list. */
  public static Kind kindOf(Class<?> type) {
    Class<?> c = Primitives.wrap(type);

    if (c == Boolean.class || c == AtomicBoolean.class) {
      return Kind.BOOL;
    } else if (c == Byte.class || c == Short.class || c == Integer.class || c == Long.class
        || c == AtomicInteger.class || c == AtomicLong.class) {
      return Kind.INT;
    } else if (c == UnsignedInteger.class || c == UnsignedLong.class) {
      return Kind.UINT;
    } else if (c == Float.class) {
      return Kind.FLOAT32;
    } else if (c == Double.class) {
      return Kind.FLOAT64;
    } else if (c == byte[].class || c == Byte[].class) {
      return Kind.BYTES;
    } else if (CharSequence.class.isAssignableFrom(c) || c == Character.class || c == char[].class
        || Enum.class.isAssignableFrom(c) || c == BigInteger.class || c == BigDecimal.class || c == UUID.class) {
      return Kind.STRING;
    } else if (c == Instant.class || Date.class.isAssignableFrom(c) || c == OffsetDateTime.class
        || c == ZonedDateTime.class) {
      return Kind.TIME;
    } else if (c == Optional.class || AtomicReference.class.isAssignableFrom(c)
        || Reference.class.isAssignableFrom(c)) {
      return Kind.POINTER;
    } else if (Channel.class.isAssignableFrom(c)) {
      return Kind.CHANNEL;
    } else if (c.isArray()) {
      return Kind.ARRAY;
    } else if (Map.class.isAssignableFrom(c)) {
      return Kind.MAP;
    } else if (Collection.class.isAssignableFrom(c)) {
      return Kind.COLLECTION;
    } else if (c.isSynthetic() || c.isHidden() || c == Class.class || c == Void.class || c == Object.class
        || Thread.class.isAssignableFrom(c) || c.isInterface()) {
      return Kind.UNSUPPORTED;
    }
    return Kind.STRUCT;
  }

  private TypeInfo build(Class<?> type) {
    Kind kind = kindOf(type);
    int flags = flagsOf(type);
    Class<?> elem = type.isArray() ? type.getComponentType() : null;

    List<FieldInfo> fields = Collections.emptyList();
    List<FieldInfo> sorted = Collections.emptyList();
    CodecStruct options = type.getAnnotation(CodecStruct.class);
    boolean toArray = options != null && options.toArray();
    boolean omitEmpty = options != null && options.omitEmpty();
    KeyType keyType = options != null ? options.keyType() : KeyType.STRING;

    if (kind == Kind.STRUCT) {
      try {
        Set<Class<?>> inlining = new HashSet<>();
        inlining.add(type);
        fields = Collections.unmodifiableList(dedupe(discover(type, new Field[0], 0, omitEmpty, inlining)));
        List<FieldInfo> byName = new ArrayList<>(fields);
        byName.sort((a, b) -> CanonicalKeys.UTF8.compare(a.encName(), b.encName()));
        sorted = Collections.unmodifiableList(byName);
      } catch (InaccessibleObjectException | SecurityException e) {
        LOG.debug("Fields of {} are not accessible, encoding is unsupported", type.getName(), e);
        kind = Kind.UNSUPPORTED;
        fields = Collections.emptyList();
      }
    }

    if (LOG.isDebugEnabled()) {
      LOG.debug("Built type info for {}: kind {}, {} fields", type.getName(), kind, fields.size());
    }
    return new TypeInfo(type, kind, flags, elem, fields, sorted, toArray, omitEmpty, keyType);
  }

  private static int flagsOf(Class<?> type) {
    int flags = 0;
    if (Selfer.class.isAssignableFrom(type)) {
      flags |= TypeInfo.SELFER;
    }
    if (BinaryMarshaler.class.isAssignableFrom(type)) {
      flags |= TypeInfo.BINARY_MARSHALER;
    }
    if (TextMarshaler.class.isAssignableFrom(type)) {
      flags |= TypeInfo.TEXT_MARSHALER;
    }
    if (JsonMarshaler.class.isAssignableFrom(type)) {
      flags |= TypeInfo.JSON_MARSHALER;
    }
    if (type == Raw.class) {
      flags |= TypeInfo.RAW;
    }
    if (type == RawExt.class) {
      flags |= TypeInfo.RAW_EXT;
    }
    if (MissingFielder.class.isAssignableFrom(type)) {
      flags |= TypeInfo.MISSING_FIELDER;
    }
    if (MapBySlice.class.isAssignableFrom(type)) {
      flags |= TypeInfo.MAP_BY_SLICE;
    }
    if (CodecEmptiable.class.isAssignableFrom(type)) {
      flags |= TypeInfo.CODEC_EMPTIABLE;
    }
    return flags;
  }

  private static List<FieldInfo> discover(
      Class<?> type, Field[] prefix, int depth, boolean classOmitEmpty, Set<Class<?>> inlining) {
    List<FieldInfo> result = new ArrayList<>();

    for (Field field : declaredFields(type)) {
      int modifiers = field.getModifiers();
      if (Modifier.isStatic(modifiers) || Modifier.isTransient(modifiers) || field.isSynthetic()) {
        continue;
      }

      String name = field.getName();
      boolean omitEmpty = classOmitEmpty;
      boolean inline = false;

      CodecField codecField = field.getAnnotation(CodecField.class);
      if (codecField != null) {
        if ("-".equals(codecField.value())) {
          continue;
        }
        if (!codecField.value().isEmpty()) {
          name = codecField.value();
        }
        omitEmpty |= codecField.omitEmpty();
        inline = codecField.inline();
      } else {
        JsonIgnore ignore = field.getAnnotation(JsonIgnore.class);
        if (ignore != null && ignore.value()) {
          continue;
        }
        JsonProperty property = field.getAnnotation(JsonProperty.class);
        if (property != null && !property.value().isEmpty()) {
          name = property.value();
        }
        JsonInclude include = field.getAnnotation(JsonInclude.class);
        if (include != null && include.value() == JsonInclude.Include.NON_EMPTY) {
          omitEmpty = true;
        }
      }

      field.setAccessible(true);
      Field[] path = Arrays.copyOf(prefix, prefix.length + 1);
      path[prefix.length] = field;

      Class<?> fieldType = field.getType();
      if (inline && kindOf(fieldType) == Kind.STRUCT && inlining.add(fieldType)) {
        CodecStruct nested = fieldType.getAnnotation(CodecStruct.class);
        result.addAll(discover(fieldType, path, depth + 1, nested != null && nested.omitEmpty(), inlining));
        inlining.remove(fieldType);
        continue;
      }

      result.add(new FieldInfo(name, path, omitEmpty, depth));
    }

    return result;
  }

  // superclass fields first, record components in component order
  private static List<Field> declaredFields(Class<?> type) {
    if (type.isRecord()) {
      List<Field> fields = new ArrayList<>();
      for (RecordComponent component : type.getRecordComponents()) {
        try {
          fields.add(type.getDeclaredField(component.getName()));
        } catch (NoSuchFieldException e) {
          throw new IllegalStateException("Record " + type.getName() + " has no field for " + component, e);
        }
      }
      return fields;
    }

    Deque<Class<?>> hierarchy = new ArrayDeque<>();
    for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
      hierarchy.push(c);
    }
    List<Field> fields = new ArrayList<>();
    for (Class<?> c : hierarchy) {
      fields.addAll(Arrays.asList(c.getDeclaredFields()));
    }
    return fields;
  }

  // when keys collide the shallowest field wins, the first one among equals
  private static List<FieldInfo> dedupe(List<FieldInfo> fields) {
    Map<String, FieldInfo> winners = new HashMap<>();
    for (FieldInfo field : fields) {
      FieldInfo current = winners.get(field.encName());
      if (current == null || field.depth() < current.depth()) {
        winners.put(field.encName(), field);
      }
    }
    List<FieldInfo> result = new ArrayList<>(winners.size());
    for (FieldInfo field : fields) {
      if (winners.get(field.encName()) == field) {
        result.add(field);
      }
    }
    return result;
  }
}
