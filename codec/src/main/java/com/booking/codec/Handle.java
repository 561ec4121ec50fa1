package com.booking.codec;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A wire format: creates the {@link EncDriver} of every {@link Encoder} and owns the per-format cache of
 * encoding strategies.
 * <p>
 * Handles are shared between threads. Extensions must be registered before the handle encodes anything.
 */
public abstract class Handle {
  private static final Logger LOG = LoggerFactory.getLogger(Handle.class);

  private static final class ExtEntry {
    private final Class<?> type;
    private final long tag;
    private final Ext ext;

    ExtEntry(Class<?> type, long tag, Ext ext) {
      this.type = type;
      this.tag = tag;
      this.ext = ext;
    }
  }

  private final String name;
  private final TypeRegistry typeRegistry;
  private final List<ExtEntry> extensions = new CopyOnWriteArrayList<>();
  private final ConcurrentHashMap<Class<?>, CodecFn> fns = new ConcurrentHashMap<>();
  private volatile boolean used;

  protected Handle(String name) {
    this(name, TypeRegistry.getDefault());
  }

  protected Handle(String name, TypeRegistry typeRegistry) {
    this.name = Objects.requireNonNull(name, "name");
    this.typeRegistry = Objects.requireNonNull(typeRegistry, "typeRegistry");
  }

  /** Short format name, used in error messages. */
  public String name() {
    return name;
  }

  public TypeRegistry typeRegistry() {
    return typeRegistry;
  }

  /** Create the driver of a new {@link Encoder}. Called once per encoder. */
  protected abstract EncDriver newEncDriver(Encoder encoder);

  /**
   * Encode values of {@code type} (and its subtypes) through {@code ext} under {@code tag}. When several
   * registrations match a class the first one wins.
   *
   * @throws IllegalStateException if the handle already built encoding strategies
   */
  public synchronized Handle setExt(Class<?> type, long tag, Ext ext) {
    if (used) {
      throw new IllegalStateException("Cannot register extension for " + type.getName() + " on handle " + name
          + " after it started encoding");
    }
    extensions.add(new ExtEntry(Objects.requireNonNull(type, "type"), tag, Objects.requireNonNull(ext, "ext")));

    return this;
  }

  public boolean hasExtensions() {
    return !extensions.isEmpty();
  }

  /** Encoding strategy of {@code type}, built and cached on first use. */
  public CodecFn fn(Class<?> type) {
    CodecFn fn = fns.get(type);
    if (fn != null) {
      return fn;
    }
    fn = build(type);
    CodecFn previous = fns.putIfAbsent(type, fn);
    return previous != null ? previous : fn;
  }

  private CodecFn build(Class<?> type) {
    if (!used) {
      synchronized (this) {
        used = true;
      }
    }

    TypeInfo ti = typeRegistry.typeInfoFor(type);
    ExtEntry extension = null;
    for (ExtEntry entry : extensions) {
      if (entry.type.isAssignableFrom(type)) {
        extension = entry;
        break;
      }
    }
    CodecFnInfo info = extension != null
        ? new CodecFnInfo(ti, extension.tag, extension.ext)
        : new CodecFnInfo(ti, 0, null);

    EncodeFn encodeFn;
    boolean custom = true;
    if (ti.isSelfer()) {
      encodeFn = Encoder::selferMarshal;
    } else if (extension != null) {
      encodeFn = Encoder::ext;
    } else if (ti.isBinaryMarshaler()) {
      encodeFn = Encoder::binaryMarshal;
    } else if (ti.isTextMarshaler()) {
      encodeFn = Encoder::textMarshal;
    } else if (ti.isJsonMarshaler()) {
      encodeFn = Encoder::jsonMarshal;
    } else if (ti.isRaw()) {
      encodeFn = Encoder::raw;
    } else if (ti.isRawExt()) {
      encodeFn = Encoder::rawExt;
    } else {
      custom = false;
      encodeFn = kindFn(ti);
    }

    if (LOG.isDebugEnabled()) {
      LOG.debug("Handle {} built {} encode function for {}", name, custom ? "custom" : ti.kind(), type.getName());
    }
    return new CodecFn(info, encodeFn, custom);
  }

  private static EncodeFn kindFn(TypeInfo ti) {
    switch (ti.kind()) {
      case BOOL:
        return Encoder::kBool;
      case INT:
        return Encoder::kInt;
      case UINT:
        return Encoder::kUint;
      case FLOAT32:
        return Encoder::kFloat32;
      case FLOAT64:
        return Encoder::kFloat64;
      case STRING:
        return Encoder::kString;
      case BYTES:
        return Encoder::kBytes;
      case TIME:
        return Encoder::kTime;
      case ARRAY:
        return Encoder::kArray;
      case COLLECTION:
        return Encoder::kCollection;
      case MAP:
        return Encoder::kMap;
      case CHANNEL:
        return Encoder::kChan;
      case POINTER:
        return Encoder::kPointer;
      case STRUCT:
        return Encoder::kStruct;
      default:
        return Encoder::kErr;
    }
  }
}
