package com.booking.codec;

import com.booking.codec.CodecException.ErrorKind;
import com.booking.codec.TypeInfo.Kind;
import com.booking.codec.impl.CanonicalKeys;
import com.booking.codec.impl.FieldValueList;
import com.google.common.primitives.Primitives;
import com.google.common.primitives.UnsignedLongs;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.lang.reflect.Array;
import java.lang.reflect.Modifier;
import java.time.Duration;
import java.time.Instant;
import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks arbitrary values and turns them into calls on the {@link EncDriver} of a {@link Handle}.
 * <p>
 * Example:
 * <pre>
 * {@code
 *   Encoder encoder = Encoder.forBytes(JacksonHandle.json());
 *   encoder.encode(Map.of("id", 42, "tags", List.of("a", "b")));
 *
 *   byte[] data = encoder.getData();
 * }
 * </pre>
 * A new encoder has no output; {@link #reset(OutputStream)} or {@link #resetBytes()} bind one and can be called
 * again to reuse the encoder. Once an encode fails the encoder keeps failing with the same error until it is
 * reset. Encoders are not thread safe.
 */
public class Encoder {
  private static final Logger LOG = LoggerFactory.getLogger(Encoder.class);

  public static final int CONTAINER_NONE = 0;
  public static final int CONTAINER_MAP_START = 1;
  public static final int CONTAINER_MAP_KEY = 2;
  public static final int CONTAINER_MAP_VALUE = 3;
  public static final int CONTAINER_ARRAY_START = 4;
  public static final int CONTAINER_ARRAY_ELEM = 5;

  private static final Duration MAX_CHANNEL_WAIT = Duration.ofDays(36500);

  private final Handle handle;
  private final EncoderOptions options;
  private final EncDriver driver;
  private final ContainerTracker tracker;
  private final FieldValueList fieldValues = new FieldValueList();
  private final List<Object> ci = new ArrayList<>();
  private ByteArray scratch;
  private EncWriter writer;
  private BytesEncWriter bytesWriter;
  private Encoder sideEncoder;
  private CodecException err;
  private int calls;
  private int c;

  /** Create an encoder with default options. It has no output until reset. */
  public Encoder(Handle handle) {
    this(handle, new EncoderOptions());
  }

  /** Create an encoder with the specified options. It has no output until reset. */
  public Encoder(Handle handle, EncoderOptions options) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.options = options.copy();
    this.driver = handle.newEncDriver(this);
    this.tracker = driver instanceof ContainerTracker ? (ContainerTracker) driver : null;
    this.err = error(ErrorKind.UNINITIALIZED_ENCODER, "Encoder not initialized, call reset first");
  }

  /** An encoder writing to an in-memory buffer, see {@link #getData()}. */
  public static Encoder forBytes(Handle handle) {
    return forBytes(handle, new EncoderOptions());
  }

  public static Encoder forBytes(Handle handle, EncoderOptions options) {
    Encoder encoder = new Encoder(handle, options);
    encoder.resetBytes();
    return encoder;
  }

  /** An encoder writing to {@code out}. The stream is flushed after every encode but never closed. */
  public static Encoder forStream(OutputStream out, Handle handle) {
    return forStream(out, handle, new EncoderOptions());
  }

  public static Encoder forStream(OutputStream out, Handle handle, EncoderOptions options) {
    Encoder encoder = new Encoder(handle, options);
    encoder.reset(out);
    return encoder;
  }

  public Handle handle() {
    return handle;
  }

  public EncoderOptions options() {
    return options;
  }

  /** Output the driver writes to, {@code null} before the first reset. */
  public EncWriter writer() {
    return writer;
  }

  /**
   * Position inside the innermost container, one of the {@code CONTAINER_*} constants. While a container or
   * {@link ContainerTracker} callback runs this is still the previous position, so the first element of an
   * array is announced with {@link #CONTAINER_ARRAY_START}.
   */
  public int containerState() {
    return c;
  }

  /** Write to {@code out} from now on and clear any previous error. */
  public void reset(OutputStream out) {
    writer = new StreamEncWriter(Objects.requireNonNull(out, "out"), options.writerBufferSize());
    bytesWriter = null;
    resetState();
  }

  /** Write to a fresh in-memory buffer from now on and clear any previous error. */
  public void resetBytes() {
    if (bytesWriter == null) {
      bytesWriter = new BytesEncWriter(options.writerBufferSize());
    } else {
      bytesWriter.clear();
    }
    writer = bytesWriter;
    resetState();
  }

  private void resetState() {
    err = null;
    calls = 0;
    c = CONTAINER_NONE;
    ci.clear();
    driver.reset();
  }

  /**
   * Get the bytes written since the last {@link #resetBytes()}. The returned object references the internal
   * buffer, which is reused by following encodes.
   */
  public ByteArray getDataReference() {
    return bytesOutput().getDataReference();
  }

  /** Get a copy of the bytes written since the last {@link #resetBytes()}. */
  public byte[] getData() {
    return bytesOutput().getData();
  }

  private BytesEncWriter bytesOutput() {
    if (bytesWriter == null || writer != bytesWriter) {
      throw new IllegalStateException("Encoder is not writing to bytes, call resetBytes first");
    }
    return bytesWriter;
  }

  /**
   * Encode {@code value} as one document.
   *
   * @throws CodecException if the value cannot be encoded or the output fails; the encoder is unusable until
   *     reset
   */
  public void encode(Object value) throws CodecException {
    try {
      mustEncode(value);
    } catch (CodecRuntimeException e) {
      throw e.getCause();
    }
  }

  /**
   * Like {@link #encode(Object)} but failing with the unchecked {@link CodecRuntimeException}.
   * <p>
   * Can be called from a {@link Selfer} or a driver while an encode is in progress; only the outermost call
   * ends the document.
   */
  public void mustEncode(Object value) {
    if (err != null) {
      throw new CodecRuntimeException(err);
    }

    calls++;
    try {
      if (!encodeFast(value)) {
        encodeValue(value, null);
      }
      if (calls == 1) {
        driver.atEndOfEncode();
        writer.end();
      }
    } catch (CodecRuntimeException e) {
      if (err == null) {
        err = e.getCause();
      }
      throw e;
    } catch (UncheckedIOException e) {
      err = new CodecException(ErrorKind.OUTPUT_FAILURE, prefix() + "Write failed: " + e.getCause().getMessage(),
          e.getCause());
      throw new CodecRuntimeException(err);
    } catch (RuntimeException e) {
      // thrown by user code: a Selfer, an Ext, a MissingFielder or a CodecEmptiable
      err = new CodecException(ErrorKind.CUSTOM_MARSHAL_FAILURE,
          prefix() + "Encoding failed: " + e.getClass().getName() + ": " + e.getMessage(), e);
      throw new CodecRuntimeException(err);
    } finally {
      calls--;
    }
  }

  // common scalars skip the function cache, unless an extension might claim them
  private boolean encodeFast(Object value) {
    if (value == null || handle.hasExtensions()) {
      return false;
    }

    if (value instanceof String) {
      driver.encodeString((String) value);
    } else if (value instanceof Boolean) {
      driver.encodeBool((Boolean) value);
    } else if (value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte) {
      driver.encodeInt(((Number) value).longValue());
    } else if (value instanceof Double) {
      driver.encodeFloat64((Double) value);
    } else if (value instanceof Float) {
      driver.encodeFloat32((Float) value);
    } else if (value instanceof byte[]) {
      driver.encodeStringBytesRaw((byte[]) value);
    } else if (value instanceof Instant) {
      driver.encodeTime((Instant) value);
    } else {
      return false;
    }
    return true;
  }

  void encodeValue(Object value, CodecFn fn) {
    while (EmptyValues.isPointer(value)) {
      value = EmptyValues.referent(value);
      fn = null;
    }
    if (value == null) {
      driver.encodeNil();
      return;
    }

    if (fn == null) {
      fn = handle.fn(value.getClass());
    }
    if (LOG.isTraceEnabled()) {
      LOG.trace("Encoding {} at depth {}", fn.info().typeInfo(), ci.size());
    }

    boolean tracked = options.checkCircularRef() && fn.info().typeInfo().kind() == Kind.STRUCT;
    if (tracked) {
      for (Object seen : ci) {
        if (seen == value) {
          throw fail(ErrorKind.CIRCULAR_REFERENCE,
              "Circular reference found in " + value.getClass().getName());
        }
      }
      ci.add(value);
    }
    try {
      fn.encode(this, value);
    } finally {
      if (tracked) {
        ci.remove(ci.size() - 1);
      }
    }
  }

  // custom encodings

  void selferMarshal(CodecFnInfo f, Object value) {
    ((Selfer) value).codecEncodeSelf(this);
  }

  void ext(CodecFnInfo f, Object value) {
    driver.encodeExt(value, f.extTag(), f.ext());
  }

  void rawExt(CodecFnInfo f, Object value) {
    driver.encodeRawExt((RawExt) value);
  }

  void binaryMarshal(CodecFnInfo f, Object value) {
    byte[] bytes;
    try {
      bytes = ((BinaryMarshaler) value).marshalBinary();
    } catch (IOException | RuntimeException e) {
      throw marshalFailure(value, e);
    }
    if (bytes == null) {
      driver.encodeNil();
    } else {
      driver.encodeStringBytesRaw(bytes);
    }
  }

  void textMarshal(CodecFnInfo f, Object value) {
    String text;
    try {
      text = ((TextMarshaler) value).marshalText();
    } catch (IOException | RuntimeException e) {
      throw marshalFailure(value, e);
    }
    if (text == null) {
      driver.encodeNil();
    } else {
      driver.encodeString(text);
    }
  }

  void jsonMarshal(CodecFnInfo f, Object value) {
    byte[] json;
    try {
      json = ((JsonMarshaler) value).marshalJson();
    } catch (IOException | RuntimeException e) {
      throw marshalFailure(value, e);
    }
    if (json == null) {
      driver.encodeNil();
    } else {
      driver.writeRaw(json);
    }
  }

  void raw(CodecFnInfo f, Object value) {
    if (!options.raw()) {
      throw fail(ErrorKind.RAW_DISALLOWED, "Raw values cannot be encoded unless enabled in the options");
    }
    driver.writeRaw(((Raw) value).bytes());
  }

  // kinds

  void kBool(CodecFnInfo f, Object value) {
    driver.encodeBool(value instanceof AtomicBoolean ? ((AtomicBoolean) value).get() : (Boolean) value);
  }

  void kInt(CodecFnInfo f, Object value) {
    driver.encodeInt(((Number) value).longValue());
  }

  void kUint(CodecFnInfo f, Object value) {
    driver.encodeUint(((Number) value).longValue());
  }

  void kFloat32(CodecFnInfo f, Object value) {
    driver.encodeFloat32((Float) value);
  }

  void kFloat64(CodecFnInfo f, Object value) {
    driver.encodeFloat64((Double) value);
  }

  void kString(CodecFnInfo f, Object value) {
    driver.encodeString(stringOf(value));
  }

  void kTime(CodecFnInfo f, Object value) {
    driver.encodeTime(CanonicalKeys.toInstant(value));
  }

  void kBytes(CodecFnInfo f, Object value) {
    if (value instanceof byte[]) {
      driver.encodeStringBytesRaw((byte[]) value);
      return;
    }

    Byte[] boxed = (Byte[]) value;
    byte[] bytes = new byte[boxed.length];
    for (int i = 0; i < boxed.length; i++) {
      if (boxed[i] == null) {
        kArray(f, value);
        return;
      }
      bytes[i] = boxed[i];
    }
    driver.encodeStringBytesRaw(bytes);
  }

  void kArray(CodecFnInfo f, Object value) {
    int length = Array.getLength(value);
    Class<?> component = f.typeInfo().elem();
    CodecFn elemFn = null;
    if (component.isPrimitive()) {
      elemFn = handle.fn(Primitives.wrap(component));
    } else if (Modifier.isFinal(component.getModifiers()) && TypeRegistry.kindOf(component) != Kind.POINTER) {
      elemFn = handle.fn(component);
    }

    arrayStart(length);
    for (int i = 0; i < length; i++) {
      arrayElem();
      encodeValue(Array.get(value, i), elemFn);
    }
    arrayEnd();
  }

  void kCollection(CodecFnInfo f, Object value) {
    Collection<?> items = (Collection<?>) value;
    if (f.typeInfo().isMapBySlice()) {
      encodeMapBySlice(items, value.getClass());
      return;
    }

    arrayStart(items.size());
    for (Object item : items) {
      arrayElem();
      encodeValue(item, null);
    }
    arrayEnd();
  }

  private void encodeMapBySlice(Collection<?> items, Class<?> type) {
    if (items.size() % 2 != 0) {
      throw fail(ErrorKind.MALFORMED_FLATTENED_SEQUENCE,
          "Map-by-slice " + type.getName() + " has odd number of elements: " + items.size());
    }

    mapStart(items.size() / 2);
    boolean key = true;
    for (Object item : items) {
      if (key) {
        mapElemKey();
      } else {
        mapElemValue();
      }
      encodeValue(item, null);
      key = !key;
    }
    mapEnd();
  }

  void kChan(CodecFnInfo f, Object value) {
    Channel<?> channel = (Channel<?>) value;
    if (!channel.canReceive()) {
      throw fail(ErrorKind.SEND_ONLY_CHANNEL,
          "Cannot receive from send-only channel of " + channel.elementType().getName());
    }

    boolean mapBySlice = f.typeInfo().isMapBySlice();
    if (channel.elementType() == Byte.class && !mapBySlice) {
      ByteArray bytes = scratch();
      bytes.clear();
      drain(channel, token -> {
        if (token == Channel.NIL) {
          throw fail(ErrorKind.UNSUPPORTED_VALUE, "Null element in byte channel");
        }
        bytes.append((Byte) token);
      });
      driver.encodeStringBytesRaw(bytes.toByteArray());
      return;
    }

    List<Object> items = new ArrayList<>();
    drain(channel, token -> items.add(token == Channel.NIL ? null : token));
    if (LOG.isTraceEnabled()) {
      LOG.trace("Received {} elements from channel of {}", items.size(), channel.elementType().getName());
    }

    if (mapBySlice) {
      encodeMapBySlice(items, value.getClass());
      return;
    }
    arrayStart(items.size());
    for (Object item : items) {
      arrayElem();
      encodeValue(item, null);
    }
    arrayEnd();
  }

  private void drain(Channel<?> channel, Consumer<Object> sink) {
    Duration timeout = options.chanRecvTimeout();
    try {
      if (timeout.isNegative()) {
        for (Object token = channel.takeRaw(); token != Channel.CLOSED; token = channel.takeRaw()) {
          sink.accept(token);
        }
      } else if (timeout.isZero()) {
        for (Object token = channel.pollRaw(); token != null && token != Channel.CLOSED; token = channel.pollRaw()) {
          sink.accept(token);
        }
      } else {
        long deadline = System.nanoTime() + (timeout.compareTo(MAX_CHANNEL_WAIT) > 0 ? MAX_CHANNEL_WAIT : timeout)
            .toNanos();
        for (long remaining = deadline - System.nanoTime(); remaining > 0; remaining = deadline - System.nanoTime()) {
          Object token = channel.pollRaw(remaining, TimeUnit.NANOSECONDS);
          if (token == null || token == Channel.CLOSED) {
            break;
          }
          sink.accept(token);
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CodecRuntimeException(
          new CodecException(ErrorKind.INTERRUPTED, prefix() + "Interrupted while receiving from channel", e));
    }
  }

  void kMap(CodecFnInfo f, Object value) {
    Map<?, ?> map = (Map<?, ?>) value;
    if (options.canonical()) {
      kMapCanonical(map);
      return;
    }

    boolean plainStrings = !handle.hasExtensions();
    mapStart(map.size());
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      mapElemKey();
      Object key = entry.getKey();
      if (plainStrings && key instanceof String) {
        driver.encodeString((String) key);
      } else {
        encodeValue(key, null);
      }
      mapElemValue();
      encodeValue(entry.getValue(), null);
    }
    mapEnd();
  }

  private void kMapCanonical(Map<?, ?> map) {
    List<Map.Entry<?, ?>> entries = new ArrayList<>(map.entrySet());
    Kind keyKind = naturalKeyKind(entries);

    if (keyKind == null) {
      kMapCanonicalEncodedKeys(entries);
      return;
    }

    Comparator<Object> order = naturalOrder(keyKind);
    entries.sort((a, b) -> order.compare(a.getKey(), b.getKey()));
    mapStart(entries.size());
    for (Map.Entry<?, ?> entry : entries) {
      mapElemKey();
      encodeValue(entry.getKey(), null);
      mapElemValue();
      encodeValue(entry.getValue(), null);
    }
    mapEnd();
  }

  // the kind shared by all keys, or null if they have no natural order in common
  private Kind naturalKeyKind(List<Map.Entry<?, ?>> entries) {
    Kind shared = null;
    for (Map.Entry<?, ?> entry : entries) {
      Object key = entry.getKey();
      if (key == null) {
        return null;
      }
      CodecFn fn = handle.fn(key.getClass());
      Kind kind = fn.info().typeInfo().kind();
      if (fn.isCustom() || !hasNaturalOrder(kind) || (shared != null && shared != kind)) {
        return null;
      }
      shared = kind;
    }
    return shared;
  }

  private static boolean hasNaturalOrder(Kind kind) {
    switch (kind) {
      case BOOL:
      case INT:
      case UINT:
      case FLOAT32:
      case FLOAT64:
      case STRING:
      case TIME:
        return true;
      default:
        return false;
    }
  }

  private static Comparator<Object> naturalOrder(Kind kind) {
    switch (kind) {
      case BOOL:
        return Comparator.comparing(Encoder::boolOf);
      case INT:
        return Comparator.comparingLong(key -> ((Number) key).longValue());
      case UINT:
        return (a, b) -> UnsignedLongs.compare(((Number) a).longValue(), ((Number) b).longValue());
      case FLOAT32:
        return (a, b) -> Float.compare(((Number) a).floatValue(), ((Number) b).floatValue());
      case FLOAT64:
        return (a, b) -> Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
      case STRING:
        return (a, b) -> CanonicalKeys.UTF8.compare(stringOf(a), stringOf(b));
      case TIME:
        return CanonicalKeys.TIME;
      default:
        throw new IllegalArgumentException("No natural order for " + kind);
    }
  }

  // keys are encoded on their own with the same handle and options, then ordered by their bytes
  private void kMapCanonicalEncodedKeys(List<Map.Entry<?, ?>> entries) {
    Encoder side = sideEncoder();
    List<Map.Entry<byte[], Object>> encoded = new ArrayList<>(entries.size());
    for (Map.Entry<?, ?> entry : entries) {
      side.resetBytes();
      side.mustEncode(entry.getKey());
      encoded.add(new SimpleImmutableEntry<>(side.getData(), entry.getValue()));
    }
    encoded.sort(Map.Entry.comparingByKey(CanonicalKeys.BYTES));

    mapStart(encoded.size());
    for (Map.Entry<byte[], Object> entry : encoded) {
      mapElemKey();
      driver.writeRaw(entry.getKey());
      mapElemValue();
      encodeValue(entry.getValue(), null);
    }
    mapEnd();
  }

  void kStruct(CodecFnInfo f, Object value) {
    TypeInfo ti = f.typeInfo();
    boolean recursive = options.recursiveEmptyCheck();
    boolean toArray = (options.structToArray() || ti.toArray()) && !ti.isMissingFielder();

    if (toArray) {
      List<FieldInfo> fields = ti.fields();
      arrayStart(fields.size());
      for (FieldInfo field : fields) {
        arrayElem();
        Object fieldValue = field.get(value);
        if (field.omitEmpty() && field.nilWhenEmpty()
            && EmptyValues.isEmpty(fieldValue, handle.typeRegistry(), recursive)) {
          driver.encodeNil();
        } else {
          encodeValue(fieldValue, null);
        }
      }
      arrayEnd();
      return;
    }

    List<FieldInfo> fields = options.canonical() ? ti.sortedFields() : ti.fields();
    Object[] pairs = fieldValues.get(fields.size());
    try {
      int count = 0;
      for (FieldInfo field : fields) {
        Object fieldValue = field.get(value);
        if (field.omitEmpty() && EmptyValues.isEmpty(fieldValue, handle.typeRegistry(), recursive)) {
          continue;
        }
        pairs[count * 2] = field;
        pairs[count * 2 + 1] = fieldValue;
        count++;
      }

      List<Map.Entry<String, Object>> missing = ti.isMissingFielder()
          ? missingFields((MissingFielder) value, ti.omitEmpty(), recursive)
          : List.of();

      mapStart(count + missing.size());
      for (int i = 0; i < count; i++) {
        FieldInfo field = (FieldInfo) pairs[i * 2];
        mapElemKey();
        encodeStructKey(ti.keyType(), field.encName(), field.asciiAlphaNum());
        mapElemValue();
        encodeValue(pairs[i * 2 + 1], null);
      }
      for (Map.Entry<String, Object> entry : missing) {
        mapElemKey();
        encodeStructKey(ti.keyType(), entry.getKey(), FieldInfo.isAsciiAlphaNum(entry.getKey()));
        mapElemValue();
        encodeValue(entry.getValue(), null);
      }
      mapEnd();
    } finally {
      fieldValues.put(pairs);
    }
  }

  private List<Map.Entry<String, Object>> missingFields(MissingFielder value, boolean omitEmpty, boolean recursive) {
    Map<String, Object> fields = value.codecMissingFields();
    if (fields == null || fields.isEmpty()) {
      return List.of();
    }

    List<Map.Entry<String, Object>> result = new ArrayList<>(fields.size());
    for (Map.Entry<String, Object> entry : fields.entrySet()) {
      if (entry.getKey() == null || entry.getKey().isEmpty()) {
        continue;
      }
      if (omitEmpty && EmptyValues.isEmpty(entry.getValue(), handle.typeRegistry(), recursive)) {
        continue;
      }
      result.add(entry);
    }
    if (options.canonical()) {
      result.sort(Map.Entry.comparingByKey(CanonicalKeys.UTF8));
    }
    return result;
  }

  private void encodeStructKey(KeyType keyType, String name, boolean asciiAlphaNum) {
    switch (keyType) {
      case INT:
        long signed;
        try {
          signed = Long.parseLong(name);
        } catch (NumberFormatException e) {
          throw invalidKey(name, keyType, e);
        }
        driver.encodeInt(signed);
        break;
      case UINT:
        long unsigned;
        try {
          unsigned = UnsignedLongs.parseUnsignedLong(name);
        } catch (NumberFormatException e) {
          throw invalidKey(name, keyType, e);
        }
        driver.encodeUint(unsigned);
        break;
      case FLOAT:
        double number;
        try {
          number = Double.parseDouble(name);
        } catch (NumberFormatException e) {
          throw invalidKey(name, keyType, e);
        }
        driver.encodeFloat64(number);
        break;
      default:
        driver.encodeFieldName(name, asciiAlphaNum);
    }
  }

  void kPointer(CodecFnInfo f, Object value) {
    encodeValue(EmptyValues.referent(value), null);
  }

  void kErr(CodecFnInfo f, Object value) {
    throw fail(ErrorKind.UNSUPPORTED_VALUE, "Unsupported type: " + value.getClass().getName());
  }

  // container state is set after the driver call, which still sees the previous state

  private void arrayStart(int length) {
    driver.writeArrayStart(length);
    c = CONTAINER_ARRAY_START;
  }

  private void arrayElem() {
    if (tracker != null) {
      tracker.writeArrayElem();
    }
    c = CONTAINER_ARRAY_ELEM;
  }

  private void arrayEnd() {
    driver.writeArrayEnd();
    c = CONTAINER_NONE;
  }

  private void mapStart(int length) {
    driver.writeMapStart(length);
    c = CONTAINER_MAP_START;
  }

  private void mapElemKey() {
    if (tracker != null) {
      tracker.writeMapElemKey();
    }
    c = CONTAINER_MAP_KEY;
  }

  private void mapElemValue() {
    if (tracker != null) {
      tracker.writeMapElemValue();
    }
    c = CONTAINER_MAP_VALUE;
  }

  private void mapEnd() {
    driver.writeMapEnd();
    c = CONTAINER_NONE;
  }

  // helpers

  private ByteArray scratch() {
    if (scratch == null) {
      scratch = new ByteArray(64);
    }
    return scratch;
  }

  private Encoder sideEncoder() {
    if (sideEncoder == null) {
      sideEncoder = new Encoder(handle, options);
    }
    return sideEncoder;
  }

  private static boolean boolOf(Object value) {
    return value instanceof AtomicBoolean ? ((AtomicBoolean) value).get() : (Boolean) value;
  }

  private static String stringOf(Object value) {
    if (value instanceof Enum) {
      return ((Enum<?>) value).name();
    } else if (value instanceof char[]) {
      return new String((char[]) value);
    }
    return value.toString();
  }

  private String prefix() {
    return "codec." + handle.name() + ": ";
  }

  private CodecException error(ErrorKind kind, String msg) {
    return new CodecException(kind, prefix() + msg);
  }

  private CodecRuntimeException fail(ErrorKind kind, String msg) {
    return new CodecRuntimeException(error(kind, msg));
  }

  private CodecRuntimeException invalidKey(String name, KeyType keyType, NumberFormatException cause) {
    return new CodecRuntimeException(new CodecException(ErrorKind.INVALID_KEY_ENCODING,
        prefix() + "Cannot encode struct key '" + name + "' as " + keyType, cause));
  }

  private CodecRuntimeException marshalFailure(Object value, Exception cause) {
    if (cause instanceof CodecRuntimeException) {
      return (CodecRuntimeException) cause;
    }
    return new CodecRuntimeException(new CodecException(ErrorKind.CUSTOM_MARSHAL_FAILURE,
        prefix() + "Marshaling " + value.getClass().getName() + " failed: " + cause.getMessage(), cause));
  }
}
