package com.booking.codec.jackson;

import com.booking.codec.CodecException.ErrorKind;
import com.booking.codec.CodecRuntimeException;
import com.booking.codec.EncDriver;
import com.booking.codec.Encoder;
import com.booking.codec.Ext;
import com.booking.codec.RawExt;
import com.fasterxml.jackson.core.Base64Variants;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.io.SerializedString;
import com.google.common.primitives.UnsignedLong;
import com.google.common.primitives.UnsignedLongs;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An {@link EncDriver} translating encoder calls into {@link JsonGenerator} calls.
 * <p>
 * In key position every scalar is written as a field name: numbers, booleans and times in their text form,
 * byte strings in base64. Composite keys of canonical maps become their encoded JSON text. Times are written
 * as ISO-8601 strings, unsigned values above {@link Long#MAX_VALUE} as big integers.
 * <p>
 * On text formats an extension value is replaced by {@link Ext#convertExt(Object)} and encoded again, so the
 * converted value must not be of the extension type itself.
 */
public class JacksonEncDriver implements EncDriver {
  private static final Logger LOG = LoggerFactory.getLogger(JacksonEncDriver.class);

  private final JacksonHandle handle;
  private final Encoder encoder;
  private final JsonFactory factory;
  private final boolean binary;
  private final Map<String, SerializedString> fieldNames = new HashMap<>();
  private JsonGenerator generator;

  JacksonEncDriver(JacksonHandle handle, Encoder encoder) {
    this.handle = handle;
    this.encoder = encoder;
    this.factory = handle.factory();
    this.binary = factory.canHandleBinaryNatively();
  }

  private JsonGenerator generator() throws IOException {
    if (generator == null) {
      generator = factory.createGenerator(encoder.writer().asOutputStream());
      generator.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      if (LOG.isDebugEnabled()) {
        LOG.debug("Created {} generator", factory.getFormatName());
      }
    }
    return generator;
  }

  private boolean inKey() {
    return encoder.containerState() == Encoder.CONTAINER_MAP_KEY;
  }

  @Override
  public void encodeNil() {
    try {
      if (inKey()) {
        generator().writeFieldName("null");
      } else {
        generator().writeNull();
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public void encodeInt(long value) {
    try {
      if (inKey()) {
        generator().writeFieldName(Long.toString(value));
      } else {
        generator().writeNumber(value);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public void encodeUint(long value) {
    try {
      if (inKey()) {
        generator().writeFieldName(UnsignedLongs.toString(value));
      } else if (value >= 0) {
        generator().writeNumber(value);
      } else {
        generator().writeNumber(UnsignedLong.fromLongBits(value).bigIntegerValue());
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public void encodeBool(boolean value) {
    try {
      if (inKey()) {
        generator().writeFieldName(Boolean.toString(value));
      } else {
        generator().writeBoolean(value);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public void encodeFloat32(float value) {
    try {
      if (inKey()) {
        generator().writeFieldName(Float.toString(value));
      } else {
        generator().writeNumber(value);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public void encodeFloat64(double value) {
    try {
      if (inKey()) {
        generator().writeFieldName(Double.toString(value));
      } else if (binary && encoder.options().optimumSize() && (double) (float) value == value) {
        generator().writeNumber((float) value);
      } else {
        generator().writeNumber(value);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public void encodeRawExt(RawExt value) {
    if (value.data() != null) {
      writeRaw(value.data());
    } else {
      encoder.mustEncode(value.value());
    }
  }

  @Override
  public void encodeExt(Object value, long tag, Ext ext) {
    if (!binary) {
      encoder.mustEncode(ext.convertExt(value));
      return;
    }
    byte[] bytes = ext.writeExt(value);
    if (bytes == null) {
      encodeNil();
    } else {
      encodeStringBytesRaw(bytes);
    }
  }

  @Override
  public void encodeString(String value) {
    try {
      if (inKey()) {
        generator().writeFieldName(value);
      } else if (binary && encoder.options().stringToRaw()) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        generator().writeBinary(bytes, 0, bytes.length);
      } else {
        generator().writeString(value);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public void encodeFieldName(String name, boolean asciiAlphaNum) {
    try {
      if (asciiAlphaNum) {
        generator().writeFieldName(fieldNames.computeIfAbsent(name, SerializedString::new));
      } else {
        generator().writeFieldName(name);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public void encodeStringBytesRaw(byte[] value) {
    try {
      if (inKey()) {
        generator().writeFieldName(Base64Variants.getDefaultVariant().encode(value));
      } else {
        generator().writeBinary(value, 0, value.length);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public void encodeTime(Instant value) {
    String text = DateTimeFormatter.ISO_INSTANT.format(value);
    try {
      if (inKey()) {
        generator().writeFieldName(text);
      } else {
        generator().writeString(text);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public void writeRaw(byte[] value) {
    if (binary) {
      throw new CodecRuntimeException(ErrorKind.UNSUPPORTED_VALUE,
          "codec." + handle.name() + ": Raw values cannot be written to " + factory.getFormatName());
    }
    try {
      if (inKey()) {
        generator().writeFieldName(keyText(value));
      } else {
        generator().writeRawValue(new String(value, StandardCharsets.UTF_8));
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  // a scalar key, e.g. "abc" or 12, by its text; a composite key by its whole encoded form
  private String keyText(byte[] encoded) throws IOException {
    try (JsonParser parser = factory.createParser(encoded)) {
      JsonToken token = parser.nextToken();
      if (token != null && token.isScalarValue()) {
        return parser.getText();
      }
    }
    return new String(encoded, StandardCharsets.UTF_8);
  }

  @Override
  public void writeArrayStart(int length) {
    try {
      generator().writeStartArray(null, length);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public void writeArrayEnd() {
    try {
      generator().writeEndArray();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public void writeMapStart(int length) {
    try {
      generator().writeStartObject(null, length);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public void writeMapEnd() {
    try {
      generator().writeEndObject();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public void reset() {
    generator = null;
  }

  @Override
  public void atEndOfEncode() {
    if (generator == null) {
      return;
    }
    try {
      generator.flush();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
