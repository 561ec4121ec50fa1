package com.booking.codec.jackson;

import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertThat;

import com.booking.codec.CodecException;
import com.booking.codec.CodecField;
import com.booking.codec.CodecStruct;
import com.booking.codec.Encoder;
import com.booking.codec.EncoderOptions;
import com.booking.codec.Ext;
import com.booking.codec.JsonMarshaler;
import com.booking.codec.KeyType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.primitives.UnsignedLong;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.Test;

public class JacksonEncDriverTest {
  static class Person {
    String name = "ann";
    int age = 30;
    @CodecField(omitEmpty = true)
    String nick;
  }

  @CodecStruct(keyType = KeyType.INT)
  static class Numbered {
    @CodecField("1")
    String one = "x";
  }

  static class Spliced {
    JsonMarshaler v = () -> "{\"a\":1}".getBytes(StandardCharsets.UTF_8);
  }

  record Point(int x, int y) {
  }

  private static final Ext POINT_EXT = new Ext() {
    @Override
    public byte[] writeExt(Object value) {
      Point point = (Point) value;
      return new byte[] {(byte) point.x(), (byte) point.y()};
    }

    @Override
    public Object convertExt(Object value) {
      Point point = (Point) value;
      return point.x() + "," + point.y();
    }
  };

  private static String json(Object value) throws CodecException {
    return json(JacksonHandle.json(), value, new EncoderOptions());
  }

  private static String json(JacksonHandle handle, Object value, EncoderOptions options) throws CodecException {
    Encoder encoder = Encoder.forBytes(handle, options);
    encoder.encode(value);
    return new String(encoder.getData(), StandardCharsets.UTF_8);
  }

  @Test
  public void scalars() throws CodecException {
    assertThat(json(null), equalTo("null"));
    assertThat(json("a\"b"), equalTo("\"a\\\"b\""));
    assertThat(json(12), equalTo("12"));
    assertThat(json(1.5), equalTo("1.5"));
    assertThat(json(false), equalTo("false"));
    assertThat(json(UnsignedLong.fromLongBits(-1L)), equalTo("18446744073709551615"));
    assertThat(json(new byte[] {1, 2}), equalTo("\"AQI=\""));
    assertThat(json(Instant.parse("2020-01-02T03:04:05Z")), equalTo("\"2020-01-02T03:04:05Z\""));
  }

  @Test
  public void containers() throws CodecException {
    Map<Object, Object> map = new LinkedHashMap<>();
    map.put("a", 1);
    map.put("b", Arrays.asList(true, null));
    map.put(3, List.of());

    assertThat(json(map), equalTo("{\"a\":1,\"b\":[true,null],\"3\":[]}"));
  }

  @Test
  public void structs() throws CodecException {
    assertThat(json(new Person()), equalTo("{\"name\":\"ann\",\"age\":30}"));
    assertThat(json(JacksonHandle.json(), new Person(), new EncoderOptions().canonical(true)),
        equalTo("{\"age\":30,\"name\":\"ann\"}"));
    assertThat(json(JacksonHandle.json(), new Person(), new EncoderOptions().structToArray(true)),
        equalTo("[\"ann\",30,null]"));
    assertThat(json(new Numbered()), equalTo("{\"1\":\"x\"}"));
  }

  @Test
  public void canonicalMixedKeys() throws CodecException {
    Map<Object, Object> map = new LinkedHashMap<>();
    map.put(1, "one");
    map.put("a", "letter");

    assertThat(json(JacksonHandle.json(), map, new EncoderOptions().canonical(true)),
        equalTo("{\"a\":\"letter\",\"1\":\"one\"}"));
  }

  @Test
  public void canonicalStructKeysStayDistinct() throws Exception {
    Map<Object, Object> map = new LinkedHashMap<>();
    map.put(new Point(3, 4), "b");
    map.put(new Point(1, 2), "a");

    String json = json(JacksonHandle.json(), map, new EncoderOptions().canonical(true));

    assertThat(json, equalTo("{\"{\\\"x\\\":1,\\\"y\\\":2}\":\"a\",\"{\\\"x\\\":3,\\\"y\\\":4}\":\"b\"}"));
    JsonNode tree = new ObjectMapper().readTree(json);
    assertThat(tree.size(), equalTo(2));
    assertThat(tree.get("{\"x\":1,\"y\":2}").asText(), equalTo("a"));
  }

  @Test
  public void jsonMarshalerIsSpliced() throws CodecException {
    assertThat(json(new Spliced()), equalTo("{\"v\":{\"a\":1}}"));
  }

  @Test
  public void extensionOnText() throws CodecException {
    JacksonHandle handle = JacksonHandle.json();
    handle.setExt(Point.class, 1, POINT_EXT);

    assertThat(json(handle, List.of(new Point(1, 2)), new EncoderOptions()), equalTo("[\"1,2\"]"));
  }

  @Test
  public void streamOutput() throws CodecException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    Encoder encoder = Encoder.forStream(out, JacksonHandle.json(), new EncoderOptions().writerBufferSize(512));

    encoder.encode(Map.of("k", "v"));

    assertThat(out.toString(StandardCharsets.UTF_8), equalTo("{\"k\":\"v\"}"));
  }
}
