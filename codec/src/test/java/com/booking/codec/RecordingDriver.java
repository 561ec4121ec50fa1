package com.booking.codec;

import com.google.common.io.BaseEncoding;
import com.google.common.primitives.UnsignedLongs;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes one space separated token per driver call:
 * <pre>
 *   nil  i:5  u:5  true  f32:1.5  f64:1.5  s:text  k:fieldName  b:hex  t:instant
 *   ext(tag):hex  rawext(tag):hex  raw:text  [n ]  {n }
 * </pre>
 */
public class RecordingDriver implements EncDriver, ContainerTracker {
  private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();

  private final Encoder encoder;
  private boolean first = true;
  int arrayElems;
  int mapKeys;
  int mapValues;
  int resets;
  int ends;
  // container state seen by each tracker callback
  final List<Integer> elemStates = new ArrayList<>();

  RecordingDriver(Encoder encoder) {
    this.encoder = encoder;
  }

  private void token(String token) {
    byte[] bytes = ((first ? "" : " ") + token).getBytes(StandardCharsets.UTF_8);
    first = false;
    encoder.writer().writeBytes(bytes);
  }

  @Override
  public void encodeNil() {
    token("nil");
  }

  @Override
  public void encodeInt(long value) {
    token("i:" + value);
  }

  @Override
  public void encodeUint(long value) {
    token("u:" + UnsignedLongs.toString(value));
  }

  @Override
  public void encodeBool(boolean value) {
    token(Boolean.toString(value));
  }

  @Override
  public void encodeFloat32(float value) {
    token("f32:" + value);
  }

  @Override
  public void encodeFloat64(double value) {
    token("f64:" + value);
  }

  @Override
  public void encodeRawExt(RawExt value) {
    if (value.data() != null) {
      token("rawext(" + value.tag() + "):" + HEX.encode(value.data()));
    } else {
      token("rawext(" + value.tag() + ")");
      encoder.mustEncode(value.value());
    }
  }

  @Override
  public void encodeExt(Object value, long tag, Ext ext) {
    token("ext(" + tag + "):" + HEX.encode(ext.writeExt(value)));
  }

  @Override
  public void encodeString(String value) {
    token("s:" + value);
  }

  @Override
  public void encodeFieldName(String name, boolean asciiAlphaNum) {
    token("k:" + name);
  }

  @Override
  public void encodeStringBytesRaw(byte[] value) {
    token("b:" + HEX.encode(value));
  }

  @Override
  public void encodeTime(Instant value) {
    token("t:" + value);
  }

  @Override
  public void writeRaw(byte[] value) {
    token("raw:" + new String(value, StandardCharsets.UTF_8));
  }

  @Override
  public void writeArrayStart(int length) {
    token("[" + length);
  }

  @Override
  public void writeArrayEnd() {
    token("]");
  }

  @Override
  public void writeMapStart(int length) {
    token("{" + length);
  }

  @Override
  public void writeMapEnd() {
    token("}");
  }

  @Override
  public void reset() {
    first = true;
    resets++;
  }

  @Override
  public void atEndOfEncode() {
    ends++;
  }

  @Override
  public void writeArrayElem() {
    arrayElems++;
    elemStates.add(encoder.containerState());
  }

  @Override
  public void writeMapElemKey() {
    mapKeys++;
    elemStates.add(encoder.containerState());
  }

  @Override
  public void writeMapElemValue() {
    mapValues++;
    elemStates.add(encoder.containerState());
  }
}
