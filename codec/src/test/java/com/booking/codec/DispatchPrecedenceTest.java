package com.booking.codec;

import static com.booking.codec.TestUtils.encode;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

import com.booking.codec.CodecException.ErrorKind;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

public class DispatchPrecedenceTest {
  static class Everything implements Selfer, BinaryMarshaler, TextMarshaler, JsonMarshaler {
    @Override
    public void codecEncodeSelf(Encoder encoder) {
      encoder.mustEncode("self");
    }

    @Override
    public byte[] marshalBinary() {
      return new byte[] {1};
    }

    @Override
    public String marshalText() {
      return "text";
    }

    @Override
    public byte[] marshalJson() {
      return "{}".getBytes(StandardCharsets.UTF_8);
    }
  }

  static class Marshalers implements BinaryMarshaler, TextMarshaler, JsonMarshaler {
    @Override
    public byte[] marshalBinary() {
      return new byte[] {0x0a, 0x0b};
    }

    @Override
    public String marshalText() {
      return "text";
    }

    @Override
    public byte[] marshalJson() {
      return "{}".getBytes(StandardCharsets.UTF_8);
    }
  }

  static class TextAndJson implements TextMarshaler, JsonMarshaler {
    @Override
    public String marshalText() {
      return "text";
    }

    @Override
    public byte[] marshalJson() {
      return "{}".getBytes(StandardCharsets.UTF_8);
    }
  }

  static class JsonOnly implements JsonMarshaler {
    String ignored = "field";

    @Override
    public byte[] marshalJson() {
      return "{\"a\":1}".getBytes(StandardCharsets.UTF_8);
    }
  }

  static class NullBinary implements BinaryMarshaler {
    @Override
    public byte[] marshalBinary() {
      return null;
    }
  }

  static class Failing implements TextMarshaler {
    @Override
    public String marshalText() throws IOException {
      throw new IOException("broken");
    }
  }

  static class Point {
    int x = 1;
    int y = 2;
  }

  static class NamedPoint extends Point implements TextMarshaler {
    @Override
    public String marshalText() {
      return "point";
    }
  }

  static class Composite implements Selfer {
    @Override
    public void codecEncodeSelf(Encoder encoder) {
      encoder.mustEncode(List.of(1, 2));
      encoder.mustEncode("tail");
    }
  }

  private static final Ext POINT_EXT = value -> new byte[] {(byte) ((Point) value).x, (byte) ((Point) value).y};

  @Rule
  public ExpectedException exceptionRule = ExpectedException.none();

  @Test
  public void selferComesFirst() throws CodecException {
    assertThat(encode(new Everything()), equalTo("s:self"));
  }

  @Test
  public void marshalerOrder() throws CodecException {
    assertThat(encode(new Marshalers()), equalTo("b:0a0b"));
    assertThat(encode(new TextAndJson()), equalTo("s:text"));
    assertThat(encode(new JsonOnly()), equalTo("raw:{\"a\":1}"));
  }

  @Test
  public void nullMarshalResult() throws CodecException {
    assertThat(encode(new NullBinary()), equalTo("nil"));
  }

  @Test
  public void extensionBeforeMarshalers() throws CodecException {
    RecordingHandle handle = new RecordingHandle();
    handle.setExt(Point.class, 7, POINT_EXT);

    assertThat(encode(handle, new Point(), new EncoderOptions()), equalTo("ext(7):0102"));
    // registered on the superclass, still wins over the subclass text marshaler
    assertThat(encode(handle, new NamedPoint(), new EncoderOptions()), equalTo("ext(7):0102"));
  }

  @Test
  public void extensionOnStringDisablesFastPath() throws CodecException {
    RecordingHandle handle = new RecordingHandle();
    handle.setExt(String.class, 3, value -> ((String) value).getBytes(StandardCharsets.UTF_8));

    assertThat(encode(handle, "hi", new EncoderOptions()), equalTo("ext(3):6869"));
    assertThat(encode(handle, List.of("hi"), new EncoderOptions()), equalTo("[1 ext(3):6869 ]"));
  }

  @Test
  public void extensionAfterUse() throws CodecException {
    RecordingHandle handle = new RecordingHandle();
    encode(handle, new Point(), new EncoderOptions());

    exceptionRule.expect(IllegalStateException.class);
    exceptionRule.expectMessage("after it started encoding");

    handle.setExt(Point.class, 7, POINT_EXT);
  }

  @Test
  public void marshalerFailure() {
    try {
      encode(new Failing());
      fail("Expected marshal failure");
    } catch (CodecException e) {
      assertThat(e.kind(), equalTo(ErrorKind.CUSTOM_MARSHAL_FAILURE));
      assertThat(e.getMessage(), equalTo(
          "codec.rec: Marshaling com.booking.codec.DispatchPrecedenceTest$Failing failed: broken"));
      assertThat(e.getCause(), instanceOf(IOException.class));
    }
  }

  @Test
  public void rawDisallowedByDefault() {
    try {
      encode(new Raw("xyz".getBytes(StandardCharsets.UTF_8)));
      fail("Expected raw values to be rejected");
    } catch (CodecException e) {
      assertThat(e.kind(), equalTo(ErrorKind.RAW_DISALLOWED));
    }
  }

  @Test
  public void rawWhenEnabled() throws CodecException {
    Raw raw = new Raw("xyz".getBytes(StandardCharsets.UTF_8));

    assertThat(encode(raw, new EncoderOptions().raw(true)), equalTo("raw:xyz"));
  }

  @Test
  public void rawExt() throws CodecException {
    assertThat(encode(new RawExt(5, new byte[] {0x0a})), equalTo("rawext(5):0a"));
    assertThat(encode(new RawExt(5, null, 3)), equalTo("rawext(5) i:3"));
  }

  @Test
  public void selferNestedEncodesEndOnce() throws CodecException {
    RecordingHandle handle = new RecordingHandle();
    Encoder encoder = Encoder.forBytes(handle);

    encoder.encode(new Composite());

    assertThat(TestUtils.text(encoder), equalTo("[2 i:1 i:2 ] s:tail"));
    assertThat(handle.drivers.get(0).ends, equalTo(1));
  }
}
