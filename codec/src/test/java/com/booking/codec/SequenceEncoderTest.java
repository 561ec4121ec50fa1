package com.booking.codec;

import static com.booking.codec.TestUtils.encode;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

import com.booking.codec.CodecException.ErrorKind;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import org.junit.Test;

public class SequenceEncoderTest {
  static class Pairs extends ArrayList<Object> implements MapBySlice {
    Pairs(Object... items) {
      super(Arrays.asList(items));
    }
  }

  @Test
  public void collections() throws CodecException {
    assertThat(encode(new LinkedHashSet<>(List.of("b", "a"))), equalTo("[2 s:b s:a ]"));
    assertThat(encode(new ArrayList<>()), equalTo("[0 ]"));
    assertThat(encode(List.of(List.of(1), List.of())), equalTo("[2 [1 i:1 ] [0 ] ]"));
  }

  @Test
  public void trackerSeesArrayStartBeforeFirstElement() throws CodecException {
    RecordingHandle handle = new RecordingHandle();
    encode(handle, List.of(1, 2, 3), new EncoderOptions());

    assertThat(handle.drivers.get(0).elemStates, contains(
        Encoder.CONTAINER_ARRAY_START, Encoder.CONTAINER_ARRAY_ELEM, Encoder.CONTAINER_ARRAY_ELEM));
  }

  @Test
  public void arrays() throws CodecException {
    assertThat(encode(new int[][] {{1}, {}}), equalTo("[2 [1 i:1 ] [0 ] ]"));
    assertThat(encode(new double[] {0.5}), equalTo("[1 f64:0.5 ]"));
    assertThat(encode(new boolean[] {true, false}), equalTo("[2 true false ]"));
    assertThat(encode(new String[] {"a", null}), equalTo("[2 s:a nil ]"));
    assertThat(encode(new Number[] {1, 2.5}), equalTo("[2 i:1 f64:2.5 ]"));
  }

  @Test
  public void mapBySlice() throws CodecException {
    assertThat(encode(new Pairs("a", 1, "b", 2)), equalTo("{2 s:a i:1 s:b i:2 }"));
    assertThat(encode(new Pairs()), equalTo("{0 }"));
  }

  @Test
  public void mapBySliceOddLength() {
    try {
      encode(new Pairs("a", 1, "b"));
      fail("Expected malformed sequence");
    } catch (CodecException e) {
      assertThat(e.kind(), equalTo(ErrorKind.MALFORMED_FLATTENED_SEQUENCE));
      assertThat(e.getMessage(), equalTo(
          "codec.rec: Map-by-slice com.booking.codec.SequenceEncoderTest$Pairs has odd number of elements: 3"));
    }
  }

  @Test
  public void elementTracking() throws CodecException {
    RecordingHandle handle = new RecordingHandle();
    encode(handle, new Object[] {1, new int[] {2, 3}}, new EncoderOptions());

    assertThat(handle.drivers.get(0).arrayElems, equalTo(4));
  }
}
