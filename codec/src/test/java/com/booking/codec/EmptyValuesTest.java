package com.booking.codec;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.Test;

public class EmptyValuesTest {
  static class Zero {
    int n;
    String s;
  }

  static class Filled {
    String s = "";
  }

  private final TypeRegistry registry = TypeRegistry.getDefault();

  private boolean shallow(Object value) {
    return EmptyValues.isEmpty(value, registry, false);
  }

  private boolean recursive(Object value) {
    return EmptyValues.isEmpty(value, registry, true);
  }

  @Test
  public void scalars() {
    assertTrue(shallow(null));
    assertTrue(shallow(false));
    assertTrue(shallow(0));
    assertTrue(shallow(0.0));
    assertTrue(shallow('\0'));
    assertTrue(shallow(""));
    assertTrue(shallow(new AtomicBoolean()));
    assertFalse(shallow(-0.5f));
    assertFalse(shallow("x"));
    assertFalse(shallow(Instant.EPOCH));
  }

  @Test
  public void containers() {
    assertTrue(shallow(new int[0]));
    assertTrue(shallow(List.of()));
    assertTrue(shallow(Map.of()));
    assertFalse(shallow(List.of(0)));
  }

  @Test
  public void pointers() {
    assertTrue(shallow(Optional.empty()));
    assertFalse(shallow(Optional.of(0)));
    assertTrue(recursive(Optional.of(0)));
  }

  @Test
  public void structs() {
    assertTrue(shallow(new Zero()));
    // a non-null string is not the zero value of its field
    assertFalse(shallow(new Filled()));
    assertTrue(recursive(new Filled()));
  }
}
