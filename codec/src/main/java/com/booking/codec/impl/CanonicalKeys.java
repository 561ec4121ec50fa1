package com.booking.codec.impl;

import com.google.common.primitives.UnsignedBytes;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Comparator;
import java.util.Date;

/** Orderings used for canonical output. */
public final class CanonicalKeys {
  /** Unsigned lexicographic order of byte strings. */
  public static final Comparator<byte[]> BYTES = UnsignedBytes.lexicographicalComparator();

  /** Order of the UTF-8 encoded forms. */
  public static final Comparator<String> UTF8 =
      (a, b) -> BYTES.compare(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));

  /** Chronological order of the supported time types. */
  public static final Comparator<Object> TIME = Comparator.comparing(CanonicalKeys::toInstant);

  private CanonicalKeys() {
  }

  public static Instant toInstant(Object time) {
    if (time instanceof Instant) {
      return (Instant) time;
    } else if (time instanceof Date) {
      return ((Date) time).toInstant();
    } else if (time instanceof OffsetDateTime) {
      return ((OffsetDateTime) time).toInstant();
    } else if (time instanceof ZonedDateTime) {
      return ((ZonedDateTime) time).toInstant();
    }
    throw new IllegalArgumentException("Not a time value: " + time.getClass().getName());
  }
}
