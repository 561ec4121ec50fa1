package com.booking.codec;

import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertThat;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

public class ByteArrayTest {
  @Rule
  public ExpectedException exceptionRule = ExpectedException.none();

  @Test
  public void growsByHalf() {
    ByteArray bytes = new ByteArray(4);
    bytes.append(new byte[] {1, 2, 3, 4, 5, 6, 7, 8, 9, 10}, 0, 10);

    assertThat(bytes.length, equalTo(10));
    assertThat(bytes.array.length, equalTo(16));
    assertThat(ByteArray.grownCapacity(100), equalTo(150));
  }

  @Test
  public void growthStopsAtMaxCapacity() {
    assertThat(ByteArray.grownCapacity(1_500_000_000L), equalTo(ByteArray.MAX_CAPACITY));
    assertThat(ByteArray.grownCapacity(ByteArray.MAX_CAPACITY), equalTo(ByteArray.MAX_CAPACITY));
  }

  @Test
  public void tooLarge() {
    exceptionRule.expect(OutOfMemoryError.class);
    exceptionRule.expectMessage("exceeds " + ByteArray.MAX_CAPACITY);

    new ByteArray(16).ensureAvailable(Integer.MAX_VALUE);
  }
}
