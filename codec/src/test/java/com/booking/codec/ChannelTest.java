package com.booking.codec;

import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

public class ChannelTest {
  @Rule
  public ExpectedException exceptionRule = ExpectedException.none();

  @Test
  public void views() {
    Channel<String> channel = new Channel<>(String.class);
    Channel<String> receiver = channel.receiveOnly();
    Channel<String> sender = channel.sendOnly();

    assertThat(channel.direction(), equalTo(Channel.Direction.BOTH));
    assertThat(receiver.direction(), equalTo(Channel.Direction.RECEIVE));
    assertThat(sender.direction(), equalTo(Channel.Direction.SEND));
    assertFalse(receiver.canSend());
    assertFalse(sender.canReceive());

    assertFalse(receiver.isClosed());
    sender.close();
    assertTrue(channel.isClosed());
    assertTrue(receiver.isClosed());
  }

  @Test
  public void sendOnReceiveOnly() {
    exceptionRule.expect(IllegalStateException.class);
    exceptionRule.expectMessage("Send on a receive-only channel");

    new Channel<>(String.class).receiveOnly().send("a");
  }

  @Test
  public void sendAfterClose() {
    Channel<String> channel = new Channel<>(String.class);
    channel.close();

    exceptionRule.expect(IllegalStateException.class);
    exceptionRule.expectMessage("Send on a closed channel");

    channel.send("a");
  }

  @Test
  public void sendsRacingCloseAreNotLost() throws Exception {
    Channel<Integer> channel = new Channel<>(Integer.class);
    AtomicInteger sent = new AtomicInteger();
    AtomicReference<String> failure = new AtomicReference<>();
    CountDownLatch started = new CountDownLatch(1);
    Thread producer = new Thread(() -> {
      started.countDown();
      try {
        for (int i = 0; ; i++) {
          channel.send(i);
          sent.incrementAndGet();
        }
      } catch (IllegalStateException e) {
        failure.set(e.getMessage());
      }
    });
    producer.start();
    started.await();
    Thread.sleep(5);
    channel.close();
    producer.join();
    assertThat(failure.get(), equalTo("Send on a closed channel"));

    Encoder encoder = Encoder.forBytes(new RecordingHandle(),
        new EncoderOptions().chanRecvTimeout(Duration.ofSeconds(-1)));
    encoder.encode(channel);

    assertThat(TestUtils.text(encoder).startsWith("[" + sent.get() + " "), equalTo(true));
  }
}
