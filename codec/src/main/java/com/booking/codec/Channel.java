package com.booking.codec;

import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An unbounded, closeable queue of elements that an {@link Encoder} drains and encodes as a sequence.
 * <p>
 * {@link #receiveOnly()} and {@link #sendOnly()} return views sharing the same queue with restricted direction.
 * Encoding a send-only view fails. How long the encoder waits for elements is controlled by
 * {@link EncoderOptions#chanRecvTimeout()}.
 * <p>
 * Subclasses may implement {@link MapBySlice} to have their elements encoded as alternating keys and values.
 *
 * @param <E> element type
 */
public class Channel<E> {
  static final Object NIL = new Object();
  static final Object CLOSED = new Object();

  public enum Direction {
    BOTH, RECEIVE, SEND
  }

  private final Class<E> elementType;
  private final LinkedBlockingQueue<Object> queue;
  private final AtomicBoolean closed;
  private final Direction direction;

  public Channel(Class<E> elementType) {
    this.elementType = Objects.requireNonNull(elementType, "elementType");
    this.queue = new LinkedBlockingQueue<>();
    this.closed = new AtomicBoolean();
    this.direction = Direction.BOTH;
  }

  protected Channel(Channel<E> source, Direction direction) {
    this.elementType = source.elementType;
    this.queue = source.queue;
    this.closed = source.closed;
    this.direction = direction;
  }

  public Class<E> elementType() {
    return elementType;
  }

  public Direction direction() {
    return direction;
  }

  public boolean canReceive() {
    return direction != Direction.SEND;
  }

  public boolean canSend() {
    return direction != Direction.RECEIVE;
  }

  public boolean isClosed() {
    return closed.get();
  }

  public Channel<E> receiveOnly() {
    return new Channel<>(this, Direction.RECEIVE);
  }

  public Channel<E> sendOnly() {
    return new Channel<>(this, Direction.SEND);
  }

  /** Enqueue an element, {@code null} included. Never blocks. */
  public void send(E element) {
    if (!canSend()) {
      throw new IllegalStateException("Send on a receive-only channel");
    }
    // under the lock close() takes, so nothing is queued behind the close marker
    synchronized (queue) {
      if (closed.get()) {
        throw new IllegalStateException("Send on a closed channel");
      }
      queue.add(element == null ? NIL : element);
    }
  }

  /**
   * Mark the end of the elements. Elements sent before closing are still received.
   */
  public void close() {
    synchronized (queue) {
      if (closed.compareAndSet(false, true)) {
        queue.add(CLOSED);
      }
    }
  }

  /** Next token without waiting: an element, {@link #NIL}, {@link #CLOSED}, or {@code null} if none is ready. */
  Object pollRaw() {
    return keepClosed(queue.poll());
  }

  Object pollRaw(long timeout, TimeUnit unit) throws InterruptedException {
    return keepClosed(queue.poll(timeout, unit));
  }

  Object takeRaw() throws InterruptedException {
    return keepClosed(queue.take());
  }

  // the close marker stays queued for every later receiver
  private Object keepClosed(Object token) {
    if (token == CLOSED) {
      queue.add(CLOSED);
    }
    return token;
  }
}
