package com.booking.codec;

/**
 * Optional {@link EncDriver} extension notified before every element of a container.
 * <p>
 * {@link Encoder#containerState()} tells the first element apart: it is {@link Encoder#CONTAINER_ARRAY_START}
 * or {@link Encoder#CONTAINER_MAP_START} there, and the state left by the previous element afterwards.
 */
public interface ContainerTracker {
  void writeArrayElem();

  void writeMapElemKey();

  void writeMapElemValue();
}
