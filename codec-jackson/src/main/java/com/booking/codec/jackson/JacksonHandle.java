package com.booking.codec.jackson;

import com.booking.codec.EncDriver;
import com.booking.codec.Encoder;
import com.booking.codec.Handle;
import com.booking.codec.TypeRegistry;
import com.fasterxml.jackson.core.JsonFactory;
import java.util.Locale;
import java.util.Objects;

/**
 * A {@link Handle} writing through the generators of a Jackson {@link JsonFactory}.
 * <p>
 * Any Jackson format can be used, for example {@code new JacksonHandle(new CBORFactory())}. Formats that handle
 * binary natively get byte strings and extension bytes as binary values and cannot take raw values.
 */
public class JacksonHandle extends Handle {
  private final JsonFactory factory;

  public JacksonHandle(JsonFactory factory) {
    this(factory, TypeRegistry.getDefault());
  }

  public JacksonHandle(JsonFactory factory, TypeRegistry typeRegistry) {
    super(factory.getFormatName().toLowerCase(Locale.ROOT), typeRegistry);
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  /** A new handle writing JSON text. */
  public static JacksonHandle json() {
    return new JacksonHandle(new JsonFactory());
  }

  public JsonFactory factory() {
    return factory;
  }

  @Override
  protected EncDriver newEncDriver(Encoder encoder) {
    return new JacksonEncDriver(this, encoder);
  }
}
