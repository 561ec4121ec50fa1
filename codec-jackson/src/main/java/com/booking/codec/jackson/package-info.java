/**
 * Jackson output adapter for the codec encoder.
 * <p>
 * {@link com.booking.codec.jackson.JacksonHandle} turns any Jackson {@link com.fasterxml.jackson.core.JsonFactory}
 * (JSON, CBOR, Smile, ...) into a {@link com.booking.codec.Handle}; {@link com.booking.codec.jackson.JacksonEncDriver}
 * does the actual writing through a {@link com.fasterxml.jackson.core.JsonGenerator}.
 */
package com.booking.codec.jackson;
