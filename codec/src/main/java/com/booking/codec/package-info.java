/**
 * Format agnostic encoding of arbitrary values.
 * <p>
 * The main entry point is {@link com.booking.codec.Encoder}, which walks a value (scalars, arrays, collections,
 * maps, records and other objects, pointer wrappers and {@link com.booking.codec.Channel}s) and drives the
 * {@link com.booking.codec.EncDriver} of a {@link com.booking.codec.Handle}. The handle decides the wire format
 * and caches how each class is encoded.
 * <p>
 * See {@code com.booking.codec.jackson.JacksonHandle} for a handle writing JSON, CBOR and other Jackson
 * supported formats.
 */
package com.booking.codec;
