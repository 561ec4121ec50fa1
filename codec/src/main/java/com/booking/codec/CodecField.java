package com.booking.codec;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Encoding options of a struct field. Takes precedence over Jackson's {@code @JsonProperty},
 * {@code @JsonIgnore} and {@code @JsonInclude} on the same field.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.RECORD_COMPONENT})
public @interface CodecField {
  /** Encoded key, defaults to the field name. {@code "-"} excludes the field. */
  String value() default "";

  /** Skip the field in map mode when its value is empty. */
  boolean omitEmpty() default false;

  /** Flatten the fields of this (struct typed) field into the enclosing struct. */
  boolean inline() default false;
}
