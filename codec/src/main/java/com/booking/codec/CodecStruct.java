package com.booking.codec;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/** Per class encoding options of a struct. */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface CodecStruct {
  /** Always encode as an array of fields in declaration order. */
  boolean toArray() default false;

  /** Treat every field as omit-empty. */
  boolean omitEmpty() default false;

  KeyType keyType() default KeyType.STRING;
}
