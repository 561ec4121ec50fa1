package com.booking.codec;

import java.util.Map;

/**
 * A struct carrying fields not declared on its class. The returned entries are encoded after the declared
 * fields; such a struct is always encoded as a map.
 */
public interface MissingFielder {
  Map<String, Object> codecMissingFields();
}
