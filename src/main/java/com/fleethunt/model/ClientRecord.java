package com.fleethunt.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Snapshot of an agent's reported attributes at check-in, keyed by attribute name.
 */
public record ClientRecord(
    String clientId,
    Map<String, Object> attributes
) {

  public ClientRecord {
    attributes = attributes == null
        ? Map.of()
        : Collections.unmodifiableMap(new HashMap<>(attributes));
  }
}
