package com.fleethunt.ruleengine.evaluator;

import com.fleethunt.enums.ClientAttribute;
import com.fleethunt.model.ClientRecord;
import java.util.Collection;
import java.util.stream.Collectors;

public class ClientAttributeExtractor {

  public String extractString(ClientRecord client, ClientAttribute attribute) {
    Object raw = rawValue(client, attribute);
    if (raw == null) {
      return null;
    }
    if (raw instanceof Collection<?> values) {
      return values.stream().map(String::valueOf).collect(Collectors.joining(","));
    }
    return String.valueOf(raw);
  }

  public Long extractInteger(ClientRecord client, ClientAttribute attribute) {
    Object raw = rawValue(client, attribute);
    if (raw == null) {
      return null;
    }
    if (raw instanceof Number number) {
      return number.longValue();
    }
    try {
      return Long.parseLong(String.valueOf(raw).trim());
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  private Object rawValue(ClientRecord client, ClientAttribute attribute) {
    if (client == null || attribute == null) {
      return null;
    }
    return client.attributes().get(attribute.attributeName());
  }
}
