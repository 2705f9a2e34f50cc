package com.fleethunt.enums;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Client attributes that foreman rules may reference, keyed by the name agents report them under.
 */
public enum ClientAttribute {
  CLIENT_NAME("Client Name", ValueType.STRING),
  CLIENT_VERSION("Client Version", ValueType.STRING),
  HOSTNAME("Host", ValueType.STRING),
  FQDN("FQDN", ValueType.STRING),
  SYSTEM("System", ValueType.STRING),
  RELEASE("Release", ValueType.STRING),
  OS_VERSION("Version", ValueType.STRING),
  ARCHITECTURE("Architecture", ValueType.STRING),
  USERNAMES("Usernames", ValueType.STRING),
  MAC_ADDRESS("MAC Address", ValueType.STRING),
  LABELS("Labels", ValueType.STRING),
  CLOCK("Clock", ValueType.INTEGER),
  INSTALL_TIME("Install Time", ValueType.INTEGER),
  LAST_BOOT_TIME("Last Boot Time", ValueType.INTEGER),
  FIRST_SEEN("First Seen", ValueType.INTEGER),
  PING("Ping", ValueType.INTEGER);

  public enum ValueType {
    STRING,
    INTEGER
  }

  private static final Map<String, ClientAttribute> BY_NAME = Arrays.stream(values())
      .collect(Collectors.toUnmodifiableMap(ClientAttribute::attributeName, Function.identity()));

  private final String attributeName;
  private final ValueType valueType;

  ClientAttribute(String attributeName, ValueType valueType) {
    this.attributeName = attributeName;
    this.valueType = valueType;
  }

  public String attributeName() {
    return attributeName;
  }

  public ValueType valueType() {
    return valueType;
  }

  public static Optional<ClientAttribute> fromAttributeName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_NAME.get(name));
  }
}
