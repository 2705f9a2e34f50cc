package com.fleethunt.model;

import java.time.Instant;
import java.util.List;

/**
 * A rule group as published to the foreman's active table.
 */
public record ForemanRule(
    String ownerId,
    String description,
    Instant created,
    Instant expires,
    List<RegexCondition> regexRules,
    List<IntegerCondition> integerRules,
    List<ForemanAction> actions
) {

  public ForemanRule {
    regexRules = regexRules == null ? List.of() : List.copyOf(regexRules);
    integerRules = integerRules == null ? List.of() : List.copyOf(integerRules);
    actions = actions == null ? List.of() : List.copyOf(actions);
  }

  public boolean isExpired(Instant now) {
    return expires != null && !now.isBefore(expires);
  }
}
