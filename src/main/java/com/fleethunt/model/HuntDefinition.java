package com.fleethunt.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Persisted description of a hunt. A new version is written whenever the hunt is modified.
 */
public record HuntDefinition(
    String id,
    String name,
    String creator,
    String description,
    Instant createdAt,
    int clientLimit,
    Duration expiry,
    String notificationEvent,
    List<RuleGroup> ruleGroups
) {

  public HuntDefinition {
    ruleGroups = ruleGroups == null ? List.of() : List.copyOf(ruleGroups);
  }

  public HuntDefinition withRuleGroups(List<RuleGroup> groups) {
    return new HuntDefinition(id, name, creator, description, createdAt, clientLimit, expiry,
        notificationEvent, groups);
  }

  public HuntDefinition withLimits(int newClientLimit, Duration newExpiry) {
    return new HuntDefinition(id, name, creator, description, createdAt, newClientLimit, newExpiry,
        notificationEvent, ruleGroups);
  }
}
