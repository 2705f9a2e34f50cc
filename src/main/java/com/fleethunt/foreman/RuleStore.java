package com.fleethunt.foreman;

import com.fleethunt.model.ForemanRule;
import java.time.Instant;
import java.util.List;

/**
 * The foreman's active rule table. Rules are grouped by owner; publishing replaces every rule of
 * that owner.
 */
public interface RuleStore {

  void publish(String ownerId, List<ForemanRule> rules);

  void remove(String ownerId);

  List<ForemanRule> snapshot();

  List<ForemanRule> rulesOf(String ownerId);

  /** Returns the number of rules dropped. */
  int pruneExpired(Instant now);

  int size();
}
