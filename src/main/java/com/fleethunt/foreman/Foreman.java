package com.fleethunt.foreman;

import com.fleethunt.hunt.Hunt;
import com.fleethunt.hunt.HuntRegistry;
import com.fleethunt.model.ClientRecord;
import com.fleethunt.model.ForemanAction;
import com.fleethunt.model.ForemanRule;
import com.fleethunt.ruleengine.evaluator.ForemanRuleEvaluator;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Matches a checking-in client against the active rule table and starts every hunt whose rule
 * fires. Holds no lock of its own; each hunt serializes its own cap and assignment bookkeeping.
 */
@Component
public class Foreman {

  private static final Logger log = LoggerFactory.getLogger(Foreman.class);

  private final RuleStore ruleStore;
  private final HuntRegistry huntRegistry;
  private final ForemanRuleEvaluator evaluator;
  private final Clock clock;

  public Foreman(RuleStore ruleStore,
                 HuntRegistry huntRegistry,
                 ForemanRuleEvaluator evaluator,
                 Clock clock) {
    this.ruleStore = ruleStore;
    this.huntRegistry = huntRegistry;
    this.evaluator = evaluator;
    this.clock = clock;
  }

  /**
   * @return the number of hunts newly dispatched to this client
   */
  public int assignTasksToClient(ClientRecord client) {
    Instant now = clock.instant();
    boolean sawExpired = false;
    int dispatched = 0;

    for (ForemanRule rule : ruleStore.snapshot()) {
      if (rule.isExpired(now)) {
        sawExpired = true;
        continue;
      }
      if (!evaluator.matches(rule, client)) {
        continue;
      }
      for (ForemanAction action : rule.actions()) {
        Optional<Hunt> hunt = huntRegistry.find(action.huntId());
        if (hunt.isEmpty()) {
          log.debug("Rule owned by {} points at unknown hunt {}", rule.ownerId(), action.huntId());
          continue;
        }
        if (hunt.get().tryStartClient(client.clientId())) {
          dispatched++;
        }
      }
    }

    if (sawExpired) {
      ruleStore.pruneExpired(now);
    }
    if (dispatched > 0) {
      log.info("Client {} dispatched to {} hunt(s)", client.clientId(), dispatched);
    }
    return dispatched;
  }
}
