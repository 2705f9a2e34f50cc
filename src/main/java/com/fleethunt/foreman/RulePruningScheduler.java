package com.fleethunt.foreman;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class RulePruningScheduler {

  private static final Logger log = LoggerFactory.getLogger(RulePruningScheduler.class);

  private final RuleStore ruleStore;
  private final Clock clock;

  public RulePruningScheduler(RuleStore ruleStore, Clock clock) {
    this.ruleStore = ruleStore;
    this.clock = clock;
  }

  @Scheduled(fixedDelayString = "${hunt.foreman.prune-interval-ms:60000}")
  public void pruneExpiredRules() {
    log.debug("Pruning expired foreman rules");
    try {
      ruleStore.pruneExpired(clock.instant());
    } catch (Exception e) {
      log.error("Rule pruning failed", e);
    }
  }
}
