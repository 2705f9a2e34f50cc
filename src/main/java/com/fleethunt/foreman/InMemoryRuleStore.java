package com.fleethunt.foreman;

import com.fleethunt.model.ForemanRule;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Copy-on-write rule table. Readers take the current immutable map without locking, writers
 * build a new map under the instance monitor and swap it in.
 */
@Component
public class InMemoryRuleStore implements RuleStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryRuleStore.class);

  private final AtomicReference<Map<String, List<ForemanRule>>> table =
      new AtomicReference<>(Map.of());

  @Override
  public synchronized void publish(String ownerId, List<ForemanRule> rules) {
    Objects.requireNonNull(ownerId, "ownerId");
    Map<String, List<ForemanRule>> next = new LinkedHashMap<>(table.get());
    if (rules == null || rules.isEmpty()) {
      next.remove(ownerId);
    } else {
      next.put(ownerId, List.copyOf(rules));
    }
    table.set(Collections.unmodifiableMap(next));
    log.debug("Published {} rules for {}", rules == null ? 0 : rules.size(), ownerId);
  }

  @Override
  public synchronized void remove(String ownerId) {
    Map<String, List<ForemanRule>> current = table.get();
    if (!current.containsKey(ownerId)) {
      return;
    }
    Map<String, List<ForemanRule>> next = new LinkedHashMap<>(current);
    next.remove(ownerId);
    table.set(Collections.unmodifiableMap(next));
    log.debug("Removed rules for {}", ownerId);
  }

  @Override
  public List<ForemanRule> snapshot() {
    List<ForemanRule> all = new ArrayList<>();
    for (List<ForemanRule> rules : table.get().values()) {
      all.addAll(rules);
    }
    return all;
  }

  @Override
  public List<ForemanRule> rulesOf(String ownerId) {
    return table.get().getOrDefault(ownerId, List.of());
  }

  @Override
  public synchronized int pruneExpired(Instant now) {
    Map<String, List<ForemanRule>> next = new LinkedHashMap<>();
    int dropped = 0;
    for (Map.Entry<String, List<ForemanRule>> entry : table.get().entrySet()) {
      List<ForemanRule> live = entry.getValue().stream()
          .filter(rule -> !rule.isExpired(now))
          .toList();
      dropped += entry.getValue().size() - live.size();
      if (!live.isEmpty()) {
        next.put(entry.getKey(), live);
      }
    }
    if (dropped > 0) {
      table.set(Collections.unmodifiableMap(next));
      log.info("Pruned {} expired foreman rules", dropped);
    }
    return dropped;
  }

  @Override
  public int size() {
    int count = 0;
    for (List<ForemanRule> rules : table.get().values()) {
      count += rules.size();
    }
    return count;
  }
}
