package com.fleethunt.foreman;

import com.fleethunt.model.ForemanAction;
import com.fleethunt.model.ForemanRule;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryRuleStoreTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

  private static ForemanRule rule(String owner, Instant expires) {
    return new ForemanRule(owner, owner, NOW, expires, List.of(), List.of(),
        List.of(new ForemanAction(owner, owner)));
  }

  @Test
  void publishReplacesOwnersRules() {
    InMemoryRuleStore store = new InMemoryRuleStore();
    store.publish("H:1", List.of(rule("H:1", null), rule("H:1", null)));
    store.publish("H:1", List.of(rule("H:1", null)));
    store.publish("H:2", List.of(rule("H:2", null)));

    assertThat(store.rulesOf("H:1")).hasSize(1);
    assertThat(store.size()).isEqualTo(2);
  }

  @Test
  void removeIsIdempotent() {
    InMemoryRuleStore store = new InMemoryRuleStore();
    store.publish("H:1", List.of(rule("H:1", null)));

    store.remove("H:1");
    store.remove("H:1");

    assertThat(store.snapshot()).isEmpty();
  }

  @Test
  void pruneDropsOnlyExpiredRules() {
    InMemoryRuleStore store = new InMemoryRuleStore();
    store.publish("H:1",
        List.of(rule("H:1", NOW.plusSeconds(10)), rule("H:1", NOW.plusSeconds(100))));
    store.publish("H:2", List.of(rule("H:2", NOW.plusSeconds(5))));

    int dropped = store.pruneExpired(NOW.plusSeconds(10));

    assertThat(dropped).isEqualTo(2);
    assertThat(store.rulesOf("H:1")).hasSize(1);
    assertThat(store.rulesOf("H:2")).isEmpty();
  }

  @Test
  void readersNeverSeePartialGroups() throws Exception {
    InMemoryRuleStore store = new InMemoryRuleStore();
    List<ForemanRule> group = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      group.add(rule("H:1", null));
    }
    AtomicBoolean partial = new AtomicBoolean();
    ExecutorService pool = Executors.newFixedThreadPool(2);
    pool.submit(() -> {
      for (int i = 0; i < 2000; i++) {
        store.publish("H:1", group);
        store.remove("H:1");
      }
    });
    pool.submit(() -> {
      for (int i = 0; i < 2000; i++) {
        int size = store.snapshot().size();
        if (size != 0 && size != 5) {
          partial.set(true);
        }
      }
    });
    pool.shutdown();
    assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

    assertThat(partial).isFalse();
  }
}
