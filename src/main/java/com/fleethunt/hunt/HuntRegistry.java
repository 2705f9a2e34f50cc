package com.fleethunt.hunt;

import com.fleethunt.exception.HuntNotFoundException;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

@Component
public class HuntRegistry {

  private final Map<String, Hunt> hunts = new ConcurrentHashMap<>();

  public void register(Hunt hunt) {
    hunts.put(hunt.id(), hunt);
  }

  public Optional<Hunt> find(String huntId) {
    return huntId == null ? Optional.empty() : Optional.ofNullable(hunts.get(huntId));
  }

  public Hunt get(String huntId) {
    return find(huntId).orElseThrow(() -> new HuntNotFoundException(huntId));
  }

  public List<Hunt> all() {
    return hunts.values().stream()
        .sorted(Comparator.comparing((Hunt h) -> h.definition().createdAt())
            .thenComparing(Hunt::id))
        .toList();
  }
}
