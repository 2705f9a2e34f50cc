package com.fleethunt.store;

import com.fleethunt.model.AttributeValue;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "hunt.persistence.enabled", havingValue = "false")
public class InMemoryAttributeStore implements AttributeStore {

  private final Clock clock;
  private final Map<String, Map<String, List<AttributeValue<Object>>>> subjects =
      new ConcurrentHashMap<>();

  public InMemoryAttributeStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public boolean exists(String subject) {
    return subjects.containsKey(subject);
  }

  @Override
  public List<String> subjects() {
    return subjects.keySet().stream().sorted().toList();
  }

  @Override
  public void set(String subject, String attribute, Object value) {
    List<AttributeValue<Object>> log = log(subject, attribute);
    synchronized (log) {
      log.clear();
      log.add(new AttributeValue<>(value, clock.instant()));
    }
  }

  @Override
  public void append(String subject, String attribute, Object value) {
    List<AttributeValue<Object>> log = log(subject, attribute);
    synchronized (log) {
      log.add(new AttributeValue<>(value, clock.instant()));
    }
  }

  @Override
  public <T> List<AttributeValue<T>> history(String subject, String attribute, Class<T> type) {
    Map<String, List<AttributeValue<Object>>> attributes = subjects.get(subject);
    if (attributes == null) {
      return List.of();
    }
    List<AttributeValue<Object>> log = attributes.get(attribute);
    if (log == null) {
      return List.of();
    }
    List<AttributeValue<T>> result = new ArrayList<>();
    synchronized (log) {
      for (AttributeValue<Object> entry : log) {
        result.add(new AttributeValue<>(type.cast(entry.value()), entry.recordedAt()));
      }
    }
    return result;
  }

  private List<AttributeValue<Object>> log(String subject, String attribute) {
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(attribute, "attribute");
    return subjects
        .computeIfAbsent(subject, s -> new ConcurrentHashMap<>())
        .computeIfAbsent(attribute, a -> new ArrayList<>());
  }
}
