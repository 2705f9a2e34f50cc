package com.fleethunt.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Bounded history of hunt notifications, newest first, also streamed to SSE subscribers.
 * A subscriber may follow one hunt or, with a null hunt id, every hunt.
 */
@Component
public class NotificationBuffer {

  private static final Logger log = LoggerFactory.getLogger(NotificationBuffer.class);

  private final Deque<NotificationRecord> recent = new ConcurrentLinkedDeque<>();
  private final List<Subscriber> subscribers = new CopyOnWriteArrayList<>();
  private final ObjectMapper objectMapper;
  private final int capacity;

  public NotificationBuffer(ObjectMapper objectMapper,
                            @Value("${hunt.notifications.buffer-size:100}") int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("Notification buffer size must be positive: " + capacity);
    }
    this.objectMapper = objectMapper;
    this.capacity = capacity;
  }

  public void push(NotificationRecord record) {
    recent.addFirst(record);
    while (recent.size() > capacity) {
      recent.pollLast();
    }
    broadcast(record);
  }

  public List<NotificationRecord> recent() {
    return new ArrayList<>(recent);
  }

  public List<NotificationRecord> recent(String huntId) {
    if (huntId == null) {
      return recent();
    }
    return recent.stream().filter(r -> huntId.equals(r.huntId())).toList();
  }

  public SseEmitter subscribe(String huntId) {
    SseEmitter emitter = new SseEmitter(0L);
    Subscriber subscriber = new Subscriber(huntId, emitter);
    subscribers.add(subscriber);
    emitter.onCompletion(() -> subscribers.remove(subscriber));
    emitter.onTimeout(() -> subscribers.remove(subscriber));
    emitter.onError(e -> subscribers.remove(subscriber));
    return emitter;
  }

  int subscriberCount() {
    return subscribers.size();
  }

  private void broadcast(NotificationRecord record) {
    if (subscribers.isEmpty()) {
      return;
    }
    String json;
    try {
      json = objectMapper.writeValueAsString(record);
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize notification {} for hunt {}", record.id(), record.huntId(), e);
      return;
    }

    for (Subscriber subscriber : subscribers) {
      if (!subscriber.follows(record.huntId())) {
        continue;
      }
      try {
        subscriber.emitter().send(SseEmitter.event()
            .id(record.id())
            .name(record.eventName())
            .data(json));
      } catch (Exception e) {
        log.debug("Dropping notification subscriber for hunt {}: {}",
            subscriber.huntId(), e.getMessage());
        subscribers.remove(subscriber);
      }
    }
  }

  private record Subscriber(String huntId, SseEmitter emitter) {

    boolean follows(String notificationHuntId) {
      return huntId == null || huntId.equals(notificationHuntId);
    }
  }
}
