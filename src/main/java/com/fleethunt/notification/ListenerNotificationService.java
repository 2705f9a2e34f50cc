package com.fleethunt.notification;

import com.fleethunt.model.HuntNotification;
import com.fleethunt.model.Outcome;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Logs every hunt notification, keeps it in the {@link NotificationBuffer} and hands it to the
 * listeners registered for its event name. A failing listener is logged and skipped.
 */
@Service
public class ListenerNotificationService implements NotificationService {

  private static final Logger log = LoggerFactory.getLogger(ListenerNotificationService.class);

  private final NotificationBuffer buffer;
  private final Map<String, List<HuntEventListener>> listeners = new ConcurrentHashMap<>();

  public ListenerNotificationService(NotificationBuffer buffer) {
    this.buffer = buffer;
  }

  public void register(String eventName, HuntEventListener listener) {
    listeners.computeIfAbsent(eventName, name -> new CopyOnWriteArrayList<>()).add(listener);
  }

  @Override
  public void publish(String eventName, HuntNotification notification) {
    Outcome outcome = notification.outcome();
    log.warn(
        "HUNT NOTIFICATION: event={}, huntId={}, huntName={}, clientId={}, outcome={}",
        eventName,
        notification.huntId(),
        notification.huntName(),
        notification.clientId(),
        outcome != null ? outcome.type() : null
    );

    Map<String, Object> details = new HashMap<>();
    details.put("huntName", notification.huntName() != null ? notification.huntName() : "N/A");
    if (outcome != null && outcome.message() != null) {
      details.put("message", outcome.message());
    }
    buffer.push(new NotificationRecord(
        UUID.randomUUID().toString(),
        notification.timestamp() != null ? notification.timestamp() : Instant.now(),
        eventName,
        notification.huntId(),
        notification.clientId(),
        "Client " + notification.clientId() + " finished with "
            + (outcome != null ? outcome.type() : "no outcome"),
        details
    ));

    for (HuntEventListener listener : listeners.getOrDefault(eventName, List.of())) {
      try {
        listener.onEvent(eventName, notification);
      } catch (Exception e) {
        log.error("Listener for event {} failed on hunt {} client {}",
            eventName, notification.huntId(), notification.clientId(), e);
      }
    }
  }
}
