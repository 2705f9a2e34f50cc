package com.fleethunt.notification;

import java.time.Instant;
import java.util.Map;

public record NotificationRecord(
    String id,
    Instant timestamp,
    String eventName,
    String huntId,
    String clientId,
    String message,
    Map<String, Object> details
) {}
