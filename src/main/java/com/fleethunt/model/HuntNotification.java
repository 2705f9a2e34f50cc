package com.fleethunt.model;

import java.time.Instant;

public record HuntNotification(
    String huntId,
    String huntName,
    String clientId,
    Outcome outcome,
    Instant timestamp
) {}
