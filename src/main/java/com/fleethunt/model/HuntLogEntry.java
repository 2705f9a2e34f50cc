package com.fleethunt.model;

import java.time.Instant;

public record HuntLogEntry(
    String clientId,
    String message,
    Instant timestamp
) {}
