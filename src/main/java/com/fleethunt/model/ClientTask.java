package com.fleethunt.model;

import java.time.Instant;

public record ClientTask(
    String taskId,
    String huntId,
    String clientId,
    int clientLimit,
    Instant issuedAt
) {}
