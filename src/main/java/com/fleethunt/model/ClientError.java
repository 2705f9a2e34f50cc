package com.fleethunt.model;

import java.time.Instant;

public record ClientError(
    String clientId,
    String message,
    String backtrace,
    Instant timestamp
) {}
