package com.fleethunt.controller;

import java.time.Instant;

public record ErrorPayload(
    Instant timestamp,
    int status,
    String error,
    String message,
    String path
) {}
