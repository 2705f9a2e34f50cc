package com.fleethunt.model;

import java.time.Instant;

public record AttributeValue<T>(
    T value,
    Instant recordedAt
) {}
