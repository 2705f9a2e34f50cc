package com.fleethunt.model;

import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;

/**
 * Null fields leave the corresponding hunt setting unchanged.
 */
public record ModifyHuntRequest(
    @PositiveOrZero Integer clientLimit,
    Duration expiry
) {}
