package com.fleethunt.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;

public record CreateHuntRequest(
    @NotBlank String name,
    String description,
    @PositiveOrZero Integer clientLimit,
    Duration expiry,
    String notificationEvent
) {}
