package com.fleethunt.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Report posted by the task-execution layer when a dispatched task finishes.
 * {@code usage} may be null when the agent sent no resource accounting.
 */
public record TaskCompletion(
    String huntId,
    @NotBlank String clientId,
    String taskId,
    @Valid @NotNull Outcome outcome,
    ResourceSample usage
) {}
