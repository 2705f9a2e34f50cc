package com.fleethunt.model;

import jakarta.validation.constraints.NotBlank;

public record ApprovalGrantDto(
    @NotBlank String requester,
    @NotBlank String reason
) {}
