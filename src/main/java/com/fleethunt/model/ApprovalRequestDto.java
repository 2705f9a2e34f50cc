package com.fleethunt.model;

import com.fleethunt.enums.ProtectedAction;
import jakarta.validation.constraints.NotBlank;
import java.util.Set;

public record ApprovalRequestDto(
    @NotBlank String approver,
    @NotBlank String reason,
    Set<ProtectedAction> actions
) {}
