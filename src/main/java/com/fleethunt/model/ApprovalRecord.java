package com.fleethunt.model;

import com.fleethunt.enums.ApprovalState;
import com.fleethunt.enums.ProtectedAction;
import java.time.Instant;
import java.util.Set;

public record ApprovalRecord(
    String id,
    String huntId,
    String requester,
    String approver,
    String reason,
    Set<ProtectedAction> actions,
    ApprovalState state,
    String grantedBy,
    Instant requestedAt,
    Instant grantedAt
) {

  public ApprovalRecord {
    actions = actions == null ? Set.of() : Set.copyOf(actions);
  }

  public ApprovalRecord granted(String by, Instant at) {
    return new ApprovalRecord(id, huntId, requester, approver, reason, actions,
        ApprovalState.GRANTED, by, requestedAt, at);
  }

  public boolean covers(ProtectedAction action) {
    return actions.contains(action);
  }
}
