package com.fleethunt.approval;

import com.fleethunt.enums.ApprovalState;
import com.fleethunt.enums.ProtectedAction;
import com.fleethunt.exception.AuthorizationException;
import com.fleethunt.exception.ValidationException;
import com.fleethunt.model.Actor;
import com.fleethunt.model.ApprovalRecord;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Two-party approval for hunt lifecycle transitions. A user asks for approval with a reason; a
 * different user grants it by quoting the same reason. Until then the requester may not run,
 * pause, modify or stop the hunt unless acting as supervisor.
 */
@Component
public class ApprovalGate {

  private static final Logger log = LoggerFactory.getLogger(ApprovalGate.class);

  private final boolean required;
  private final Duration lifetime;
  private final Clock clock;

  // huntId -> approvals for that hunt
  private final Map<String, List<ApprovalRecord>> approvals = new ConcurrentHashMap<>();

  public ApprovalGate(@Value("${hunt.approval.required:true}") boolean required,
                      @Value("${hunt.approval.lifetime:P28D}") Duration lifetime,
                      Clock clock) {
    this.required = required;
    this.lifetime = lifetime;
    this.clock = clock;
  }

  public ApprovalRecord request(String huntId, String requester, String approver, String reason,
                                Set<ProtectedAction> actions) {
    requireText(huntId, "Hunt id");
    requireText(requester, "Requester");
    requireText(reason, "Approval reason");
    if (approver != null && approver.equals(requester)) {
      throw new ValidationException("User '" + requester + "' cannot approve their own request");
    }
    Set<ProtectedAction> covered = actions == null || actions.isEmpty()
        ? EnumSet.allOf(ProtectedAction.class)
        : EnumSet.copyOf(actions);

    List<ApprovalRecord> records = recordsOf(huntId);
    synchronized (records) {
      for (ApprovalRecord existing : records) {
        if (existing.requester().equals(requester) && existing.reason().equals(reason)) {
          return existing;
        }
      }
      ApprovalRecord record = new ApprovalRecord(UUID.randomUUID().toString(), huntId, requester,
          approver, reason, covered, ApprovalState.REQUESTED, null, clock.instant(), null);
      records.add(record);
      log.info("User {} requested approval on hunt {} from {}: {}",
          requester, huntId, approver, reason);
      return record;
    }
  }

  public ApprovalRecord grant(String huntId, String approver, String requester, String reason) {
    requireText(approver, "Approver");
    requireText(reason, "Approval reason");
    if (approver.equals(requester)) {
      throw new ValidationException("User '" + approver + "' cannot approve their own request");
    }
    List<ApprovalRecord> records = recordsOf(huntId);
    synchronized (records) {
      for (int i = 0; i < records.size(); i++) {
        ApprovalRecord record = records.get(i);
        if (!record.requester().equals(requester) || !record.reason().equals(reason)) {
          continue;
        }
        if (record.state() == ApprovalState.GRANTED) {
          return record;
        }
        ApprovalRecord granted = record.granted(approver, clock.instant());
        records.set(i, granted);
        log.info("User {} granted approval on hunt {} to {}", approver, huntId, requester);
        return granted;
      }
    }
    throw new ValidationException("No approval request by '" + requester + "' on hunt "
        + huntId + " with reason '" + reason + "'");
  }

  /**
   * Throws {@link AuthorizationException} unless the actor may perform the action on the hunt.
   */
  public void check(String huntId, Actor actor, ProtectedAction action) {
    if (!required || actor.supervisor()) {
      return;
    }
    Instant now = clock.instant();
    for (ApprovalRecord record : list(huntId)) {
      if (record.state() == ApprovalState.GRANTED
          && record.requester().equals(actor.username())
          && record.covers(action)
          && now.isBefore(record.grantedAt().plus(lifetime))) {
        return;
      }
    }
    log.warn("Denied {} on hunt {} for user {}: no granted approval", action, huntId,
        actor.username());
    throw new AuthorizationException(huntId, actor.username(), action);
  }

  /**
   * Most advanced state of the requester's approvals on the hunt.
   */
  public ApprovalState state(String huntId, String requester) {
    ApprovalState state = ApprovalState.UNREQUESTED;
    for (ApprovalRecord record : list(huntId)) {
      if (!record.requester().equals(requester)) {
        continue;
      }
      if (record.state() == ApprovalState.GRANTED) {
        return ApprovalState.GRANTED;
      }
      state = ApprovalState.REQUESTED;
    }
    return state;
  }

  public List<ApprovalRecord> list(String huntId) {
    List<ApprovalRecord> records = approvals.get(huntId);
    if (records == null) {
      return List.of();
    }
    List<ApprovalRecord> copy;
    synchronized (records) {
      copy = new ArrayList<>(records);
    }
    copy.sort(Comparator.comparing(ApprovalRecord::requestedAt));
    return copy;
  }

  private List<ApprovalRecord> recordsOf(String huntId) {
    return approvals.computeIfAbsent(huntId, id -> new ArrayList<>());
  }

  private static void requireText(String value, String what) {
    if (value == null || value.isBlank()) {
      throw new ValidationException(what + " must not be blank");
    }
  }
}
