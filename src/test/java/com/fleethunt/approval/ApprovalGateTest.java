package com.fleethunt.approval;

import com.fleethunt.MutableClock;
import com.fleethunt.enums.ApprovalState;
import com.fleethunt.enums.ProtectedAction;
import com.fleethunt.exception.AuthorizationException;
import com.fleethunt.exception.ValidationException;
import com.fleethunt.model.Actor;
import com.fleethunt.model.ApprovalRecord;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApprovalGateTest {

  private MutableClock clock;
  private ApprovalGate gate;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-03-01T00:00:00Z"));
    gate = new ApprovalGate(true, Duration.ofDays(28), clock);
  }

  @Test
  void runRequiresGrantedApproval() {
    Actor alice = Actor.user("alice");

    assertThatThrownBy(() -> gate.check("H:1", alice, ProtectedAction.RUN))
        .isInstanceOf(AuthorizationException.class)
        .hasMessageContaining("Approval required");

    gate.request("H:1", "alice", "bob", "incident 42", null);
    assertThat(gate.state("H:1", "alice")).isEqualTo(ApprovalState.REQUESTED);
    assertThatThrownBy(() -> gate.check("H:1", alice, ProtectedAction.RUN))
        .isInstanceOf(AuthorizationException.class);

    ApprovalRecord granted = gate.grant("H:1", "bob", "alice", "incident 42");

    assertThat(granted.state()).isEqualTo(ApprovalState.GRANTED);
    assertThat(granted.grantedBy()).isEqualTo("bob");
    assertThat(gate.state("H:1", "alice")).isEqualTo(ApprovalState.GRANTED);
    assertThatCode(() -> gate.check("H:1", alice, ProtectedAction.RUN)).doesNotThrowAnyException();
  }

  @Test
  void supervisorBypassesApproval() {
    assertThatCode(() -> gate.check("H:1", Actor.supervisor("root"), ProtectedAction.STOP))
        .doesNotThrowAnyException();
  }

  @Test
  void disabledGatePassesEveryone() {
    ApprovalGate open = new ApprovalGate(false, Duration.ofDays(28), clock);

    assertThatCode(() -> open.check("H:1", Actor.user("alice"), ProtectedAction.RUN))
        .doesNotThrowAnyException();
  }

  @Test
  void requesterCannotApproveThemselves() {
    assertThatThrownBy(() -> gate.request("H:1", "alice", "alice", "why", null))
        .isInstanceOf(ValidationException.class);

    gate.request("H:1", "alice", "bob", "why", null);
    assertThatThrownBy(() -> gate.grant("H:1", "alice", "alice", "why"))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void blankReasonIsRejected() {
    assertThatThrownBy(() -> gate.request("H:1", "alice", "bob", "  ", null))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void grantNeedsExactReason() {
    gate.request("H:1", "alice", "bob", "incident 42", null);

    assertThatThrownBy(() -> gate.grant("H:1", "bob", "alice", "incident 43"))
        .isInstanceOf(ValidationException.class);
    assertThat(gate.state("H:1", "alice")).isEqualTo(ApprovalState.REQUESTED);
  }

  @Test
  void duplicateRequestReturnsExistingRecord() {
    ApprovalRecord first = gate.request("H:1", "alice", "bob", "incident 42", null);
    ApprovalRecord second = gate.request("H:1", "alice", "bob", "incident 42", null);

    assertThat(second.id()).isEqualTo(first.id());
    assertThat(gate.list("H:1")).hasSize(1);
  }

  @Test
  void grantingTwiceKeepsFirstGrant() {
    gate.request("H:1", "alice", "bob", "incident 42", null);
    ApprovalRecord first = gate.grant("H:1", "bob", "alice", "incident 42");
    clock.advance(Duration.ofHours(1));

    ApprovalRecord second = gate.grant("H:1", "carol", "alice", "incident 42");

    assertThat(second).isEqualTo(first);
  }

  @Test
  void approvalOnlyCoversRequestedActions() {
    gate.request("H:1", "alice", "bob", "pause only", Set.of(ProtectedAction.PAUSE));
    gate.grant("H:1", "bob", "alice", "pause only");

    assertThatCode(() -> gate.check("H:1", Actor.user("alice"), ProtectedAction.PAUSE))
        .doesNotThrowAnyException();
    assertThatThrownBy(() -> gate.check("H:1", Actor.user("alice"), ProtectedAction.STOP))
        .isInstanceOf(AuthorizationException.class);
  }

  @Test
  void approvalIsScopedToHuntAndRequester() {
    gate.request("H:1", "alice", "bob", "incident 42", null);
    gate.grant("H:1", "bob", "alice", "incident 42");

    assertThatThrownBy(() -> gate.check("H:2", Actor.user("alice"), ProtectedAction.RUN))
        .isInstanceOf(AuthorizationException.class);
    assertThatThrownBy(() -> gate.check("H:1", Actor.user("bob"), ProtectedAction.RUN))
        .isInstanceOf(AuthorizationException.class);
  }

  @Test
  void approvalExpires() {
    gate.request("H:1", "alice", "bob", "incident 42", null);
    gate.grant("H:1", "bob", "alice", "incident 42");

    clock.advance(Duration.ofDays(29));

    assertThatThrownBy(() -> gate.check("H:1", Actor.user("alice"), ProtectedAction.RUN))
        .isInstanceOf(AuthorizationException.class);
  }
}
