package com.fleethunt.hunt;

import com.fleethunt.MutableClock;
import com.fleethunt.enums.ClientStatus;
import com.fleethunt.enums.HuntState;
import com.fleethunt.enums.OutcomeType;
import com.fleethunt.exception.InvalidHuntStateException;
import com.fleethunt.exception.ValidationException;
import com.fleethunt.foreman.InMemoryAssignmentStore;
import com.fleethunt.foreman.InMemoryRuleStore;
import com.fleethunt.model.ClientStatusView;
import com.fleethunt.model.ClientTask;
import com.fleethunt.model.HuntDefinition;
import com.fleethunt.model.HuntNotification;
import com.fleethunt.model.HuntSummary;
import com.fleethunt.model.Outcome;
import com.fleethunt.model.RegexCondition;
import com.fleethunt.model.ResourceSample;
import com.fleethunt.model.RuleGroup;
import com.fleethunt.notification.NotificationService;
import com.fleethunt.ruleengine.evaluator.RuleValidator;
import com.fleethunt.store.InMemoryAttributeStore;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class HuntTest {

  private static final RuleGroup LINUX =
      new RuleGroup(List.of(new RegexCondition("System", "Linux")), List.of());

  private MutableClock clock;
  private InMemoryRuleStore ruleStore;
  private InMemoryAssignmentStore assignmentStore;
  private InMemoryAttributeStore attributeStore;
  private ClientTaskQueue taskQueue;
  private NotificationService notificationService;
  private HuntFactory factory;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-03-01T00:00:00Z"));
    ruleStore = new InMemoryRuleStore();
    assignmentStore = new InMemoryAssignmentStore();
    attributeStore = new InMemoryAttributeStore(clock);
    taskQueue = new ClientTaskQueue();
    notificationService = mock(NotificationService.class);
    factory = new HuntFactory(ruleStore, assignmentStore, attributeStore,
        new QueueingDispatcher(taskQueue, clock), notificationService, new RuleValidator(), clock);
  }

  private Hunt newHunt(String id, int clientLimit, String notificationEvent) {
    Hunt hunt = factory.create(new HuntDefinition(id, "hunt " + id, "alice", "test hunt",
        clock.instant(), clientLimit, Duration.ofDays(31), notificationEvent, List.of()));
    hunt.addRule(LINUX);
    return hunt;
  }

  @Test
  void lifecycleTransitions() {
    Hunt hunt = newHunt("H:1", 0, null);
    assertThat(hunt.state()).isEqualTo(HuntState.CONSTRUCTED);

    hunt.run();
    assertThat(hunt.state()).isEqualTo(HuntState.RUNNING);
    assertThat(ruleStore.rulesOf("H:1")).hasSize(1);

    hunt.pause();
    assertThat(hunt.state()).isEqualTo(HuntState.PAUSED);
    assertThat(ruleStore.rulesOf("H:1")).isEmpty();

    hunt.run();
    hunt.stop();
    assertThat(hunt.state()).isEqualTo(HuntState.STOPPED);
    assertThat(ruleStore.rulesOf("H:1")).isEmpty();
  }

  @Test
  void invalidTransitionsAreRejected() {
    Hunt hunt = newHunt("H:1", 0, null);

    assertThatThrownBy(hunt::pause).isInstanceOf(InvalidHuntStateException.class);

    hunt.run();
    assertThatThrownBy(() -> hunt.addRule(LINUX)).isInstanceOf(InvalidHuntStateException.class);

    hunt.stop();
    assertThatThrownBy(hunt::run).isInstanceOf(InvalidHuntStateException.class);
    assertThatThrownBy(hunt::pause).isInstanceOf(InvalidHuntStateException.class);
    assertThatThrownBy(() -> hunt.modify(5, null))
        .isInstanceOf(InvalidHuntStateException.class);
  }

  @Test
  void stopBeforeFirstRunPublishesNothing() {
    Hunt hunt = newHunt("H:1", 0, null);

    hunt.stop();

    assertThat(hunt.state()).isEqualTo(HuntState.STOPPED);
    assertThat(ruleStore.rulesOf("H:1")).isEmpty();
    assertThatThrownBy(hunt::run).isInstanceOf(InvalidHuntStateException.class);
    assertThat(ruleStore.rulesOf("H:1")).isEmpty();
  }

  @Test
  void ruleOnUnknownAttributeIsRejectedAndNeverPublished() {
    Hunt hunt = newHunt("H:1", 0, null);

    assertThatThrownBy(() -> hunt.addRule(new RuleGroup(
        List.of(new RegexCondition("no such attribute", "x")), null)))
        .isInstanceOf(ValidationException.class);
    assertThat(hunt.definition().ruleGroups()).containsExactly(LINUX);

    hunt.run();
    assertThat(ruleStore.rulesOf("H:1")).singleElement()
        .satisfies(rule -> assertThat(rule.regexRules())
            .containsExactly(new RegexCondition("System", "Linux")));
  }

  @Test
  void ruleGroupWithNullConditionIsRejected() {
    assertThatThrownBy(() -> new RuleGroup(Arrays.asList((RegexCondition) null), null))
        .isInstanceOf(ValidationException.class);
    Hunt hunt = newHunt("H:1", 0, null);
    assertThatThrownBy(() -> hunt.addRule(null)).isInstanceOf(ValidationException.class);
  }

  @Test
  void startIsIgnoredUnlessRunning() {
    Hunt hunt = newHunt("H:1", 0, null);

    assertThat(hunt.tryStartClient("C.1")).isFalse();
    hunt.run();
    hunt.pause();
    assertThat(hunt.tryStartClient("C.1")).isFalse();
    assertThat(assignmentStore.isAssigned("H:1", "C.1")).isFalse();
  }

  @Test
  void modifyKeepsAssignmentsAndRaisesLimit() {
    Hunt hunt = newHunt("H:1", 1, null);
    hunt.run();
    assertThat(hunt.tryStartClient("C.1")).isTrue();
    assertThat(hunt.tryStartClient("C.2")).isFalse();

    hunt.modify(2, Duration.ofDays(1));

    assertThat(hunt.tryStartClient("C.1")).isFalse();
    assertThat(hunt.tryStartClient("C.2")).isTrue();
    assertThat(hunt.definition().clientLimit()).isEqualTo(2);
    assertThat(ruleStore.rulesOf("H:1").get(0).expires())
        .isEqualTo(clock.instant().plus(Duration.ofDays(1)));
  }

  @Test
  void errorsAreIsolatedPerClient() {
    Hunt hunt = newHunt("H:1", 0, null);
    hunt.run();
    int clients = 20;
    int failing = 7;
    IntStream.range(0, clients).forEach(i -> hunt.tryStartClient("C." + i));

    for (int i = 0; i < clients; i++) {
      Outcome outcome = i < failing
          ? Outcome.error("boom " + i, "trace")
          : Outcome.success();
      hunt.recordOutcome("C." + i, outcome);
    }

    HuntSummary summary = hunt.summary();
    assertThat(summary.startedCount()).isEqualTo(clients);
    assertThat(summary.erroredCount()).isEqualTo(failing);
    assertThat(summary.finishedCount()).isEqualTo(clients - failing);
    assertThat(hunt.errors()).hasSize(failing);
  }

  @Test
  void badnessCountsAsFinished() {
    Hunt hunt = newHunt("H:1", 0, null);
    hunt.run();
    hunt.tryStartClient("C.1");
    hunt.tryStartClient("C.2");

    hunt.recordOutcome("C.1", Outcome.badness());

    assertThat(hunt.badnessClients()).containsExactly("C.1");
    assertThat(hunt.finishedClients()).containsExactly("C.1");
    assertThat(hunt.clientStatuses()).extracting(ClientStatusView::status)
        .containsExactly(ClientStatus.BAD, ClientStatus.OUTSTANDING);
  }

  @Test
  void secondOutcomeFromSameClientIsIgnored() {
    Hunt hunt = newHunt("H:1", 0, "hunt-done");
    hunt.run();
    hunt.tryStartClient("C.1");

    hunt.recordOutcome("C.1", Outcome.success());
    hunt.recordOutcome("C.1", Outcome.error("late"));

    assertThat(hunt.finishedClients()).containsExactly("C.1");
    assertThat(hunt.erroredClients()).isEmpty();
    verify(notificationService, times(1)).publish(eq("hunt-done"), any(HuntNotification.class));
  }

  @Test
  void outcomeWithoutTypeIsRejectedAndLaterOutcomeCounts() {
    Hunt hunt = newHunt("H:1", 0, null);
    hunt.run();
    hunt.tryStartClient("C.1");

    assertThatThrownBy(() -> hunt.recordOutcome("C.1", new Outcome(null, null, null)))
        .isInstanceOf(ValidationException.class);
    assertThat(hunt.recordOutcome("C.1", Outcome.success())).isTrue();

    assertThat(hunt.finishedClients()).containsExactly("C.1");
  }

  @Test
  void repeatedCompletionDoesNotCountUsageTwice() {
    Hunt hunt = newHunt("H:1", 0, null);
    hunt.run();
    hunt.tryStartClient("C.1");
    ResourceSample usage = new ResourceSample("C.1", "t1", 1.5, 0.5, 512);

    assertThat(hunt.recordCompletion("C.1", Outcome.success(), usage)).isTrue();
    assertThat(hunt.recordCompletion("C.1", Outcome.success(), usage)).isFalse();

    assertThat(hunt.usageStats().userCpuStats().count()).isEqualTo(1);
    assertThat(hunt.usageStats().worstPerformers()).hasSize(1);
  }

  @Test
  void everyTerminalOutcomeNotifiesOnce() {
    Hunt hunt = newHunt("H:1", 0, "hunt-done");
    hunt.run();
    hunt.tryStartClient("C.1");
    hunt.tryStartClient("C.2");

    hunt.recordOutcome("C.1", Outcome.success());
    hunt.recordOutcome("C.2", Outcome.error("disk full"));

    ArgumentCaptor<HuntNotification> captor = ArgumentCaptor.forClass(HuntNotification.class);
    verify(notificationService, times(2)).publish(eq("hunt-done"), captor.capture());
    assertThat(captor.getAllValues())
        .extracting(HuntNotification::clientId)
        .containsExactly("C.1", "C.2");
    assertThat(captor.getAllValues().get(1).outcome().type()).isEqualTo(OutcomeType.ERROR);
  }

  @Test
  void noNotificationWithoutEventName() {
    Hunt hunt = newHunt("H:1", 0, null);
    hunt.run();
    hunt.tryStartClient("C.1");

    hunt.recordOutcome("C.1", Outcome.success());

    verify(notificationService, never()).publish(any(), any());
  }

  @Test
  void failingNotificationDoesNotAffectHunt() {
    willThrow(new IllegalStateException("sink down"))
        .given(notificationService).publish(any(), any());
    Hunt hunt = newHunt("H:1", 0, "hunt-done");
    hunt.run();
    hunt.tryStartClient("C.1");

    hunt.recordOutcome("C.1", Outcome.success());

    assertThat(hunt.finishedClients()).containsExactly("C.1");
  }

  @Test
  void stopPurgesUndeliveredTasks() {
    Hunt hunt = newHunt("H:1", 0, null);
    Hunt other = newHunt("H:2", 0, null);
    hunt.run();
    other.run();
    hunt.tryStartClient("C.1");
    hunt.tryStartClient("C.2");
    other.tryStartClient("C.1");
    assertThat(hunt.outstandingRequests()).isEqualTo(2);

    hunt.stop();

    assertThat(hunt.outstandingRequests()).isZero();
    assertThat(other.outstandingRequests()).isEqualTo(1);
    assertThat(taskQueue.drain("C.1")).extracting(ClientTask::huntId).containsExactly("H:2");
  }

  @Test
  void outcomesAfterStopAreStillRecorded() {
    Hunt hunt = newHunt("H:1", 0, null);
    hunt.run();
    hunt.tryStartClient("C.1");
    hunt.stop();

    hunt.recordOutcome("C.1", Outcome.success());

    assertThat(hunt.finishedClients()).containsExactly("C.1");
  }

  @Test
  void restoredHuntHasSameSetsAndStatistics() {
    Hunt hunt = newHunt("H:1", 0, null);
    hunt.run();
    for (int i = 1; i <= 4; i++) {
      hunt.tryStartClient("C." + i);
      hunt.recordResourceUsage(new ResourceSample("C." + i, "t" + i, i, 2 * i, 100L * i));
    }
    hunt.recordOutcome("C.1", Outcome.success());
    hunt.recordOutcome("C.2", Outcome.badness());
    hunt.recordOutcome("C.3", Outcome.error("broken", "stack"));
    hunt.logResult("C.1", "found 3 files");

    InMemoryRuleStore freshRules = new InMemoryRuleStore();
    HuntFactory restarted = new HuntFactory(freshRules, assignmentStore, attributeStore,
        new QueueingDispatcher(new ClientTaskQueue(), clock), notificationService, new RuleValidator(), clock);
    Hunt restored = restarted.restore("H:1").orElseThrow();

    assertThat(restored.state()).isEqualTo(HuntState.RUNNING);
    assertThat(restored.definition()).isEqualTo(hunt.definition());
    assertThat(restored.startedClients()).isEqualTo(hunt.startedClients());
    assertThat(restored.finishedClients()).isEqualTo(hunt.finishedClients());
    assertThat(restored.erroredClients()).isEqualTo(hunt.erroredClients());
    assertThat(restored.badnessClients()).isEqualTo(hunt.badnessClients());
    assertThat(restored.errors()).isEqualTo(hunt.errors());
    assertThat(restored.resultLog()).isEqualTo(hunt.resultLog());
    assertThat(restored.usageStats().userCpuStats().mean())
        .isCloseTo(hunt.usageStats().userCpuStats().mean(), within(1e-9));
    assertThat(restored.usageStats().worstPerformers())
        .isEqualTo(hunt.usageStats().worstPerformers());
    assertThat(freshRules.rulesOf("H:1")).hasSize(1);
    assertThat(restored.tryStartClient("C.1")).isFalse();
  }

  @Test
  void restoreOfUnknownHuntIsEmpty() {
    assertThat(factory.restore("H:missing")).isEmpty();
  }
}
