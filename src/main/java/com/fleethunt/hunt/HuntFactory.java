package com.fleethunt.hunt;

import com.fleethunt.enums.HuntState;
import com.fleethunt.foreman.AssignmentStore;
import com.fleethunt.foreman.RuleStore;
import com.fleethunt.model.HuntDefinition;
import com.fleethunt.notification.NotificationService;
import com.fleethunt.ruleengine.evaluator.RuleValidator;
import com.fleethunt.store.AttributeStore;
import java.time.Clock;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Wires hunts to their collaborators, either fresh or rebuilt from the attribute store.
 */
@Component
public class HuntFactory {

  private final RuleStore ruleStore;
  private final AssignmentStore assignmentStore;
  private final AttributeStore attributeStore;
  private final Dispatcher defaultDispatcher;
  private final NotificationService notificationService;
  private final RuleValidator ruleValidator;
  private final Clock clock;

  public HuntFactory(RuleStore ruleStore,
                     AssignmentStore assignmentStore,
                     AttributeStore attributeStore,
                     Dispatcher defaultDispatcher,
                     NotificationService notificationService,
                     RuleValidator ruleValidator,
                     Clock clock) {
    this.ruleStore = ruleStore;
    this.assignmentStore = assignmentStore;
    this.attributeStore = attributeStore;
    this.defaultDispatcher = defaultDispatcher;
    this.notificationService = notificationService;
    this.ruleValidator = ruleValidator;
    this.clock = clock;
  }

  public Hunt create(HuntDefinition definition) {
    return create(definition, defaultDispatcher);
  }

  public Hunt create(HuntDefinition definition, Dispatcher dispatcher) {
    Hunt hunt = newHunt(definition, dispatcher);
    hunt.persistCreated();
    return hunt;
  }

  public Optional<Hunt> restore(String huntId) {
    Optional<HuntDefinition> definition =
        attributeStore.latest(huntId, AttributeStore.DEFINITION, HuntDefinition.class);
    if (definition.isEmpty()) {
      return Optional.empty();
    }
    HuntState state = attributeStore.latest(huntId, AttributeStore.STATE, HuntState.class)
        .orElse(HuntState.CONSTRUCTED);
    Hunt hunt = newHunt(definition.get(), defaultDispatcher);
    hunt.restore(state);
    return Optional.of(hunt);
  }

  private Hunt newHunt(HuntDefinition definition, Dispatcher dispatcher) {
    return new Hunt(definition, ruleStore, assignmentStore, attributeStore, dispatcher,
        notificationService, ruleValidator, clock);
  }
}
