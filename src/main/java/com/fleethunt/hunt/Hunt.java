package com.fleethunt.hunt;

import com.fleethunt.enums.ClientStatus;
import com.fleethunt.enums.HuntState;
import com.fleethunt.exception.InvalidHuntStateException;
import com.fleethunt.exception.ValidationException;
import com.fleethunt.foreman.AssignmentStore;
import com.fleethunt.foreman.RuleStore;
import com.fleethunt.model.ClientError;
import com.fleethunt.model.ClientStatusView;
import com.fleethunt.model.ForemanAction;
import com.fleethunt.model.ForemanRule;
import com.fleethunt.model.HuntDefinition;
import com.fleethunt.model.HuntLogEntry;
import com.fleethunt.model.HuntNotification;
import com.fleethunt.model.HuntSummary;
import com.fleethunt.model.Outcome;
import com.fleethunt.model.ResourceSample;
import com.fleethunt.model.RuleGroup;
import com.fleethunt.notification.NotificationService;
import com.fleethunt.ruleengine.evaluator.RuleValidator;
import com.fleethunt.stats.HuntUsageStats;
import com.fleethunt.store.AttributeStore;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A running investigation across the fleet.
 *
 * <p>Lifecycle transitions and cap reservation are serialized by the hunt's own lock. Outcome
 * postings only touch concurrent per-client sets, so completions from different clients never
 * contend. The dispatcher is always called outside the lock.
 */
public class Hunt {

  private static final Logger log = LoggerFactory.getLogger(Hunt.class);

  private final ReentrantLock lock = new ReentrantLock();

  private final RuleStore ruleStore;
  private final AssignmentStore assignmentStore;
  private final AttributeStore attributeStore;
  private final Dispatcher dispatcher;
  private final NotificationService notificationService;
  private final RuleValidator ruleValidator;
  private final Clock clock;

  private volatile HuntDefinition definition;
  private volatile HuntState state = HuntState.CONSTRUCTED;

  private final Set<String> started = ConcurrentHashMap.newKeySet();
  private final Set<String> finished = ConcurrentHashMap.newKeySet();
  private final Set<String> errored = ConcurrentHashMap.newKeySet();
  private final Set<String> badness = ConcurrentHashMap.newKeySet();
  private final Set<String> reported = ConcurrentHashMap.newKeySet();
  private final Map<String, ClientError> errors = new ConcurrentHashMap<>();
  private final Queue<HuntLogEntry> resultLog = new ConcurrentLinkedQueue<>();
  private final HuntUsageStats usageStats = new HuntUsageStats();

  public Hunt(HuntDefinition definition,
              RuleStore ruleStore,
              AssignmentStore assignmentStore,
              AttributeStore attributeStore,
              Dispatcher dispatcher,
              NotificationService notificationService,
              RuleValidator ruleValidator,
              Clock clock) {
    this.definition = Objects.requireNonNull(definition, "definition");
    this.ruleStore = ruleStore;
    this.assignmentStore = assignmentStore;
    this.attributeStore = attributeStore;
    this.dispatcher = dispatcher;
    this.notificationService = notificationService;
    this.ruleValidator = ruleValidator;
    this.clock = clock;
  }

  public String id() {
    return definition.id();
  }

  public HuntDefinition definition() {
    return definition;
  }

  public HuntState state() {
    return state;
  }

  /** Writes the initial definition and state of a newly created hunt. */
  void persistCreated() {
    attributeStore.append(id(), AttributeStore.DEFINITION, definition);
    attributeStore.set(id(), AttributeStore.STATE, state);
  }

  /**
   * Attaches one OR-branch. Only allowed before the hunt is first run.
   *
   * @throws ValidationException if any condition names an unknown attribute or is malformed
   */
  public void addRule(RuleGroup group) {
    ruleValidator.validate(group);
    lock.lock();
    try {
      if (state != HuntState.CONSTRUCTED) {
        throw new InvalidHuntStateException(id(), state, "add rule to");
      }
      List<RuleGroup> groups = new ArrayList<>(definition.ruleGroups());
      groups.add(group);
      definition = definition.withRuleGroups(groups);
      attributeStore.append(id(), AttributeStore.DEFINITION, definition);
    } finally {
      lock.unlock();
    }
    log.info("Added rule group #{} to hunt {}", definition.ruleGroups().size(), id());
  }

  public void run() {
    lock.lock();
    try {
      switch (state) {
        case STOPPED -> throw new InvalidHuntStateException(id(), state, "run");
        case RUNNING -> {
          return;
        }
        default -> {
        }
      }
      state = HuntState.RUNNING;
      publishRules();
      attributeStore.set(id(), AttributeStore.STATE, state);
    } finally {
      lock.unlock();
    }
    log.info("Hunt {} is running with {} rule group(s)", id(), definition.ruleGroups().size());
  }

  public void pause() {
    lock.lock();
    try {
      switch (state) {
        case CONSTRUCTED, STOPPED -> throw new InvalidHuntStateException(id(), state, "pause");
        case PAUSED -> {
          return;
        }
        default -> {
        }
      }
      state = HuntState.PAUSED;
      ruleStore.remove(id());
      attributeStore.set(id(), AttributeStore.STATE, state);
    } finally {
      lock.unlock();
    }
    log.info("Hunt {} paused", id());
  }

  public void stop() {
    lock.lock();
    try {
      if (state == HuntState.STOPPED) {
        return;
      }
      state = HuntState.STOPPED;
      ruleStore.remove(id());
      attributeStore.set(id(), AttributeStore.STATE, state);
    } finally {
      lock.unlock();
    }
    int purged = dispatcher.cancel(id());
    log.info("Hunt {} stopped, {} queued task(s) dropped", id(), purged);
  }

  /**
   * Changes the client limit and/or the rule expiry. Null arguments keep the current value.
   * Assignments already made are kept.
   */
  public void modify(Integer clientLimit, Duration expiry) {
    if (clientLimit != null && clientLimit < 0) {
      throw new ValidationException("Client limit must not be negative: " + clientLimit);
    }
    if (expiry != null && (expiry.isNegative() || expiry.isZero())) {
      throw new ValidationException("Expiry must be positive: " + expiry);
    }
    lock.lock();
    try {
      if (state == HuntState.STOPPED) {
        throw new InvalidHuntStateException(id(), state, "modify");
      }
      definition = definition.withLimits(
          clientLimit != null ? clientLimit : definition.clientLimit(),
          expiry != null ? expiry : definition.expiry());
      attributeStore.append(id(), AttributeStore.DEFINITION, definition);
      if (state == HuntState.RUNNING) {
        publishRules();
      }
    } finally {
      lock.unlock();
    }
    log.info("Hunt {} modified: clientLimit={}, expiry={}",
        id(), definition.clientLimit(), definition.expiry());
  }

  /**
   * Called by the foreman when one of this hunt's rules matched a client.
   *
   * @return true if the client was newly assigned and handed to the dispatcher
   */
  public boolean tryStartClient(String clientId) {
    int clientLimit;
    lock.lock();
    try {
      if (state != HuntState.RUNNING) {
        log.debug("Hunt {} is {}, ignoring client {}", id(), state, clientId);
        return false;
      }
      clientLimit = definition.clientLimit();
      if (clientLimit > 0 && started.size() >= clientLimit) {
        log.debug("Hunt {} reached its client limit of {}, ignoring client {}",
            id(), clientLimit, clientId);
        return false;
      }
      if (!assignmentStore.tryAssign(id(), clientId)) {
        return false;
      }
      started.add(clientId);
      attributeStore.append(id(), AttributeStore.CLIENTS, clientId);
    } finally {
      lock.unlock();
    }

    try {
      dispatcher.startClient(id(), clientId, clientLimit);
    } catch (RuntimeException e) {
      log.error("Dispatch of hunt {} to client {} failed", id(), clientId, e);
      recordOutcome(clientId, Outcome.error("Dispatch failed: " + e.getMessage(), backtrace(e)));
    }
    return true;
  }

  /**
   * Records the terminal outcome of one client. Only the first outcome per client counts.
   *
   * @return false if the client had already reported
   */
  public boolean recordOutcome(String clientId, Outcome outcome) {
    return recordCompletion(clientId, outcome, null);
  }

  /**
   * Records a client's outcome together with the resources its task used. The sample is only
   * added to the statistics when the outcome is the client's first.
   *
   * @return false if the client had already reported
   */
  public boolean recordCompletion(String clientId, Outcome outcome, ResourceSample usage) {
    Objects.requireNonNull(clientId, "clientId");
    Objects.requireNonNull(outcome, "outcome");
    if (outcome.type() == null) {
      throw new ValidationException("Outcome type is required");
    }
    if (!reported.add(clientId)) {
      log.warn("Ignoring second outcome {} from client {} for hunt {}",
          outcome.type(), clientId, id());
      return false;
    }
    if (usage != null) {
      recordResourceUsage(usage);
    }
    Instant now = clock.instant();
    switch (outcome.type()) {
      case SUCCESS -> markFinished(clientId);
      case BADNESS -> {
        if (badness.add(clientId)) {
          attributeStore.append(id(), AttributeStore.BADNESS, clientId);
        }
        markFinished(clientId);
      }
      case ERROR -> {
        ClientError error = new ClientError(clientId, outcome.message(), outcome.backtrace(), now);
        errors.put(clientId, error);
        if (errored.add(clientId)) {
          attributeStore.append(id(), AttributeStore.ERRORS, error);
        }
        log.warn("Client {} reported an error for hunt {}: {}", clientId, id(), outcome.message());
      }
    }
    notifyOutcome(clientId, outcome, now);
    return true;
  }

  public void recordResourceUsage(ResourceSample sample) {
    usageStats.add(sample);
    attributeStore.append(id(), AttributeStore.RESOURCES, sample);
  }

  public void logResult(String clientId, String message) {
    HuntLogEntry entry = new HuntLogEntry(clientId, message, clock.instant());
    resultLog.add(entry);
    attributeStore.append(id(), AttributeStore.LOG, entry);
  }

  public Set<String> startedClients() {
    return new TreeSet<>(started);
  }

  public Set<String> finishedClients() {
    return new TreeSet<>(finished);
  }

  public Set<String> erroredClients() {
    return new TreeSet<>(errored);
  }

  public Set<String> badnessClients() {
    return new TreeSet<>(badness);
  }

  public List<ClientError> errors() {
    return errors.values().stream()
        .sorted(Comparator.comparing(ClientError::clientId))
        .toList();
  }

  public List<HuntLogEntry> resultLog() {
    return List.copyOf(resultLog);
  }

  public HuntUsageStats usageStats() {
    return usageStats;
  }

  public int outstandingRequests() {
    return dispatcher.pending(id());
  }

  /**
   * Status of every client this hunt has started or received an outcome from, ordered by id.
   */
  public List<ClientStatusView> clientStatuses() {
    Set<String> clients = new TreeSet<>(started);
    clients.addAll(finished);
    clients.addAll(errored);
    List<ClientStatusView> views = new ArrayList<>(clients.size());
    for (String clientId : clients) {
      views.add(new ClientStatusView(clientId, statusOf(clientId)));
    }
    return views;
  }

  public HuntSummary summary() {
    HuntDefinition current = definition;
    return new HuntSummary(
        current.id(),
        current.name(),
        current.creator(),
        current.description(),
        current.createdAt(),
        state,
        current.ruleGroups().size(),
        current.clientLimit(),
        current.expiry(),
        current.notificationEvent(),
        started.size(),
        finished.size(),
        errored.size(),
        badness.size(),
        outstandingRequests(),
        usageStats.summary()
    );
  }

  /**
   * Rebuilds sets, errors, log and statistics from the attribute store. Used when the service
   * starts over an existing store; does not write anything back.
   */
  void restore(HuntState persistedState) {
    lock.lock();
    try {
      state = persistedState;
      started.addAll(attributeStore.distinctValues(id(), AttributeStore.CLIENTS, String.class));
      finished.addAll(attributeStore.distinctValues(id(), AttributeStore.FINISHED, String.class));
      badness.addAll(attributeStore.distinctValues(id(), AttributeStore.BADNESS, String.class));
      for (ClientError error
          : attributeStore.distinctValues(id(), AttributeStore.ERRORS, ClientError.class)) {
        errors.put(error.clientId(), error);
        errored.add(error.clientId());
      }
      reported.addAll(finished);
      reported.addAll(errored);
      attributeStore.history(id(), AttributeStore.LOG, HuntLogEntry.class)
          .forEach(entry -> resultLog.add(entry.value()));
      attributeStore.history(id(), AttributeStore.RESOURCES, ResourceSample.class)
          .forEach(sample -> usageStats.add(sample.value()));
      if (state == HuntState.RUNNING) {
        publishRules();
      }
    } finally {
      lock.unlock();
    }
    log.info("Restored hunt {} in state {}: started={}, finished={}, errored={}",
        id(), state, started.size(), finished.size(), errored.size());
  }

  private ClientStatus statusOf(String clientId) {
    if (errored.contains(clientId)) {
      return ClientStatus.ERROR;
    }
    if (badness.contains(clientId)) {
      return ClientStatus.BAD;
    }
    if (finished.contains(clientId)) {
      return ClientStatus.COMPLETED;
    }
    return ClientStatus.OUTSTANDING;
  }

  private void markFinished(String clientId) {
    if (finished.add(clientId)) {
      attributeStore.append(id(), AttributeStore.FINISHED, clientId);
    }
  }

  private void notifyOutcome(String clientId, Outcome outcome, Instant now) {
    String eventName = definition.notificationEvent();
    if (eventName == null || eventName.isBlank()) {
      return;
    }
    try {
      notificationService.publish(eventName,
          new HuntNotification(id(), definition.name(), clientId, outcome, now));
    } catch (RuntimeException e) {
      log.error("Notification {} for hunt {} client {} failed", eventName, id(), clientId, e);
    }
  }

  // Caller holds the lock.
  private void publishRules() {
    HuntDefinition current = definition;
    Instant now = clock.instant();
    Instant expires = current.expiry() != null ? now.plus(current.expiry()) : null;
    List<ForemanAction> actions = List.of(new ForemanAction(current.id(), current.name()));
    List<ForemanRule> rules = new ArrayList<>(current.ruleGroups().size());
    for (RuleGroup group : current.ruleGroups()) {
      rules.add(new ForemanRule(current.id(), current.name(), now, expires,
          group.regexRules(), group.integerRules(), actions));
    }
    ruleStore.publish(current.id(), rules);
  }

  private static String backtrace(Throwable e) {
    StringWriter out = new StringWriter();
    e.printStackTrace(new PrintWriter(out));
    return out.toString();
  }
}
