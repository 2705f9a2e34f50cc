package com.fleethunt.service;

import com.fleethunt.approval.ApprovalGate;
import com.fleethunt.enums.ApprovalState;
import com.fleethunt.enums.ProtectedAction;
import com.fleethunt.exception.ValidationException;
import com.fleethunt.hunt.Hunt;
import com.fleethunt.hunt.HuntFactory;
import com.fleethunt.hunt.HuntRegistry;
import com.fleethunt.model.Actor;
import com.fleethunt.model.AddRuleRequest;
import com.fleethunt.model.ApprovalGrantDto;
import com.fleethunt.model.ApprovalRecord;
import com.fleethunt.model.ApprovalRequestDto;
import com.fleethunt.model.ClientError;
import com.fleethunt.model.ClientStatusView;
import com.fleethunt.model.CpuUsage;
import com.fleethunt.model.CreateHuntRequest;
import com.fleethunt.model.HuntDefinition;
import com.fleethunt.model.HuntLogEntry;
import com.fleethunt.model.HuntSummary;
import com.fleethunt.model.ModifyHuntRequest;
import com.fleethunt.model.ResourceSample;
import com.fleethunt.model.RuleGroup;
import com.fleethunt.model.TaskCompletion;
import com.fleethunt.store.AttributeStore;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class HuntService {

  private static final Logger log = LoggerFactory.getLogger(HuntService.class);

  private final HuntRegistry registry;
  private final HuntFactory factory;
  private final ApprovalGate approvalGate;
  private final AttributeStore attributeStore;
  private final Clock clock;
  private final int maxClientLimit;
  private final Duration defaultExpiry;

  public HuntService(HuntRegistry registry,
                     HuntFactory factory,
                     ApprovalGate approvalGate,
                     AttributeStore attributeStore,
                     Clock clock,
                     @Value("${hunt.max-client-limit:1000}") int maxClientLimit,
                     @Value("${hunt.default-expiry:P31D}") Duration defaultExpiry) {
    this.registry = registry;
    this.factory = factory;
    this.approvalGate = approvalGate;
    this.attributeStore = attributeStore;
    this.clock = clock;
    this.maxClientLimit = maxClientLimit;
    this.defaultExpiry = defaultExpiry;
  }

  public HuntSummary createHunt(CreateHuntRequest request, String creator) {
    if (request == null || request.name() == null || request.name().isBlank()) {
      throw new ValidationException("Hunt name must not be blank");
    }
    int clientLimit = request.clientLimit() != null ? request.clientLimit() : 0;
    validateClientLimit(clientLimit);
    Duration expiry = request.expiry() != null ? request.expiry() : defaultExpiry;
    validateExpiry(expiry);

    HuntDefinition definition = new HuntDefinition(
        newHuntId(),
        request.name(),
        creator,
        request.description(),
        clock.instant(),
        clientLimit,
        expiry,
        request.notificationEvent(),
        List.of()
    );
    Hunt hunt = factory.create(definition);
    registry.register(hunt);
    log.info("Created hunt {} '{}' for {} (clientLimit={}, expiry={})",
        hunt.id(), definition.name(), creator, clientLimit, expiry);
    return hunt.summary();
  }

  public HuntSummary addRule(String huntId, AddRuleRequest request) {
    Hunt hunt = registry.get(huntId);
    hunt.addRule(request == null
        ? null
        : new RuleGroup(request.regexRules(), request.integerRules()));
    return hunt.summary();
  }

  public HuntSummary run(String huntId, Actor actor) {
    Hunt hunt = registry.get(huntId);
    approvalGate.check(huntId, actor, ProtectedAction.RUN);
    hunt.run();
    return hunt.summary();
  }

  public HuntSummary pause(String huntId, Actor actor) {
    Hunt hunt = registry.get(huntId);
    approvalGate.check(huntId, actor, ProtectedAction.PAUSE);
    hunt.pause();
    return hunt.summary();
  }

  public HuntSummary stop(String huntId, Actor actor) {
    Hunt hunt = registry.get(huntId);
    approvalGate.check(huntId, actor, ProtectedAction.STOP);
    hunt.stop();
    return hunt.summary();
  }

  public HuntSummary modify(String huntId, ModifyHuntRequest request, Actor actor) {
    Hunt hunt = registry.get(huntId);
    if (request == null) {
      throw new ValidationException("Modification must not be empty");
    }
    if (request.clientLimit() != null) {
      validateClientLimit(request.clientLimit());
    }
    if (request.expiry() != null) {
      validateExpiry(request.expiry());
    }
    approvalGate.check(huntId, actor, ProtectedAction.MODIFY);
    hunt.modify(request.clientLimit(), request.expiry());
    return hunt.summary();
  }

  /**
   * Applies a completion report. A repeated report from the same client is ignored, usage
   * included.
   */
  public void recordCompletion(TaskCompletion completion) {
    Hunt hunt = registry.get(completion.huntId());
    ResourceSample usage = completion.usage();
    if (usage != null) {
      usage = new ResourceSample(
          completion.clientId(),
          usage.taskId() != null ? usage.taskId() : completion.taskId(),
          usage.userCpuTime(),
          usage.systemCpuTime(),
          usage.networkBytesSent());
    }
    hunt.recordCompletion(completion.clientId(), completion.outcome(), usage);
  }

  public ApprovalRecord requestApproval(String huntId, String requester,
                                        ApprovalRequestDto request) {
    registry.get(huntId);
    return approvalGate.request(huntId, requester, request.approver(), request.reason(),
        request.actions());
  }

  public ApprovalRecord grantApproval(String huntId, String approver, ApprovalGrantDto grant) {
    registry.get(huntId);
    return approvalGate.grant(huntId, approver, grant.requester(), grant.reason());
  }

  public ApprovalState approvalState(String huntId, String requester) {
    registry.get(huntId);
    return approvalGate.state(huntId, requester);
  }

  public List<ApprovalRecord> approvals(String huntId) {
    registry.get(huntId);
    return approvalGate.list(huntId);
  }

  public void logResult(String huntId, String clientId, String message) {
    registry.get(huntId).logResult(clientId, message);
  }

  public HuntSummary getHunt(String huntId) {
    return registry.get(huntId).summary();
  }

  public List<HuntSummary> listHunts() {
    return registry.all().stream().map(Hunt::summary).toList();
  }

  public Map<String, CpuUsage> resourceUsageByClient(String huntId, String clientId) {
    return registry.get(huntId).usageStats().resourceUsageByClient(clientId);
  }

  public Map<String, Map<String, CpuUsage>> resourceUsageByTask(String huntId, String clientId) {
    return registry.get(huntId).usageStats().resourceUsageByTask(clientId);
  }

  public List<ClientStatusView> clientStatuses(String huntId) {
    return registry.get(huntId).clientStatuses();
  }

  public List<ClientError> errors(String huntId) {
    return registry.get(huntId).errors();
  }

  public List<HuntLogEntry> resultLog(String huntId) {
    return registry.get(huntId).resultLog();
  }

  /**
   * Rebuilds every hunt found in the attribute store that is not registered yet.
   *
   * @return the number of hunts restored
   */
  public int restoreAll() {
    int restored = 0;
    for (String huntId : attributeStore.subjects()) {
      if (registry.find(huntId).isPresent()) {
        continue;
      }
      Optional<Hunt> hunt = factory.restore(huntId);
      if (hunt.isPresent()) {
        registry.register(hunt.get());
        restored++;
      }
    }
    return restored;
  }

  private void validateClientLimit(int clientLimit) {
    if (clientLimit < 0 || clientLimit > maxClientLimit) {
      throw new ValidationException(
          "Client limit must be between 0 and " + maxClientLimit + ", got " + clientLimit);
    }
  }

  private static void validateExpiry(Duration expiry) {
    if (expiry.isNegative() || expiry.isZero()) {
      throw new ValidationException("Expiry must be positive: " + expiry);
    }
  }

  private String newHuntId() {
    String id;
    do {
      id = "H:" + UUID.randomUUID().toString().substring(0, 8).toUpperCase(Locale.ROOT);
    } while (registry.find(id).isPresent());
    return id;
  }
}
