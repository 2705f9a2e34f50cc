package com.fleethunt.controller;

import com.fleethunt.model.Actor;
import com.fleethunt.model.AddRuleRequest;
import com.fleethunt.model.ClientError;
import com.fleethunt.model.ClientStatusView;
import com.fleethunt.model.CreateHuntRequest;
import com.fleethunt.model.HuntLogEntry;
import com.fleethunt.model.HuntSummary;
import com.fleethunt.model.ModifyHuntRequest;
import com.fleethunt.model.TaskCompletion;
import com.fleethunt.service.CompletionIngestionService;
import com.fleethunt.service.HuntService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.net.URI;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/hunts")
@Validated
public class HuntController {

  private final HuntService huntService;
  private final CompletionIngestionService ingestionService;

  public HuntController(HuntService huntService, CompletionIngestionService ingestionService) {
    this.huntService = huntService;
    this.ingestionService = ingestionService;
  }

  @PostMapping
  public ResponseEntity<HuntSummary> createHunt(
      @RequestHeader(ActorHeaders.USER) @NotBlank String user,
      @Valid @RequestBody CreateHuntRequest request) {
    HuntSummary created = huntService.createHunt(request, user);
    return ResponseEntity
        .created(URI.create("/api/v1/hunts/" + created.id()))
        .body(created);
  }

  @GetMapping
  public ResponseEntity<List<HuntSummary>> listHunts() {
    return ResponseEntity.ok(huntService.listHunts());
  }

  @GetMapping("/{huntId}")
  public ResponseEntity<HuntSummary> getHunt(@PathVariable String huntId) {
    return ResponseEntity.ok(huntService.getHunt(huntId));
  }

  @PostMapping("/{huntId}/rules")
  public ResponseEntity<HuntSummary> addRule(
      @PathVariable String huntId,
      @RequestBody AddRuleRequest request) {
    return ResponseEntity.ok(huntService.addRule(huntId, request));
  }

  @PostMapping("/{huntId}/run")
  public ResponseEntity<HuntSummary> run(
      @PathVariable String huntId,
      @RequestHeader(ActorHeaders.USER) @NotBlank String user,
      @RequestHeader(value = ActorHeaders.SUPERVISOR, defaultValue = "false") boolean supervisor) {
    return ResponseEntity.ok(huntService.run(huntId, new Actor(user, supervisor)));
  }

  @PostMapping("/{huntId}/pause")
  public ResponseEntity<HuntSummary> pause(
      @PathVariable String huntId,
      @RequestHeader(ActorHeaders.USER) @NotBlank String user,
      @RequestHeader(value = ActorHeaders.SUPERVISOR, defaultValue = "false") boolean supervisor) {
    return ResponseEntity.ok(huntService.pause(huntId, new Actor(user, supervisor)));
  }

  @PostMapping("/{huntId}/stop")
  public ResponseEntity<HuntSummary> stop(
      @PathVariable String huntId,
      @RequestHeader(ActorHeaders.USER) @NotBlank String user,
      @RequestHeader(value = ActorHeaders.SUPERVISOR, defaultValue = "false") boolean supervisor) {
    return ResponseEntity.ok(huntService.stop(huntId, new Actor(user, supervisor)));
  }

  @PatchMapping("/{huntId}")
  public ResponseEntity<HuntSummary> modify(
      @PathVariable String huntId,
      @RequestHeader(ActorHeaders.USER) @NotBlank String user,
      @RequestHeader(value = ActorHeaders.SUPERVISOR, defaultValue = "false") boolean supervisor,
      @Valid @RequestBody ModifyHuntRequest request) {
    return ResponseEntity.ok(
        huntService.modify(huntId, request, new Actor(user, supervisor)));
  }

  @GetMapping("/{huntId}/resources")
  public ResponseEntity<Map<String, ?>> resourceUsage(
      @PathVariable String huntId,
      @RequestParam(value = "clientId", required = false) String clientId,
      @RequestParam(value = "groupByClient", defaultValue = "true") boolean groupByClient) {
    if (groupByClient) {
      return ResponseEntity.ok(huntService.resourceUsageByClient(huntId, clientId));
    }
    return ResponseEntity.ok(huntService.resourceUsageByTask(huntId, clientId));
  }

  @GetMapping("/{huntId}/clients")
  public ResponseEntity<List<ClientStatusView>> clients(@PathVariable String huntId) {
    return ResponseEntity.ok(huntService.clientStatuses(huntId));
  }

  @GetMapping("/{huntId}/errors")
  public ResponseEntity<List<ClientError>> errors(@PathVariable String huntId) {
    return ResponseEntity.ok(huntService.errors(huntId));
  }

  @GetMapping("/{huntId}/log")
  public ResponseEntity<List<HuntLogEntry>> log(@PathVariable String huntId) {
    return ResponseEntity.ok(huntService.resultLog(huntId));
  }

  @PostMapping("/{huntId}/log")
  public ResponseEntity<Void> logResult(
      @PathVariable String huntId,
      @Valid @RequestBody LogResultRequest request) {
    huntService.logResult(huntId, request.clientId(), request.message());
    return ResponseEntity.status(HttpStatus.CREATED).build();
  }

  @PostMapping("/{huntId}/completions")
  public ResponseEntity<Void> postCompletion(
      @PathVariable String huntId,
      @Valid @RequestBody TaskCompletion completion) {
    ingestionService.ingest(new TaskCompletion(huntId, completion.clientId(),
        completion.taskId(), completion.outcome(), completion.usage()));
    return ResponseEntity.status(HttpStatus.ACCEPTED).build();
  }

  public record LogResultRequest(@NotBlank String clientId, @NotBlank String message) {}
}
