package com.fleethunt.controller;

import com.fleethunt.enums.ApprovalState;
import com.fleethunt.model.ApprovalGrantDto;
import com.fleethunt.model.ApprovalRecord;
import com.fleethunt.model.ApprovalRequestDto;
import com.fleethunt.service.HuntService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/hunts/{huntId}/approvals")
@Validated
public class ApprovalController {

  private final HuntService huntService;

  public ApprovalController(HuntService huntService) {
    this.huntService = huntService;
  }

  @PostMapping
  public ResponseEntity<ApprovalRecord> request(
      @PathVariable String huntId,
      @RequestHeader(ActorHeaders.USER) @NotBlank String user,
      @Valid @RequestBody ApprovalRequestDto request) {
    return ResponseEntity
        .status(HttpStatus.CREATED)
        .body(huntService.requestApproval(huntId, user, request));
  }

  @PostMapping("/grant")
  public ResponseEntity<ApprovalRecord> grant(
      @PathVariable String huntId,
      @RequestHeader(ActorHeaders.USER) @NotBlank String user,
      @Valid @RequestBody ApprovalGrantDto grant) {
    return ResponseEntity.ok(huntService.grantApproval(huntId, user, grant));
  }

  @GetMapping
  public ResponseEntity<List<ApprovalRecord>> list(@PathVariable String huntId) {
    return ResponseEntity.ok(huntService.approvals(huntId));
  }

  @GetMapping("/state")
  public ResponseEntity<ApprovalState> state(
      @PathVariable String huntId,
      @RequestParam("requester") String requester) {
    return ResponseEntity.ok(huntService.approvalState(huntId, requester));
  }
}
