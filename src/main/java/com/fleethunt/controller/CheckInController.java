package com.fleethunt.controller;

import com.fleethunt.model.ClientRecord;
import com.fleethunt.model.ClientTask;
import com.fleethunt.service.CheckInService;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/clients/{clientId}")
public class CheckInController {

  private final CheckInService checkInService;

  public CheckInController(CheckInService checkInService) {
    this.checkInService = checkInService;
  }

  /**
   * Body is the client's attribute map, keyed by attribute name.
   */
  @PostMapping("/checkin")
  public ResponseEntity<CheckInResponse> checkIn(
      @PathVariable String clientId,
      @RequestBody(required = false) Map<String, Object> attributes) {
    int dispatched = checkInService.checkIn(new ClientRecord(clientId, attributes));
    return ResponseEntity.ok(new CheckInResponse(clientId, dispatched));
  }

  @GetMapping("/tasks")
  public ResponseEntity<List<ClientTask>> tasks(@PathVariable String clientId) {
    return ResponseEntity.ok(checkInService.pollTasks(clientId));
  }

  public record CheckInResponse(String clientId, int dispatched) {}
}
