package com.fleethunt.controller;

import com.fleethunt.notification.NotificationBuffer;
import com.fleethunt.notification.NotificationRecord;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Recent hunt notifications, optionally narrowed to one hunt.
 */
@RestController
@RequestMapping("/api/v1/notifications")
public class NotificationController {

  private final NotificationBuffer buffer;

  public NotificationController(NotificationBuffer buffer) {
    this.buffer = buffer;
  }

  @GetMapping
  public ResponseEntity<List<NotificationRecord>> recent(
      @RequestParam(value = "huntId", required = false) String huntId) {
    return ResponseEntity.ok(buffer.recent(huntId));
  }

  @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public SseEmitter stream(@RequestParam(value = "huntId", required = false) String huntId) {
    return buffer.subscribe(huntId);
  }
}
