package com.fleethunt.controller;

import com.fleethunt.exception.ValidationException;
import com.fleethunt.model.ClientRecord;
import com.fleethunt.model.ClientTask;
import com.fleethunt.service.CheckInService;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CheckInController.class)
class CheckInControllerTest {

  @Autowired
  private MockMvc mockMvc;

  @MockBean
  private CheckInService checkInService;

  @Test
  void checkInReportsDispatchedCount() throws Exception {
    given(checkInService.checkIn(argThat((ClientRecord c) -> "C.1".equals(c.clientId())
        && "Linux".equals(c.attributes().get("System"))
        && Integer.valueOf(1_700_000_000).equals(c.attributes().get("Clock")))))
        .willReturn(2);

    mockMvc.perform(
            post("/api/v1/clients/C.1/checkin")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"System\":\"Linux\",\"Clock\":1700000000}")
        )
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.clientId").value("C.1"))
        .andExpect(jsonPath("$.dispatched").value(2));
  }

  @Test
  void checkInWithoutBodyIsAccepted() throws Exception {
    given(checkInService.checkIn(any(ClientRecord.class))).willReturn(0);

    mockMvc.perform(post("/api/v1/clients/C.1/checkin"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.dispatched").value(0));
  }

  @Test
  void invalidClientIdReturns400() throws Exception {
    given(checkInService.checkIn(any(ClientRecord.class)))
        .willThrow(new ValidationException("Client id must not be blank"));

    mockMvc.perform(post("/api/v1/clients/{clientId}/checkin", " "))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Client id must not be blank"));
  }

  @Test
  void pollReturnsQueuedTasks() throws Exception {
    given(checkInService.pollTasks("C.1")).willReturn(List.of(
        new ClientTask("task-1", "H:1", "C.1", 0, Instant.parse("2026-03-01T00:00:00Z"))));

    mockMvc.perform(get("/api/v1/clients/C.1/tasks"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].huntId").value("H:1"))
        .andExpect(jsonPath("$[0].taskId").value("task-1"));
  }
}
