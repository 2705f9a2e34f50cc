package com.fleethunt.service;

import com.fleethunt.exception.ValidationException;
import com.fleethunt.foreman.Foreman;
import com.fleethunt.hunt.ClientTaskQueue;
import com.fleethunt.model.ClientRecord;
import com.fleethunt.model.ClientTask;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class CheckInService {

  private final Foreman foreman;
  private final ClientTaskQueue taskQueue;

  public CheckInService(Foreman foreman, ClientTaskQueue taskQueue) {
    this.foreman = foreman;
    this.taskQueue = taskQueue;
  }

  /**
   * @return number of hunts newly dispatched to the client
   */
  public int checkIn(ClientRecord client) {
    if (client == null || client.clientId() == null || client.clientId().isBlank()) {
      throw new ValidationException("Client id must not be blank");
    }
    return foreman.assignTasksToClient(client);
  }

  /** Hands over and forgets every task queued for the client. */
  public List<ClientTask> pollTasks(String clientId) {
    return taskQueue.drain(clientId);
  }
}
