package com.fleethunt.hunt;

import com.fleethunt.model.ClientTask;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Per-client queues of tasks waiting for the client's next poll.
 */
@Component
public class ClientTaskQueue {

  private final Map<String, Deque<ClientTask>> queues = new HashMap<>();

  public synchronized void enqueue(ClientTask task) {
    queues.computeIfAbsent(task.clientId(), id -> new ArrayDeque<>()).addLast(task);
  }

  public synchronized List<ClientTask> drain(String clientId) {
    Deque<ClientTask> queue = queues.remove(clientId);
    return queue == null ? List.of() : new ArrayList<>(queue);
  }

  public synchronized int pending(String huntId) {
    int count = 0;
    for (Deque<ClientTask> queue : queues.values()) {
      for (ClientTask task : queue) {
        if (task.huntId().equals(huntId)) {
          count++;
        }
      }
    }
    return count;
  }

  public synchronized int purge(String huntId) {
    int purged = 0;
    Iterator<Map.Entry<String, Deque<ClientTask>>> entries = queues.entrySet().iterator();
    while (entries.hasNext()) {
      Deque<ClientTask> queue = entries.next().getValue();
      Iterator<ClientTask> tasks = queue.iterator();
      while (tasks.hasNext()) {
        if (tasks.next().huntId().equals(huntId)) {
          tasks.remove();
          purged++;
        }
      }
      if (queue.isEmpty()) {
        entries.remove();
      }
    }
    return purged;
  }
}
