package com.fleethunt.hunt;

import com.fleethunt.model.ClientTask;
import java.time.Clock;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class QueueingDispatcher implements Dispatcher {

  private static final Logger log = LoggerFactory.getLogger(QueueingDispatcher.class);

  private final ClientTaskQueue queue;
  private final Clock clock;

  public QueueingDispatcher(ClientTaskQueue queue, Clock clock) {
    this.queue = queue;
    this.clock = clock;
  }

  @Override
  public void startClient(String huntId, String clientId, int clientLimit) {
    ClientTask task = new ClientTask(
        UUID.randomUUID().toString(), huntId, clientId, clientLimit, clock.instant());
    queue.enqueue(task);
    log.debug("Queued task {} of hunt {} for client {}", task.taskId(), huntId, clientId);
  }

  @Override
  public int cancel(String huntId) {
    int purged = queue.purge(huntId);
    if (purged > 0) {
      log.info("Purged {} undelivered task(s) of hunt {}", purged, huntId);
    }
    return purged;
  }

  @Override
  public int pending(String huntId) {
    return queue.pending(huntId);
  }
}
