package com.fleethunt.pipeline.completion;

import com.fleethunt.model.TaskCompletion;
import com.fleethunt.pipeline.queue.CompletionBus;
import com.fleethunt.service.HuntService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CompletionWorker implements Runnable {

  private static final Logger log = LoggerFactory.getLogger(CompletionWorker.class);

  private final CompletionBus completionBus;
  private final HuntService huntService;

  private volatile boolean running = true;

  public CompletionWorker(CompletionBus completionBus, HuntService huntService) {
    this.completionBus = completionBus;
    this.huntService = huntService;
  }

  @Override
  public void run() {
    log.info("CompletionWorker started");
    while (running && !Thread.currentThread().isInterrupted()) {
      TaskCompletion completion = null;
      try {
        completion = completionBus.take();
        huntService.recordCompletion(completion);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      } catch (Exception e) {
        log.error("Failed to record completion of client {} for hunt {}",
            completion != null ? completion.clientId() : null,
            completion != null ? completion.huntId() : null, e);
      }
    }
    log.info("CompletionWorker stopped");
  }

  public void shutdown() {
    this.running = false;
  }
}
