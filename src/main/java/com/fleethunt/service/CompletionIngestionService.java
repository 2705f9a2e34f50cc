package com.fleethunt.service;

import com.fleethunt.hunt.HuntRegistry;
import com.fleethunt.model.TaskCompletion;
import com.fleethunt.pipeline.queue.CompletionBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class CompletionIngestionService {

  private static final Logger log = LoggerFactory.getLogger(CompletionIngestionService.class);

  private final CompletionBus completionBus;
  private final HuntRegistry registry;
  private final HuntService huntService;

  public CompletionIngestionService(CompletionBus completionBus,
                                    HuntRegistry registry,
                                    HuntService huntService) {
    this.completionBus = completionBus;
    this.registry = registry;
    this.huntService = huntService;
  }

  /**
   * Queues the completion for the worker pool. Unknown hunts are rejected here so the caller
   * gets the error; a full queue falls back to recording on the calling thread.
   */
  public void ingest(TaskCompletion completion) {
    registry.get(completion.huntId());
    if (!completionBus.publish(completion)) {
      log.warn("Completion queue full, recording inline. huntId={}, clientId={}",
          completion.huntId(), completion.clientId());
      huntService.recordCompletion(completion);
    }
  }
}
