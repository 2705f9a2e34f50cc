package com.fleethunt.pipeline.queue;

import com.fleethunt.model.TaskCompletion;
import java.util.List;

public interface CompletionBus {

  /**
   * Queue a completion for asynchronous recording.
   *
   * @return true if the completion was accepted, false if the queue was full and the caller
   *         must record it itself.
   */
  boolean publish(TaskCompletion completion);

  TaskCompletion take() throws InterruptedException;

  /** Removes and returns everything still queued, oldest first. */
  List<TaskCompletion> drain();

  int size();
}
