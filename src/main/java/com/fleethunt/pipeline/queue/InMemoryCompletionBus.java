package com.fleethunt.pipeline.queue;

import com.fleethunt.model.TaskCompletion;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class InMemoryCompletionBus implements CompletionBus {

  private final BlockingQueue<TaskCompletion> queue;

  public InMemoryCompletionBus(@Value("${hunt.completion.queue-capacity:10000}") int capacity) {
    this.queue = new LinkedBlockingQueue<>(capacity);
  }

  @Override
  public boolean publish(TaskCompletion completion) {
    return queue.offer(completion);
  }

  @Override
  public TaskCompletion take() throws InterruptedException {
    return queue.take();
  }

  @Override
  public List<TaskCompletion> drain() {
    List<TaskCompletion> remaining = new ArrayList<>();
    queue.drainTo(remaining);
    return remaining;
  }

  @Override
  public int size() {
    return queue.size();
  }
}
