package com.fleethunt.pipeline.completion;

import com.fleethunt.model.TaskCompletion;
import com.fleethunt.pipeline.queue.CompletionBus;
import com.fleethunt.service.HuntService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Runs the threads that record queued task completions against their hunts. Completions still
 * queued at shutdown are recorded on the stopping thread, so no terminal outcome is dropped.
 */
@Component
public class CompletionWorkerPool {

  private static final Logger log = LoggerFactory.getLogger(CompletionWorkerPool.class);
  private static final long JOIN_TIMEOUT_MS = 2000;

  private final CompletionBus completionBus;
  private final HuntService huntService;
  private final int workerCount;

  private final List<CompletionWorker> workers = new ArrayList<>();
  private final List<Thread> threads = new ArrayList<>();

  public CompletionWorkerPool(CompletionBus completionBus,
                              HuntService huntService,
                              @Value("${hunt.completion.worker-count:2}") int workerCount) {
    if (workerCount < 1) {
      throw new IllegalArgumentException("Completion worker count must be at least 1");
    }
    this.completionBus = completionBus;
    this.huntService = huntService;
    this.workerCount = workerCount;
  }

  @PostConstruct
  public void start() {
    for (int i = 0; i < workerCount; i++) {
      CompletionWorker worker = new CompletionWorker(completionBus, huntService);
      Thread thread = new Thread(worker, "completion-worker-" + i);
      thread.setDaemon(true);
      workers.add(worker);
      threads.add(thread);
      thread.start();
    }
    log.info("Started {} completion workers (queued={})", workerCount, completionBus.size());
  }

  @PreDestroy
  public void stop() {
    workers.forEach(CompletionWorker::shutdown);
    threads.forEach(Thread::interrupt);
    for (Thread thread : threads) {
      try {
        thread.join(JOIN_TIMEOUT_MS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      }
    }

    List<TaskCompletion> remaining = completionBus.drain();
    if (!remaining.isEmpty()) {
      log.info("Recording {} queued completions before shutdown", remaining.size());
    }
    for (TaskCompletion completion : remaining) {
      try {
        huntService.recordCompletion(completion);
      } catch (RuntimeException e) {
        log.error("Failed to record completion of client {} for hunt {} during shutdown",
            completion.clientId(), completion.huntId(), e);
      }
    }
  }

  int aliveWorkers() {
    return (int) threads.stream().filter(Thread::isAlive).count();
  }
}
