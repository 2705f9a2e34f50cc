package com.fleethunt.hunt;

/**
 * Hands a started client over to the task-execution layer. Implementations must not block on the
 * task itself; the outcome comes back later as a completion.
 */
public interface Dispatcher {

  void startClient(String huntId, String clientId, int clientLimit);

  /** Drops tasks of the hunt that have not been delivered yet. Returns how many were dropped. */
  default int cancel(String huntId) {
    return 0;
  }

  default int pending(String huntId) {
    return 0;
  }
}
