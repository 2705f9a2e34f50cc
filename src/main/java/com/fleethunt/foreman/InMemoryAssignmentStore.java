package com.fleethunt.foreman;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "hunt.persistence.enabled", havingValue = "false")
public class InMemoryAssignmentStore implements AssignmentStore {

  private final Map<String, Set<String>> assignments = new ConcurrentHashMap<>();

  @Override
  public boolean tryAssign(String huntId, String clientId) {
    return assignments
        .computeIfAbsent(huntId, id -> ConcurrentHashMap.newKeySet())
        .add(clientId);
  }

  @Override
  public boolean isAssigned(String huntId, String clientId) {
    Set<String> clients = assignments.get(huntId);
    return clients != null && clients.contains(clientId);
  }

  @Override
  public Set<String> assignedClients(String huntId) {
    Set<String> clients = assignments.get(huntId);
    return clients == null ? Set.of() : new TreeSet<>(clients);
  }
}
