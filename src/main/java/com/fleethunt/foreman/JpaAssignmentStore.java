package com.fleethunt.foreman;

import com.fleethunt.repository.AssignmentKey;
import com.fleethunt.repository.AssignmentRepository;
import java.time.Clock;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

/**
 * Assignment store backed by the {@code assignments} table. The (hunt_id, client_id) primary key
 * makes a second insert fail, which is reported as "already assigned".
 */
@Component
@ConditionalOnProperty(name = "hunt.persistence.enabled", havingValue = "true", matchIfMissing = true)
public class JpaAssignmentStore implements AssignmentStore {

  private static final Logger log = LoggerFactory.getLogger(JpaAssignmentStore.class);

  private final AssignmentRepository repository;
  private final Clock clock;

  public JpaAssignmentStore(AssignmentRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  @Override
  public boolean tryAssign(String huntId, String clientId) {
    try {
      return repository.insertAssignment(huntId, clientId, clock.instant()) == 1;
    } catch (DataIntegrityViolationException e) {
      log.debug("Client {} already assigned to hunt {}", clientId, huntId);
      return false;
    }
  }

  @Override
  public boolean isAssigned(String huntId, String clientId) {
    return repository.existsById(new AssignmentKey(huntId, clientId));
  }

  @Override
  public Set<String> assignedClients(String huntId) {
    Set<String> clients = new TreeSet<>();
    repository.findByIdHuntId(huntId).forEach(a -> clients.add(a.getId().getClientId()));
    return clients;
  }
}
