package com.fleethunt.repository;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import java.io.Serializable;
import java.util.Objects;

@Embeddable
public class AssignmentKey implements Serializable {

  @Column(name = "hunt_id", nullable = false)
  private String huntId;

  @Column(name = "client_id", nullable = false)
  private String clientId;

  public AssignmentKey() {}

  public AssignmentKey(String huntId, String clientId) {
    this.huntId = huntId;
    this.clientId = clientId;
  }

  public String getHuntId() {
    return huntId;
  }

  public String getClientId() {
    return clientId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AssignmentKey other)) {
      return false;
    }
    return Objects.equals(huntId, other.huntId) && Objects.equals(clientId, other.clientId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(huntId, clientId);
  }
}
