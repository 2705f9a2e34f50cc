package com.fleethunt.repository;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "assignments")
public class AssignmentEntity {

  @EmbeddedId
  private AssignmentKey id;

  @Column(name = "assigned_at", nullable = false, updatable = false)
  private Instant assignedAt;

  public AssignmentEntity() {}

  public AssignmentKey getId() {
    return id;
  }

  public Instant getAssignedAt() {
    return assignedAt;
  }
}
