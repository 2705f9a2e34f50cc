package com.fleethunt.repository;

import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface AssignmentRepository extends JpaRepository<AssignmentEntity, AssignmentKey> {

  /**
   * Plain insert so that a duplicate (hunt, client) pair fails on the primary key instead of
   * being merged.
   */
  @Modifying
  @Transactional
  @Query(value = "INSERT INTO assignments (hunt_id, client_id, assigned_at) "
      + "VALUES (:huntId, :clientId, :assignedAt)", nativeQuery = true)
  int insertAssignment(@Param("huntId") String huntId,
                       @Param("clientId") String clientId,
                       @Param("assignedAt") Instant assignedAt);

  List<AssignmentEntity> findByIdHuntId(String huntId);
}
