package com.fleethunt.repository;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface AttributeRepository extends JpaRepository<AttributeEntity, Long> {

  List<AttributeEntity> findBySubjectAndAttributeOrderByIdAsc(String subject, String attribute);

  boolean existsBySubject(String subject);

  @Query("select distinct a.subject from AttributeEntity a order by a.subject")
  List<String> findDistinctSubjects();

  @Modifying
  @Transactional
  @Query("delete from AttributeEntity a where a.subject = :subject and a.attribute = :attribute")
  int deleteBySubjectAndAttribute(@Param("subject") String subject,
                                  @Param("attribute") String attribute);
}
