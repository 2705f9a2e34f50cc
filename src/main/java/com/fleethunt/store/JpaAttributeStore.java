package com.fleethunt.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleethunt.exception.HuntException;
import com.fleethunt.model.AttributeValue;
import com.fleethunt.repository.AttributeEntity;
import com.fleethunt.repository.AttributeRepository;
import java.time.Clock;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Attribute store backed by the {@code attributes} table. Values are stored as JSON.
 */
@Component
@ConditionalOnProperty(name = "hunt.persistence.enabled", havingValue = "true", matchIfMissing = true)
public class JpaAttributeStore implements AttributeStore {

  private final AttributeRepository repository;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public JpaAttributeStore(AttributeRepository repository, ObjectMapper objectMapper, Clock clock) {
    this.repository = repository;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  public boolean exists(String subject) {
    return repository.existsBySubject(subject);
  }

  @Override
  public List<String> subjects() {
    return repository.findDistinctSubjects();
  }

  @Override
  @Transactional
  public void set(String subject, String attribute, Object value) {
    repository.deleteBySubjectAndAttribute(subject, attribute);
    repository.save(new AttributeEntity(subject, attribute, toJson(value), clock.instant()));
  }

  @Override
  @Transactional
  public void append(String subject, String attribute, Object value) {
    repository.save(new AttributeEntity(subject, attribute, toJson(value), clock.instant()));
  }

  @Override
  @Transactional(readOnly = true)
  public <T> List<AttributeValue<T>> history(String subject, String attribute, Class<T> type) {
    return repository.findBySubjectAndAttributeOrderByIdAsc(subject, attribute).stream()
        .map(entity -> new AttributeValue<>(fromJson(entity.getValueJson(), type),
            entity.getRecordedAt()))
        .toList();
  }

  private String toJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new HuntException("Failed to serialize attribute value", e);
    }
  }

  private <T> T fromJson(String json, Class<T> type) {
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new HuntException("Failed to deserialize attribute value as " + type.getSimpleName(), e);
    }
  }
}
