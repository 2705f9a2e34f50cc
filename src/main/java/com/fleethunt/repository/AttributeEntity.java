package com.fleethunt.repository;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import java.time.Instant;

/**
 * One entry of the append-only attribute log. {@code id} preserves insertion order.
 */
@Entity
@Table(name = "attributes", indexes = {
    @Index(name = "idx_attributes_subject_attribute", columnList = "subject, attribute")
})
public class AttributeEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false, updatable = false)
  private Long id;

  @Column(name = "subject", nullable = false, updatable = false)
  private String subject;

  @Column(name = "attribute", nullable = false, updatable = false, length = 64)
  private String attribute;

  @Lob
  @Column(name = "value_json", nullable = false, updatable = false)
  private String valueJson;

  @Column(name = "recorded_at", nullable = false, updatable = false)
  private Instant recordedAt;

  public AttributeEntity() {}

  public AttributeEntity(String subject, String attribute, String valueJson, Instant recordedAt) {
    this.subject = subject;
    this.attribute = attribute;
    this.valueJson = valueJson;
    this.recordedAt = recordedAt;
  }

  public Long getId() {
    return id;
  }

  public String getSubject() {
    return subject;
  }

  public String getAttribute() {
    return attribute;
  }

  public String getValueJson() {
    return valueJson;
  }

  public Instant getRecordedAt() {
    return recordedAt;
  }
}
