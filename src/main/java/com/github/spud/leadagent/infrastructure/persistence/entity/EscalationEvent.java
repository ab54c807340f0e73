package com.github.spud.leadagent.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Getter
@Setter
@Entity
@Table(name = "escalation_events")
public class EscalationEvent {

  public static final String PENDING = "pending";

  @Id
  @GeneratedValue(strategy = GenerationType.AUTO)
  @Column(name = "id", nullable = false)
  private UUID id;

  @NotNull
  @Column(name = "lead_id", nullable = false)
  private UUID leadId;

  @Size(max = 64)
  @NotNull
  @Column(name = "reason", nullable = false, length = 64)
  private String reason;

  @Column(name = "confidence_score")
  private Double confidenceScore;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "context")
  private Map<String, Object> context = new HashMap<>();

  @Size(max = 32)
  @Column(name = "resolved", length = 32)
  private String resolved = PENDING;

  @ColumnDefault("now()")
  @CreationTimestamp
  @Column(name = "created_at")
  private OffsetDateTime createdAt;

}
