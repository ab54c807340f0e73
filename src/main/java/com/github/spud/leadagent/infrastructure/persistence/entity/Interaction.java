package com.github.spud.leadagent.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
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
@Table(name = "interactions", indexes = @Index(name = "idx_interactions_lead", columnList = "lead_id"))
public class Interaction {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false)
  private Long id;

  @NotNull
  @Column(name = "lead_id", nullable = false)
  private UUID leadId;

  /**
   * lead 或 agent
   */
  @Size(max = 16)
  @NotNull
  @Column(name = "message_from", nullable = false, length = 16)
  private String messageFrom;

  @NotNull
  @Column(name = "message_text", nullable = false, length = Integer.MAX_VALUE)
  private String messageText;

  @Size(max = 32)
  @Column(name = "decision_type", length = 32)
  private String decisionType;

  @Column(name = "confidence_score")
  private Double confidenceScore;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "tools_used")
  private List<String> toolsUsed = new ArrayList<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "sources_retrieved")
  private List<String> sourcesRetrieved = new ArrayList<>();

  @ColumnDefault("now()")
  @CreationTimestamp
  @Column(name = "created_at")
  private OffsetDateTime createdAt;

}
