package com.github.spud.leadagent.infrastructure.persistence.entity;

import com.github.spud.leadagent.domain.memory.LeadSource;
import com.github.spud.leadagent.domain.memory.LeadStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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
@Table(name = "leads")
public class Lead {

  @Id
  @GeneratedValue(strategy = GenerationType.AUTO)
  @Column(name = "id", nullable = false)
  private UUID id;

  @Size(max = 255)
  @NotNull
  @Column(name = "email", nullable = false, unique = true)
  private String email;

  @Size(max = 255)
  @Column(name = "name")
  private String name;

  @Size(max = 255)
  @Column(name = "company")
  private String company;

  @Size(max = 50)
  @Column(name = "phone", length = 50)
  private String phone;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 32)
  private LeadStatus status = LeadStatus.NEW;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(name = "source", nullable = false, length = 32)
  private LeadSource source = LeadSource.OTHER;

  @Column(name = "qualification_score")
  private Double qualificationScore;

  @Size(max = 100)
  @Column(name = "budget_range", length = 100)
  private String budgetRange;

  @Size(max = 100)
  @Column(name = "timeline", length = 100)
  private String timeline;

  @Column(name = "decision_maker")
  private Boolean decisionMaker;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "metadata")
  private Map<String, Object> metadata = new HashMap<>();

  @ColumnDefault("now()")
  @CreationTimestamp
  @Column(name = "created_at")
  private OffsetDateTime createdAt;

  @Column(name = "last_contacted_at")
  private OffsetDateTime lastContactedAt;

  @Column(name = "next_followup_at")
  private OffsetDateTime nextFollowupAt;

}
