package com.github.spud.leadagent.domain.kernel;

import com.github.spud.leadagent.domain.decision.DecisionType;
import com.github.spud.leadagent.domain.rag.Evidence;
import com.github.spud.leadagent.domain.state.PipelineState;
import com.github.spud.leadagent.domain.tools.ActionOutcome;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Data;
import lombok.Setter;

/**
 * 单次请求的运行记录，由编排器独占，按阶段顺序修改
 * <p>
 * 不变式：置信度始终在 [0, 1]；escalated 为 true 时必有原因；errors 只追加。
 */
@Data
public class RunState {

  /**
   * 追踪 ID
   */
  @Setter(AccessLevel.NONE)
  private String traceId = UUID.randomUUID().toString();

  @Setter(AccessLevel.NONE)
  private String leadId;

  private String leadEmail;

  /**
   * 请求中携带的线索姓名
   */
  private String leadName;

  private String query;

  /**
   * 来源渠道
   */
  private String source;

  private Map<String, Object> requestMetadata = new HashMap<>();

  // ===== 上下文 =====

  private LeadSnapshot lead;

  private List<ConversationTurn> history = new ArrayList<>();

  // ===== 决策 =====

  private DecisionType decisionType;

  @Setter(AccessLevel.NONE)
  private double confidence;

  private String reasoning;

  private boolean retrievalNeeded;

  private List<String> toolsToUse = new ArrayList<>();

  // ===== 证据 =====

  /**
   * 原始检索结果（保留原始分数）
   */
  private List<Evidence> rawEvidence = new ArrayList<>();

  /**
   * 重排、过滤后的证据，按综合分降序
   */
  private List<Evidence> evidence = new ArrayList<>();

  private boolean conflictDetected;

  // ===== 回复 =====

  private String responseText;

  private boolean grounded;

  private List<String> sourcesUsed = new ArrayList<>();

  // ===== 动作 =====

  private List<ActionOutcome> actionOutcomes = new ArrayList<>();

  private List<String> toolErrors = new ArrayList<>();

  // ===== 控制 =====

  @Setter(AccessLevel.NONE)
  private boolean escalated;

  @Setter(AccessLevel.NONE)
  private String escalationReason;

  /**
   * 转人工事件是否已落库
   */
  private boolean escalationRecorded;

  @Setter(AccessLevel.NONE)
  private List<String> errors = new ArrayList<>();

  private String nextAction;

  private PipelineState currentState = PipelineState.INTAKE;

  private List<StageRecord> stageRecords = new ArrayList<>();

  private Instant startTime = Instant.now();

  private Instant endTime;

  /**
   * 只有入站字段可由构建器设置，置信度与转人工状态只能经由 setter 与 {@link #escalate}
   */
  @Builder
  private RunState(String leadEmail, String leadName, String query, String source,
    Map<String, Object> requestMetadata) {
    this.leadEmail = leadEmail;
    this.leadName = leadName;
    this.query = query;
    this.source = source;
    if (requestMetadata != null) {
      this.requestMetadata.putAll(requestMetadata);
    }
  }

  /**
   * 绑定线索 ID，一旦设置不可更改
   */
  public void setLeadId(String leadId) {
    if (this.leadId != null && !this.leadId.equals(leadId)) {
      throw new IllegalStateException("Lead id already bound: " + this.leadId);
    }
    this.leadId = leadId;
  }

  /**
   * 设置置信度，截断到 [0, 1]
   */
  public void setConfidence(double confidence) {
    this.confidence = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
  }

  /**
   * 标记转人工，原因不可为空
   */
  public void escalate(String reason) {
    this.escalationReason = Objects.requireNonNull(reason, "escalation reason");
    this.escalated = true;
  }

  public void addError(String error) {
    errors.add(error);
  }

  public List<String> getErrors() {
    return Collections.unmodifiableList(errors);
  }

  public void addStageRecord(StageRecord record) {
    stageRecords.add(record);
  }

  /**
   * 请求了动作且尚未转人工
   */
  public boolean hasPendingActions() {
    return !escalated && toolsToUse != null && !toolsToUse.isEmpty();
  }
}
