package com.github.spud.leadagent.domain.kernel;

import com.github.spud.leadagent.domain.decision.DecisionType;
import com.github.spud.leadagent.domain.state.PipelineState;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * 流水线输出
 */
@Data
@Builder
public class PipelineResult {

  private String traceId;

  private String leadId;

  private String responseText;

  private double confidence;

  private DecisionType decisionType;

  private List<String> sourcesUsed;

  private List<String> toolsCalled;

  private boolean grounded;

  private boolean escalated;

  private String escalationReason;

  private String nextAction;

  private List<String> errors;

  /**
   * 最终状态
   */
  private PipelineState finalState;

  private List<StageRecord> stageRecords;

  private long totalDurationMs;

  private Instant startTime;

  private Instant endTime;

  public static PipelineResult fromRunState(RunState state) {
    Instant end = state.getEndTime() != null ? state.getEndTime() : Instant.now();
    return PipelineResult.builder()
      .traceId(state.getTraceId())
      .leadId(state.getLeadId())
      .responseText(state.getResponseText())
      .confidence(state.getConfidence())
      .decisionType(state.getDecisionType())
      .sourcesUsed(new ArrayList<>(state.getSourcesUsed()))
      .toolsCalled(new ArrayList<>(state.getToolsToUse()))
      .grounded(state.isGrounded())
      .escalated(state.isEscalated())
      .escalationReason(state.getEscalationReason())
      .nextAction(state.getNextAction())
      .errors(new ArrayList<>(state.getErrors()))
      .finalState(state.getCurrentState())
      .stageRecords(new ArrayList<>(state.getStageRecords()))
      .totalDurationMs(end.toEpochMilli() - state.getStartTime().toEpochMilli())
      .startTime(state.getStartTime())
      .endTime(end)
      .build();
  }
}
