package com.github.spud.leadagent.domain.kernel;

import com.github.spud.leadagent.config.AgentProperties;
import com.github.spud.leadagent.domain.compose.ResponseComposer;
import com.github.spud.leadagent.domain.decision.DecisionEngine;
import com.github.spud.leadagent.domain.decision.DecisionOutput;
import com.github.spud.leadagent.domain.decision.DecisionType;
import com.github.spud.leadagent.domain.decision.EscalationReasons;
import com.github.spud.leadagent.domain.memory.LeadMemoryService;
import com.github.spud.leadagent.domain.memory.LeadSource;
import com.github.spud.leadagent.domain.memory.LeadStatus;
import com.github.spud.leadagent.domain.rag.Evidence;
import com.github.spud.leadagent.domain.rag.EvidenceReranker;
import com.github.spud.leadagent.domain.rag.EvidenceRetriever;
import com.github.spud.leadagent.domain.rag.RagProperties;
import com.github.spud.leadagent.domain.state.PipelineEvent;
import com.github.spud.leadagent.domain.state.PipelineState;
import com.github.spud.leadagent.domain.state.StateMachineDriver;
import com.github.spud.leadagent.domain.tools.ActionDispatcher;
import com.github.spud.leadagent.domain.tools.ActionOutcome;
import com.github.spud.leadagent.domain.tools.ActionType;
import com.github.spud.leadagent.domain.tools.CrmActionAdapter;
import com.github.spud.leadagent.domain.tools.ToolExecutionService;
import com.github.spud.leadagent.domain.tools.ToolResult;
import com.github.spud.leadagent.infrastructure.persistence.entity.Lead;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.statemachine.StateMachine;
import org.springframework.stereotype.Component;

/**
 * 线索处理编排器 驱动状态机，按固定 DAG 顺序执行各阶段
 * <p>
 * 关键约束：<p> - 每个请求独占一个 {@link RunState} 与一个状态机实例<p> - 检索失败降级为空证据，回复生成失败强制转人工<p> -
 * 任何未处理异常在顶层兜底为 orchestration_error，保证一定返回回复与明确的转人工状态<p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LeadAgentOrchestrator {

  public static final String HANDOFF_RESPONSE = "Thank you for your inquiry. I want to ensure you "
    + "get the best possible assistance, so I'm connecting you with one of our team members who "
    + "will follow up with you shortly.";

  public static final String FAILURE_RESPONSE = "I apologize, but I'm experiencing technical "
    + "difficulties. A team member will assist you shortly.";

  static final String NEXT_ACTION_HUMAN = "human_followup";
  static final String NEXT_ACTION_AWAIT_REPLY = "await_lead_reply";
  static final String NEXT_ACTION_MEETING = "attend_meeting";

  private static final String MDC_TRACE_ID = "traceId";

  private final StateMachineDriver stateMachineDriver;
  private final LeadMemoryService leadMemoryService;
  private final DecisionEngine decisionEngine;
  private final EvidenceRetriever evidenceRetriever;
  private final EvidenceReranker evidenceReranker;
  private final ResponseComposer responseComposer;
  private final ActionDispatcher actionDispatcher;
  private final ToolExecutionService toolExecutionService;
  private final AgentProperties agentProperties;
  private final RagProperties ragProperties;

  /**
   * 处理一条入站消息
   */
  public PipelineResult run(InboundLead request) {
    RunState state = RunState.builder()
      .leadEmail(request.email())
      .leadName(request.name())
      .query(request.message())
      .source(request.source())
      .requestMetadata(request.metadata() != null
        ? new HashMap<>(request.metadata()) : new HashMap<>())
      .build();
    return run(state);
  }

  PipelineResult run(RunState state) {
    MDC.put(MDC_TRACE_ID, state.getTraceId());
    log.info("Starting lead pipeline: traceId={}, source={}, query='{}'",
      state.getTraceId(), state.getSource(), truncate(state.getQuery(), 100));

    StateMachine<PipelineState, PipelineEvent> sm = null;
    try {
      sm = stateMachineDriver.start(state.getTraceId());

      // 主循环：执行当前阶段，发送其产生的事件
      while (!stateMachineDriver.isFinished(sm)) {
        PipelineState current = stateMachineDriver.currentState(sm);
        state.setCurrentState(current);

        long startTime = System.currentTimeMillis();
        PipelineEvent event = executeStage(current, state);
        state.addStageRecord(StageRecord.builder()
          .state(current)
          .event(event.name())
          .summary(summarize(current, state))
          .durationMs(System.currentTimeMillis() - startTime)
          .timestamp(Instant.now())
          .build());

        stateMachineDriver.fire(sm, event, state);
      }

      state.setCurrentState(stateMachineDriver.currentState(sm));
      finalizeRun(state);

    } catch (Exception e) {
      log.error("Lead pipeline failed in {}: {}", state.getCurrentState(), e.getMessage(), e);
      state.addStageRecord(StageRecord.builder()
        .state(state.getCurrentState())
        .error(e.getMessage() != null ? e.getMessage() : e.getClass().getName())
        .timestamp(Instant.now())
        .build());
      absorbFailure(state, e);

    } finally {
      stopQuietly(sm);
      log.info("Lead pipeline finished: traceId={}, escalated={}, reason={}, confidence={}",
        state.getTraceId(), state.isEscalated(), state.getEscalationReason(),
        state.getConfidence());
      MDC.remove(MDC_TRACE_ID);
    }

    return PipelineResult.fromRunState(state);
  }

  private PipelineEvent executeStage(PipelineState current, RunState state) {
    switch (current) {
      case INTAKE:
        return intake(state);
      case LOAD_CONTEXT:
        return loadContext(state);
      case DECIDE:
        return decide(state);
      case RETRIEVE:
        return retrieve(state);
      case COMPOSE:
        return compose(state);
      case ESCALATE:
        return escalate(state);
      case TOOLS:
        return executeTools(state);
      case MEMORY:
        return writeMemory(state);
      default:
        throw new IllegalStateException("No stage handler for state " + current);
    }
  }

  private PipelineEvent intake(RunState state) {
    if (state.getLeadEmail() == null || state.getLeadEmail().isBlank()) {
      throw new IllegalArgumentException("Lead email is required");
    }
    if (state.getQuery() == null) {
      state.setQuery("");
    }
    return PipelineEvent.ACCEPTED;
  }

  /**
   * 获取或创建线索，加载最近对话（正序）
   */
  private PipelineEvent loadContext(RunState state) {
    Lead lead = leadMemoryService.getOrCreateLead(state.getLeadEmail(), state.getLeadName(),
      LeadSource.fromValue(state.getSource()));
    state.setLeadId(lead.getId().toString());
    state.setLead(LeadMemoryService.toSnapshot(lead));
    state.setHistory(new ArrayList<>(
      leadMemoryService.recentConversation(lead.getId(), agentProperties.getHistoryLimit())));

    log.debug("Context loaded: leadId={}, status={}, historyTurns={}", state.getLeadId(),
      state.getLead().status(), state.getHistory().size());
    return PipelineEvent.CONTEXT_LOADED;
  }

  private PipelineEvent decide(RunState state) {
    DecisionOutput decision = decisionEngine.decide(state.getQuery(), state.getHistory(),
      state.getLead(), state.getRawEvidence());

    state.setDecisionType(decision.getDecision());
    state.setConfidence(decision.getConfidence());
    state.setReasoning(decision.getReasoning());
    state.setRetrievalNeeded(decision.isRetrievalNeeded());
    state.setToolsToUse(new ArrayList<>(decision.getToolsNeeded()));

    if (decision.getDecision() == DecisionType.ESCALATE) {
      state.escalate(decision.getEscalationReason() != null
        ? decision.getEscalationReason() : EscalationReasons.AGENT_DECISION);
    }

    return decision.isRetrievalNeeded()
      ? PipelineEvent.RETRIEVAL_REQUIRED
      : PipelineEvent.RETRIEVAL_SKIPPED;
  }

  /**
   * 检索 → 重排 → 过滤 → 冲突检测，冲突时降低置信度
   */
  private PipelineEvent retrieve(RunState state) {
    List<Evidence> hits = evidenceRetriever.retrieve(state.getQuery(), ragProperties.getTopK());
    state.setRawEvidence(Evidence.copyAll(hits));

    List<Evidence> reranked = evidenceReranker.rerank(new ArrayList<>(hits));
    List<Evidence> filtered = evidenceReranker.filterLowQuality(reranked,
      ragProperties.getConfidenceThreshold());
    state.setEvidence(filtered);

    if (evidenceReranker.detectConflicts(filtered)) {
      state.setConflictDetected(true);
      state.setConfidence(state.getConfidence() * ragProperties.getConflictPenalty());
      log.warn("Conflicting evidence detected, confidence lowered to {}", state.getConfidence());
    }

    log.info("Evidence ready: raw={}, kept={}", state.getRawEvidence().size(), filtered.size());
    return PipelineEvent.EVIDENCE_READY;
  }

  private PipelineEvent compose(RunState state) {
    responseComposer.compose(state);

    if (state.isEscalated()) {
      return PipelineEvent.ESCALATION_REQUIRED;
    }
    return state.hasPendingActions()
      ? PipelineEvent.ACTIONS_PENDING
      : PipelineEvent.RESPONSE_READY;
  }

  /**
   * 转人工：覆盖回复，记录事件，更新线索状态
   */
  private PipelineEvent escalate(RunState state) {
    state.setResponseText(HANDOFF_RESPONSE);
    recordEscalation(state);
    return PipelineEvent.HANDOFF_DONE;
  }

  private PipelineEvent executeTools(RunState state) {
    actionDispatcher.dispatch(state);
    return PipelineEvent.ACTIONS_DONE;
  }

  /**
   * 写入双方交互；动作阶段触发的转人工在此补记事件
   */
  private PipelineEvent writeMemory(RunState state) {
    UUID leadId = UUID.fromString(state.getLeadId());
    leadMemoryService.addInteraction(leadId, ConversationTurn.LEAD, state.getQuery(),
      null, null, null, null);
    leadMemoryService.addInteraction(leadId, ConversationTurn.AGENT, state.getResponseText(),
      state.getDecisionType() != null ? state.getDecisionType().name() : null,
      state.getConfidence(), state.getToolsToUse(), state.getSourcesUsed());

    if (state.isEscalated() && !state.isEscalationRecorded()) {
      recordEscalation(state);
    }
    return PipelineEvent.MEMORY_WRITTEN;
  }

  private void recordEscalation(RunState state) {
    UUID leadId = UUID.fromString(state.getLeadId());

    List<String> errors = new ArrayList<>(state.getErrors());
    errors.addAll(state.getToolErrors());
    Map<String, Object> context = new HashMap<>();
    context.put("query", state.getQuery());
    context.put("decision", state.getDecisionType() != null
      ? state.getDecisionType().name() : null);
    context.put("errors", errors);

    leadMemoryService.recordEscalation(leadId, state.getEscalationReason(),
      state.getConfidence(), context);

    ToolResult statusResult = toolExecutionService.executeOnce(ActionType.CRM,
      CrmActionAdapter.UPDATE_STATUS,
      Map.of("lead_id", state.getLeadId(), "status", LeadStatus.ESCALATED.value()));
    if (!statusResult.success()) {
      state.addError("Escalation status update failed: " + statusResult.error());
    }
    state.setEscalationRecorded(true);
  }

  private void finalizeRun(RunState state) {
    state.setEndTime(Instant.now());
    state.setNextAction(nextAction(state));
  }

  static String nextAction(RunState state) {
    if (state.isEscalated()) {
      return NEXT_ACTION_HUMAN;
    }
    if (state.getDecisionType() == DecisionType.CLARIFY) {
      return NEXT_ACTION_AWAIT_REPLY;
    }
    boolean meetingBooked = state.getActionOutcomes().stream()
      .filter(o -> o.getType() == ActionType.CALENDAR)
      .map(ActionOutcome::getResult)
      .anyMatch(r -> r.success() && r.data().containsKey("meeting_id"));
    return meetingBooked ? NEXT_ACTION_MEETING : null;
  }

  /**
   * 顶层兜底：转人工并返回通用致歉
   */
  private void absorbFailure(RunState state, Exception e) {
    state.escalate(EscalationReasons.ORCHESTRATION_ERROR);
    state.addError(e.getMessage() != null ? e.getMessage() : e.getClass().getName());
    state.setResponseText(FAILURE_RESPONSE);
    state.setGrounded(false);
    state.setSourcesUsed(new ArrayList<>());
    state.setEndTime(Instant.now());
    state.setNextAction(NEXT_ACTION_HUMAN);
  }

  private void stopQuietly(StateMachine<PipelineState, PipelineEvent> sm) {
    if (sm == null) {
      return;
    }
    try {
      stateMachineDriver.stop(sm);
    } catch (Exception e) {
      log.warn("Failed to stop state machine: {}", e.getMessage());
    }
  }

  private static String summarize(PipelineState stage, RunState state) {
    switch (stage) {
      case LOAD_CONTEXT:
        return "historyTurns=" + state.getHistory().size();
      case DECIDE:
        return "decision=" + state.getDecisionType() + ", confidence=" + state.getConfidence();
      case RETRIEVE:
        return "raw=" + state.getRawEvidence().size() + ", kept=" + state.getEvidence().size();
      case COMPOSE:
        return "grounded=" + state.isGrounded() + ", escalated=" + state.isEscalated();
      case TOOLS:
        return "actions=" + state.getActionOutcomes().size() + ", errors="
          + state.getToolErrors().size();
      case ESCALATE:
        return "reason=" + state.getEscalationReason();
      default:
        return null;
    }
  }

  private static String truncate(String text, int maxLen) {
    if (text == null) {
      return "";
    }
    return text.length() > maxLen ? text.substring(0, maxLen) + "..." : text;
  }
}
