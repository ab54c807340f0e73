package com.github.spud.leadagent.domain.kernel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.spud.leadagent.config.AgentProperties;
import com.github.spud.leadagent.domain.compose.ResponseComposer;
import com.github.spud.leadagent.domain.decision.DecisionEngine;
import com.github.spud.leadagent.domain.decision.DecisionOutput;
import com.github.spud.leadagent.domain.decision.DecisionResponseParser;
import com.github.spud.leadagent.domain.decision.DecisionType;
import com.github.spud.leadagent.domain.decision.EscalationReasons;
import com.github.spud.leadagent.domain.llm.GenerationResult;
import com.github.spud.leadagent.domain.llm.LlmGateway;
import com.github.spud.leadagent.domain.memory.LeadMemoryService;
import com.github.spud.leadagent.domain.rag.Evidence;
import com.github.spud.leadagent.domain.rag.EvidenceReranker;
import com.github.spud.leadagent.domain.rag.EvidenceRetriever;
import com.github.spud.leadagent.domain.rag.RagProperties;
import com.github.spud.leadagent.domain.state.PipelineEvent;
import com.github.spud.leadagent.domain.state.PipelineState;
import com.github.spud.leadagent.domain.state.PipelineStateConfig;
import com.github.spud.leadagent.domain.state.StateMachineDriver;
import com.github.spud.leadagent.domain.tools.ActionDispatcher;
import com.github.spud.leadagent.domain.tools.ActionType;
import com.github.spud.leadagent.domain.tools.CalendarActionAdapter;
import com.github.spud.leadagent.domain.tools.CrmActionAdapter;
import com.github.spud.leadagent.domain.tools.ToolExecutionService;
import com.github.spud.leadagent.domain.tools.ToolResult;
import com.github.spud.leadagent.infrastructure.persistence.entity.Lead;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.config.StateMachineBuilder;
import org.springframework.statemachine.config.StateMachineFactory;

/**
 * 编排器端到端流程测试：真实状态机 + 真实重排/生成/动作路由，外部依赖 mock
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class LeadAgentOrchestratorFlowTest {

  private static final UUID LEAD_ID = UUID.fromString("7a1d2c3e-0000-4000-8000-000000000001");

  @Mock
  private StateMachineFactory<PipelineState, PipelineEvent> stateMachineFactory;

  @Mock
  private LeadMemoryService leadMemoryService;

  @Mock
  private DecisionEngine decisionEngine;

  @Mock
  private EvidenceRetriever evidenceRetriever;

  @Mock
  private LlmGateway llmGateway;

  @Mock
  private ToolExecutionService toolExecutionService;

  private LeadAgentOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    AgentProperties agentProperties = new AgentProperties();
    RagProperties ragProperties = new RagProperties();

    when(stateMachineFactory.getStateMachine(anyString())).thenAnswer(inv -> buildMachine());

    // 组合阶段使用真实的转人工规则
    DecisionEngine rules = new DecisionEngine(llmGateway, new DecisionResponseParser(),
      agentProperties);
    ResponseComposer composer = new ResponseComposer(llmGateway, rules, agentProperties);

    orchestrator = new LeadAgentOrchestrator(
      new StateMachineDriver(stateMachineFactory),
      leadMemoryService,
      decisionEngine,
      evidenceRetriever,
      new EvidenceReranker(ragProperties),
      composer,
      new ActionDispatcher(toolExecutionService),
      toolExecutionService,
      agentProperties,
      ragProperties);

    Lead lead = new Lead();
    lead.setId(LEAD_ID);
    lead.setEmail("jane@acme.com");
    lead.setName("Jane");
    when(leadMemoryService.getOrCreateLead(anyString(), any(), any())).thenReturn(lead);
    when(leadMemoryService.recentConversation(LEAD_ID, 10)).thenReturn(List.of(
      new ConversationTurn(ConversationTurn.LEAD, "Hi, I run a small agency"),
      new ConversationTurn(ConversationTurn.AGENT, "Welcome! How can I help?")));
    when(toolExecutionService.executeOnce(any(), anyString(), anyMap()))
      .thenReturn(ToolResult.ok(Map.of()));
  }

  private static StateMachine<PipelineState, PipelineEvent> buildMachine() throws Exception {
    PipelineStateConfig config = new PipelineStateConfig();
    StateMachineBuilder.Builder<PipelineState, PipelineEvent> builder = StateMachineBuilder.builder();
    config.configure(builder.configureConfiguration());
    config.configure(builder.configureStates());
    config.configure(builder.configureTransitions());
    return builder.build();
  }

  private static InboundLead inbound(String message) {
    return new InboundLead("jane@acme.com", "Jane", message, "website_form", Map.of());
  }

  private void decide(DecisionType type, double confidence, boolean retrieval, String... tools) {
    when(decisionEngine.decide(anyString(), any(), any(), any())).thenReturn(
      DecisionOutput.builder()
        .decision(type)
        .confidence(confidence)
        .reasoning("test")
        .toolsNeeded(List.of(tools))
        .retrievalNeeded(retrieval)
        .build());
  }

  private void composeReturns(String text) {
    when(llmGateway.generate(anyString(), anyString(), anyDouble(), anyInt()))
      .thenReturn(GenerationResult.ok(text));
  }

  private static Evidence evidence(String title, String type, double similarity) {
    return Evidence.builder()
      .sourceId(title)
      .docTitle(title)
      .docType(type)
      .chunkText(title + " text")
      .similarity(similarity)
      .score(similarity)
      .build();
  }

  private static List<PipelineState> visited(PipelineResult result) {
    return result.getStageRecords().stream().map(StageRecord::getState).toList();
  }

  @Test
  void pricingQueryShouldProduceGroundedResponse() {
    decide(DecisionType.RETRIEVE, 0.85, true);
    when(evidenceRetriever.retrieve("What are your prices?", 8)).thenReturn(List.of(
      evidence("Company Overview", "general", 0.88),
      evidence("Pricing Sheet", "pricing", 0.86)));
    composeReturns("Our Pro plan is $99/month.");

    PipelineResult result = orchestrator.run(inbound("What are your prices?"));

    assertThat(result.getResponseText()).isEqualTo("Our Pro plan is $99/month.");
    assertThat(result.isGrounded()).isTrue();
    assertThat(result.getSourcesUsed()).containsExactly("Pricing Sheet", "Company Overview");
    assertThat(result.isEscalated()).isFalse();
    assertThat(result.getEscalationReason()).isNull();
    assertThat(result.getDecisionType()).isEqualTo(DecisionType.RETRIEVE);
    assertThat(result.getLeadId()).isEqualTo(LEAD_ID.toString());
    assertThat(result.getFinalState()).isEqualTo(PipelineState.FINALIZE);
    assertThat(result.getNextAction()).isNull();
    assertThat(visited(result)).containsExactly(PipelineState.INTAKE,
      PipelineState.LOAD_CONTEXT, PipelineState.DECIDE, PipelineState.RETRIEVE,
      PipelineState.COMPOSE, PipelineState.MEMORY);

    verify(leadMemoryService).addInteraction(eq(LEAD_ID), eq(ConversationTurn.LEAD),
      eq("What are your prices?"), any(), any(), any(), any());
    verify(leadMemoryService).addInteraction(eq(LEAD_ID), eq(ConversationTurn.AGENT),
      eq("Our Pro plan is $99/month."), eq("RETRIEVE"), eq(0.85), eq(List.of()),
      eq(List.of("Pricing Sheet", "Company Overview")));
    verify(leadMemoryService, never()).recordEscalation(any(), any(), any(), any());
  }

  @Test
  void skippedRetrievalShouldGoStraightToComposition() {
    decide(DecisionType.REASON_ONLY, 0.9, false);
    composeReturns("Happy to help.");

    PipelineResult result = orchestrator.run(inbound("Thanks!"));

    assertThat(visited(result)).doesNotContain(PipelineState.RETRIEVE);
    assertThat(result.isGrounded()).isFalse();
    verify(evidenceRetriever, never()).retrieve(anyString(), anyInt());
  }

  @Test
  void compositionFailureShouldEscalateWithGenerationError() {
    decide(DecisionType.REASON_ONLY, 0.9, false);
    when(llmGateway.generate(anyString(), anyString(), anyDouble(), anyInt()))
      .thenReturn(GenerationResult.failed("model unavailable"));

    PipelineResult result = orchestrator.run(inbound("Tell me more"));

    assertThat(result.isEscalated()).isTrue();
    assertThat(result.getEscalationReason())
      .isEqualTo(EscalationReasons.RESPONSE_GENERATION_ERROR);
    assertThat(result.getErrors()).contains("Response composition failed: model unavailable");
    assertThat(result.getResponseText()).isEqualTo(LeadAgentOrchestrator.HANDOFF_RESPONSE);
    assertThat(result.getNextAction()).isEqualTo("human_followup");
    assertThat(visited(result)).contains(PipelineState.ESCALATE);

    verify(leadMemoryService).recordEscalation(eq(LEAD_ID),
      eq(EscalationReasons.RESPONSE_GENERATION_ERROR), any(), any());
    verify(toolExecutionService).executeOnce(ActionType.CRM, CrmActionAdapter.UPDATE_STATUS,
      Map.of("lead_id", LEAD_ID.toString(), "status", "escalated"));
  }

  @Test
  void lowConfidenceShouldEscalateAfterComposition() {
    decide(DecisionType.REASON_ONLY, 0.3, false);
    composeReturns("I think so.");

    PipelineResult result = orchestrator.run(inbound("Do you support SSO?"));

    assertThat(result.getDecisionType()).isEqualTo(DecisionType.REASON_ONLY);
    assertThat(result.isEscalated()).isTrue();
    assertThat(result.getEscalationReason()).isEqualTo(EscalationReasons.LOW_CONFIDENCE);
    assertThat(result.getResponseText()).isEqualTo(LeadAgentOrchestrator.HANDOFF_RESPONSE);
  }

  @Test
  void decisionFailureShouldEscalateWithZeroConfidence() {
    when(decisionEngine.decide(anyString(), any(), any(), any()))
      .thenReturn(DecisionOutput.failClosed("timeout"));
    composeReturns("unused");

    PipelineResult result = orchestrator.run(inbound("Hello"));

    assertThat(result.isEscalated()).isTrue();
    assertThat(result.getEscalationReason()).isEqualTo(EscalationReasons.INTERNAL_ERROR);
    assertThat(result.getConfidence()).isZero();
    assertThat(visited(result)).doesNotContain(PipelineState.RETRIEVE, PipelineState.TOOLS);
  }

  @Test
  void calendarFailureShouldEscalateAndRecordInMemoryStage() {
    decide(DecisionType.USE_TOOL, 0.9, false, "calendar_booking");
    composeReturns("Let me set up a call.");
    when(toolExecutionService.executeWithRetry(eq(ActionType.CALENDAR),
      eq(CalendarActionAdapter.BOOK_MEETING), anyMap()))
      .thenReturn(ToolResult.retryableFailure("calendar unavailable"));

    PipelineResult result = orchestrator.run(inbound("Can we schedule a call next week?"));

    assertThat(result.isEscalated()).isTrue();
    assertThat(result.getEscalationReason()).isEqualTo(EscalationReasons.TOOL_FAILURE);
    assertThat(result.getToolsCalled()).containsExactly("calendar_booking");
    assertThat(visited(result)).contains(PipelineState.TOOLS).doesNotContain(PipelineState.ESCALATE);
    assertThat(result.getNextAction()).isEqualTo("human_followup");

    verify(leadMemoryService, times(1)).recordEscalation(eq(LEAD_ID),
      eq(EscalationReasons.TOOL_FAILURE), any(), any());
  }

  @Test
  void bookedMeetingShouldSetNextAction() {
    decide(DecisionType.USE_TOOL, 0.9, false, "calendar_booking");
    composeReturns("Booked!");
    when(toolExecutionService.executeWithRetry(eq(ActionType.CALENDAR),
      eq(CalendarActionAdapter.BOOK_MEETING), anyMap()))
      .thenReturn(ToolResult.ok(Map.of("meeting_id", "m-1")));

    PipelineResult result = orchestrator.run(inbound("Please book a meeting"));

    assertThat(result.isEscalated()).isFalse();
    assertThat(result.getNextAction()).isEqualTo("attend_meeting");
  }

  @Test
  void clarifyShouldAwaitLeadReply() {
    decide(DecisionType.CLARIFY, 0.8, false);
    composeReturns("Could you tell me your team size?");

    PipelineResult result = orchestrator.run(inbound("How much?"));

    assertThat(result.getNextAction()).isEqualTo("await_lead_reply");
  }

  @Test
  void conflictingPricingEvidenceShouldLowerConfidence() {
    decide(DecisionType.RETRIEVE, 0.9, true);
    when(evidenceRetriever.retrieve(anyString(), anyInt())).thenReturn(new ArrayList<>(List.of(
      evidence("Pricing 2024", "pricing", 0.95),
      evidence("Pricing 2022", "pricing", 0.44))));
    composeReturns("Prices vary.");

    PipelineResult result = orchestrator.run(inbound("What are your prices?"));

    assertThat(result.getConfidence()).isCloseTo(0.63, offset(1e-9));
    assertThat(result.isEscalated()).isFalse();
  }

  @Test
  void unexpectedFailureShouldEndEscalatedWithApology() {
    when(leadMemoryService.getOrCreateLead(anyString(), any(), any()))
      .thenThrow(new IllegalStateException("db down"));

    PipelineResult result = orchestrator.run(inbound("Hello"));

    assertThat(result.isEscalated()).isTrue();
    assertThat(result.getEscalationReason()).isEqualTo(EscalationReasons.ORCHESTRATION_ERROR);
    assertThat(result.getResponseText()).isEqualTo(LeadAgentOrchestrator.FAILURE_RESPONSE);
    assertThat(result.getErrors()).containsExactly("db down");
    assertThat(result.getNextAction()).isEqualTo("human_followup");
    assertThat(result.getStageRecords()).last()
      .satisfies(r -> assertThat(r.getError()).isEqualTo("db down"));
  }

  @Test
  void eachRunShouldGetItsOwnTrace() {
    decide(DecisionType.REASON_ONLY, 0.9, false);
    composeReturns("Hi!");

    PipelineResult first = orchestrator.run(inbound("Hi"));
    PipelineResult second = orchestrator.run(inbound("Hi again"));

    assertThat(first.getTraceId()).isNotEqualTo(second.getTraceId());
    verify(stateMachineFactory, times(2)).getStateMachine(anyString());
  }
}
