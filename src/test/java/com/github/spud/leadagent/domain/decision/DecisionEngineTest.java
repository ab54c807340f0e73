package com.github.spud.leadagent.domain.decision;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.github.spud.leadagent.config.AgentProperties;
import com.github.spud.leadagent.domain.kernel.ConversationTurn;
import com.github.spud.leadagent.domain.kernel.LeadSnapshot;
import com.github.spud.leadagent.domain.llm.GenerationResult;
import com.github.spud.leadagent.domain.llm.LlmGateway;
import com.github.spud.leadagent.domain.rag.Evidence;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * 决策引擎测试：决策失败一律 ESCALATE，置信度与转人工规则
 */
@ExtendWith(MockitoExtension.class)
class DecisionEngineTest {

  @Mock
  private LlmGateway llmGateway;

  private AgentProperties properties;
  private DecisionEngine engine;

  private final LeadSnapshot lead =
    new LeadSnapshot("id-1", "jane@acme.com", "Jane", "Acme", "new");

  @BeforeEach
  void setUp() {
    properties = new AgentProperties();
    engine = new DecisionEngine(llmGateway, new DecisionResponseParser(), properties);
  }

  @Test
  void shouldReturnParsedDecision() {
    when(llmGateway.generate(anyString(), eq(DecisionEngine.SYSTEM_PROMPT), eq(0.3), eq(500)))
      .thenReturn(GenerationResult.ok("""
        DECISION: RETRIEVE
        CONFIDENCE: 0.8
        REASONING: needs pricing
        TOOLS_NEEDED: none
        RETRIEVAL_NEEDED: yes"""));

    DecisionOutput output = engine.decide("How much is the pro plan?", List.of(), lead, null);

    assertThat(output.getDecision()).isEqualTo(DecisionType.RETRIEVE);
    assertThat(output.getConfidence()).isEqualTo(0.8);
    assertThat(output.isRetrievalNeeded()).isTrue();
  }

  @Test
  void shouldFailClosedWhenGenerationFails() {
    when(llmGateway.generate(anyString(), anyString(), anyDouble(), anyInt()))
      .thenReturn(GenerationResult.failed("timeout"));

    DecisionOutput output = engine.decide("hello", List.of(), lead, null);

    assertThat(output.getDecision()).isEqualTo(DecisionType.ESCALATE);
    assertThat(output.getConfidence()).isEqualTo(0.0);
    assertThat(output.getReasoning()).contains("timeout");
    assertThat(output.getToolsNeeded()).isEmpty();
    assertThat(output.getEscalationReason()).isEqualTo(EscalationReasons.INTERNAL_ERROR);
  }

  @Test
  void shouldFailClosedWhenGatewayThrows() {
    when(llmGateway.generate(anyString(), anyString(), anyDouble(), anyInt()))
      .thenThrow(new IllegalStateException("boom"));

    DecisionOutput output = engine.decide("hello", null, null, null);

    assertThat(output.getDecision()).isEqualTo(DecisionType.ESCALATE);
    assertThat(output.getEscalationReason()).isEqualTo(EscalationReasons.INTERNAL_ERROR);
  }

  @Test
  void shouldBuildPromptWithRecentHistoryAndSourceCount() {
    List<ConversationTurn> history = List.of(
      new ConversationTurn("lead", "first"),
      new ConversationTurn("agent", "second"),
      new ConversationTurn("lead", "third"));
    List<Evidence> evidence = List.of(Evidence.builder().docTitle("a").build(),
      Evidence.builder().docTitle("b").build());

    String prompt = engine.buildPrompt("What now?", history, lead, evidence, 2);

    assertThat(prompt)
      .contains("CURRENT QUERY: What now?")
      .contains("agent: second\nlead: third")
      .doesNotContain("lead: first")
      .contains("PREVIOUSLY RETRIEVED SOURCES: 2 sources available")
      .contains("- Company: Acme");
  }

  @Test
  void shouldMarkMissingHistoryAndSources() {
    String prompt = engine.buildPrompt("Hi", List.of(), null, List.of(), 5);

    assertThat(prompt)
      .contains("No previous conversation")
      .contains("PREVIOUSLY RETRIEVED SOURCES: None")
      .contains("- Email: unknown");
  }

  @Test
  void shouldCalculateWeightedConfidence() {
    assertThat(engine.calculateConfidence(1.0, 0.0, 1.0, 1.0, false)).isEqualTo(1.0);
    assertThat(engine.calculateConfidence(1.0, 0.0, 1.0, 1.0, true)).isEqualTo(0.5);
    assertThat(engine.calculateConfidence(0.5, 0.5, 0.5, 0.5, false))
      .isCloseTo(0.5, offset(1e-9));
    assertThat(engine.calculateConfidence(5.0, -3.0, 5.0, 5.0, false)).isEqualTo(1.0);
  }

  @Test
  void confidenceShouldMoveMonotonicallyWithEachFactor() {
    double[] grid = {0.0, 0.1, 0.25, 0.4, 0.5, 0.6, 0.75, 0.9, 1.0};
    double[] base = {0.6, 0.4, 0.5, 0.7};

    for (boolean conflict : new boolean[]{false, true}) {
      for (int factor = 0; factor < base.length; factor++) {
        double previous = Double.NaN;
        for (double value : grid) {
          double[] args = base.clone();
          args[factor] = value;
          double confidence = engine.calculateConfidence(args[0], args[1], args[2], args[3],
            conflict);

          assertThat(confidence).isBetween(0.0, 1.0);
          if (!Double.isNaN(previous)) {
            if (factor == 1) {
              assertThat(confidence).as("complexity=%s conflict=%s", value, conflict)
                .isLessThanOrEqualTo(previous);
            } else {
              assertThat(confidence).as("factor=%s value=%s conflict=%s", factor, value, conflict)
                .isGreaterThanOrEqualTo(previous);
            }
          }
          previous = confidence;
        }
      }
    }
  }

  @Test
  void conflictShouldNeverRaiseConfidence() {
    double[] grid = {0.0, 0.3, 0.7, 1.0};
    for (double sources : grid) {
      for (double complexity : grid) {
        assertThat(engine.calculateConfidence(sources, complexity, 0.5, 0.5, true))
          .isLessThanOrEqualTo(engine.calculateConfidence(sources, complexity, 0.5, 0.5, false));
      }
    }
  }

  @Test
  void shouldCompareAgainstHighConfidenceThreshold() {
    assertThat(engine.isHighConfidence(0.75)).isTrue();
    assertThat(engine.isHighConfidence(0.74)).isFalse();

    properties.getConfidence().setHighThreshold(0.9);
    assertThat(engine.isHighConfidence(0.8)).isFalse();
  }

  @Test
  void shouldApplyEscalationPriority() {
    assertThat(engine.shouldEscalate(0.1, true, true))
      .isEqualTo(EscalationVerdict.of(EscalationReasons.ERROR_IN_PROCESSING));
    assertThat(engine.shouldEscalate(0.1, false, true))
      .isEqualTo(EscalationVerdict.of(EscalationReasons.SENSITIVE_TOPIC));
    assertThat(engine.shouldEscalate(0.49, false, false))
      .isEqualTo(EscalationVerdict.of(EscalationReasons.LOW_CONFIDENCE));
    assertThat(engine.shouldEscalate(0.5, false, false).escalate()).isFalse();
  }

  @Test
  void shouldDetectConfiguredSensitiveTopics() {
    assertThat(engine.isSensitiveTopic("I want a refund now")).isFalse();

    properties.setSensitiveTopics(List.of("refund", "lawsuit"));

    assertThat(engine.isSensitiveTopic("I want a REFUND now")).isTrue();
    assertThat(engine.isSensitiveTopic("What are your hours?")).isFalse();
  }
}
