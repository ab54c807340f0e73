package com.github.spud.leadagent.domain.compose;

import com.github.spud.leadagent.config.AgentProperties;
import com.github.spud.leadagent.domain.decision.DecisionEngine;
import com.github.spud.leadagent.domain.decision.EscalationReasons;
import com.github.spud.leadagent.domain.decision.EscalationVerdict;
import com.github.spud.leadagent.domain.kernel.ConversationTurn;
import com.github.spud.leadagent.domain.kernel.LeadSnapshot;
import com.github.spud.leadagent.domain.kernel.RunState;
import com.github.spud.leadagent.domain.llm.GenerationResult;
import com.github.spud.leadagent.domain.llm.LlmGateway;
import com.github.spud.leadagent.domain.rag.Evidence;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 回复生成服务
 * <p>
 * 生成失败时写入固定致歉文案并强制转人工；生成成功后再做一次置信度检查。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResponseComposer {

  public static final String APOLOGY_RESPONSE = "I apologize, but I'm having trouble "
    + "formulating a response. A team member will reach out to you shortly.";

  static final String SYSTEM_PROMPT = """
    You are a professional sales and operations AI agent for a service business.
    Your goal is to help prospects by providing accurate information and moving them through the sales funnel.

    Guidelines:
    - Be professional but friendly
    - Ground your answers in the provided sources
    - If sources are insufficient, ask clarifying questions
    - Proactively suggest next steps (book a call, request demo, etc.)
    - Keep responses concise (2-3 paragraphs max)
    """;

  private static final String COMPOSE_PROMPT = """
    CONVERSATION HISTORY:
    %s

    CURRENT QUERY:
    %s

    RETRIEVED INFORMATION:
    %s

    LEAD CONTEXT:
    - Status: %s
    - Company: %s

    Compose a helpful response to the current query.""";

  private static final String NO_SOURCES =
    "No specific sources retrieved - use general knowledge about sales process.";

  private final LlmGateway llmGateway;
  private final DecisionEngine decisionEngine;
  private final AgentProperties agentProperties;

  public void compose(RunState state) {
    AgentProperties.Generation cfg = agentProperties.getCompose();
    List<Evidence> top = topEvidence(state.getEvidence());
    String sourcesText = formatSources(top);
    String prompt = buildPrompt(state, sourcesText, cfg.getHistoryWindow());

    GenerationResult result = llmGateway.generate(prompt, SYSTEM_PROMPT, cfg.getTemperature(),
      cfg.getMaxTokens());

    if (!result.success()) {
      log.error("Response composition failed: traceId={}, error={}", state.getTraceId(),
        result.error());
      state.setResponseText(APOLOGY_RESPONSE);
      state.setGrounded(false);
      state.escalate(EscalationReasons.RESPONSE_GENERATION_ERROR);
      state.addError("Response composition failed: " + result.error());
      return;
    }

    boolean grounded = !sourcesText.isEmpty();
    state.setResponseText(result.text());
    state.setGrounded(grounded);
    state.setSourcesUsed(grounded
      ? top.stream().map(Evidence::getDocTitle).collect(Collectors.toList())
      : List.of());
    log.info("Response composed: grounded={}, sources={}", grounded, state.getSourcesUsed());

    EscalationVerdict verdict = decisionEngine.shouldEscalate(state.getConfidence(), false,
      decisionEngine.isSensitiveTopic(state.getQuery()));
    if (verdict.escalate() && !state.isEscalated()) {
      log.warn("Escalating after composition: reason={}, confidence={}", verdict.reason(),
        state.getConfidence());
      state.escalate(verdict.reason());
    }
  }

  List<Evidence> topEvidence(List<Evidence> evidence) {
    if (evidence == null || evidence.isEmpty()) {
      return List.of();
    }
    return evidence.subList(0, Math.min(agentProperties.getEvidenceLimit(), evidence.size()));
  }

  static String formatSources(List<Evidence> evidence) {
    return evidence.stream()
      .map(e -> "[Source: " + e.getDocTitle() + "]\n" + e.getChunkText())
      .collect(Collectors.joining("\n\n"));
  }

  String buildPrompt(RunState state, String sourcesText, int historyWindow) {
    List<ConversationTurn> history = state.getHistory();
    String conversation = history.subList(Math.max(0, history.size() - historyWindow),
        history.size())
      .stream()
      .map(ConversationTurn::format)
      .collect(Collectors.joining("\n"));

    LeadSnapshot lead = state.getLead();
    return COMPOSE_PROMPT.formatted(
      conversation,
      state.getQuery(),
      sourcesText.isEmpty() ? NO_SOURCES : sourcesText,
      lead != null && lead.status() != null ? lead.status() : "new",
      lead != null && lead.company() != null ? lead.company() : "unknown");
  }
}
