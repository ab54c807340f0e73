package com.github.spud.leadagent.domain.decision;

import com.github.spud.leadagent.config.AgentProperties;
import com.github.spud.leadagent.domain.kernel.ConversationTurn;
import com.github.spud.leadagent.domain.kernel.LeadSnapshot;
import com.github.spud.leadagent.domain.llm.GenerationResult;
import com.github.spud.leadagent.domain.llm.LlmGateway;
import com.github.spud.leadagent.domain.rag.Evidence;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 决策引擎
 * <p>
 * - decide：调用 LLM 做分类，失败或无法解析时一律 ESCALATE<p>
 * - calculateConfidence：纯函数，综合置信度<p>
 * - shouldEscalate：转人工判定，优先级 错误 > 敏感话题 > 低置信度<p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DecisionEngine {

  static final String SYSTEM_PROMPT =
    "You are an autonomous agent decision engine. Analyze the situation and decide the best action.";

  private static final String DECISION_PROMPT = """
    You are an autonomous sales agent decision engine. Analyze the situation and decide the best action.

    CURRENT QUERY: %s

    CONVERSATION HISTORY:
    %s

    LEAD CONTEXT:
    - Email: %s
    - Name: %s
    - Status: %s
    - Company: %s

    PREVIOUSLY RETRIEVED SOURCES: %s

    AVAILABLE ACTIONS:
    1. RETRIEVE - Search knowledge base for information (pricing, policies, SOPs, FAQs)
    2. REASON_ONLY - Answer using general knowledge without retrieval
    3. USE_TOOL - Execute tools (CRM update, book meeting, send email)
    4. CLARIFY - Ask user for more information
    5. ESCALATE - Hand off to human (low confidence, sensitive topic, error)

    Respond in this exact format:
    DECISION: [RETRIEVE|REASON_ONLY|USE_TOOL|CLARIFY|ESCALATE]
    CONFIDENCE: [0.0-1.0]
    REASONING: [Brief explanation]
    TOOLS_NEEDED: [comma-separated list like crm_update, calendar_booking, email_send, or "none"]
    RETRIEVAL_NEEDED: [yes|no]
    """;

  private final LlmGateway llmGateway;
  private final DecisionResponseParser parser;
  private final AgentProperties agentProperties;

  /**
   * 做出决策，不会抛出异常
   */
  public DecisionOutput decide(String query, List<ConversationTurn> history, LeadSnapshot lead,
    List<Evidence> previousEvidence) {
    try {
      AgentProperties.Generation cfg = agentProperties.getDecision();
      String prompt = buildPrompt(query, history, lead, previousEvidence, cfg.getHistoryWindow());

      GenerationResult result = llmGateway.generate(prompt, SYSTEM_PROMPT, cfg.getTemperature(),
        cfg.getMaxTokens());
      if (!result.success()) {
        log.error("Decision generation failed: {}", result.error());
        return DecisionOutput.failClosed(result.error());
      }

      DecisionOutput output = parser.parse(result.text());
      log.info("Decision made: decision={}, confidence={}, retrievalNeeded={}, tools={}",
        output.getDecision(), output.getConfidence(), output.isRetrievalNeeded(),
        output.getToolsNeeded());
      return output;

    } catch (Exception e) {
      log.error("Decision engine failed: {}", e.getMessage(), e);
      return DecisionOutput.failClosed(e.getMessage());
    }
  }

  String buildPrompt(String query, List<ConversationTurn> history, LeadSnapshot lead,
    List<Evidence> previousEvidence, int historyWindow) {
    String historyText = "No previous conversation";
    if (history != null && !history.isEmpty()) {
      historyText = history.subList(Math.max(0, history.size() - historyWindow), history.size())
        .stream()
        .map(ConversationTurn::format)
        .collect(Collectors.joining("\n"));
    }

    // 只携带数量，控制提示词长度
    String sources = previousEvidence != null && !previousEvidence.isEmpty()
      ? previousEvidence.size() + " sources available"
      : "None";

    return DECISION_PROMPT.formatted(
      query,
      historyText,
      lead != null ? orUnknown(lead.email()) : "unknown",
      lead != null ? orUnknown(lead.name()) : "unknown",
      lead != null ? orUnknown(lead.status()) : "unknown",
      lead != null ? orUnknown(lead.company()) : "unknown",
      sources);
  }

  /**
   * 综合置信度：0.3*来源质量 + 0.2*(1-问题复杂度) + 0.3*上下文完整度 + 0.2*工具成功率，存在冲突时减半，结果截断到 [0, 1]
   */
  public double calculateConfidence(double sourcesQuality, double queryComplexity,
    double contextCompleteness, double toolSuccessRate, boolean conflictDetected) {
    double confidence = 0.3 * sourcesQuality
      + 0.2 * (1.0 - queryComplexity)
      + 0.3 * contextCompleteness
      + 0.2 * toolSuccessRate;
    if (conflictDetected) {
      confidence *= 0.5;
    }
    double clamped = DecisionResponseParser.clamp(confidence);
    log.debug("Confidence calculated: value={}, conflict={}, thresholdMet={}", clamped,
      conflictDetected, isHighConfidence(clamped));
    return clamped;
  }

  /**
   * 是否达到高置信度阈值
   */
  public boolean isHighConfidence(double confidence) {
    return confidence >= agentProperties.getConfidence().getHighThreshold();
  }

  /**
   * 转人工判定，只返回第一个命中条件的原因
   */
  public EscalationVerdict shouldEscalate(double confidence, boolean errorOccurred,
    boolean sensitiveTopic) {
    if (errorOccurred) {
      return EscalationVerdict.of(EscalationReasons.ERROR_IN_PROCESSING);
    }
    if (sensitiveTopic) {
      return EscalationVerdict.of(EscalationReasons.SENSITIVE_TOPIC);
    }
    if (confidence < agentProperties.getConfidence().getLowThreshold()) {
      return EscalationVerdict.of(EscalationReasons.LOW_CONFIDENCE);
    }
    return EscalationVerdict.none();
  }

  /**
   * 敏感话题检测：按配置的关键词做大小写不敏感匹配
   */
  public boolean isSensitiveTopic(String query) {
    if (query == null || agentProperties.getSensitiveTopics().isEmpty()) {
      return false;
    }
    String lower = query.toLowerCase(Locale.ROOT);
    return agentProperties.getSensitiveTopics().stream()
      .anyMatch(topic -> !topic.isBlank() && lower.contains(topic.toLowerCase(Locale.ROOT)));
  }

  private static String orUnknown(String value) {
    return value != null && !value.isBlank() ? value : "unknown";
  }
}
