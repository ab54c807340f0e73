package com.github.spud.leadagent.domain.decision;

/**
 * 转人工原因
 */
public final class EscalationReasons {

  /**
   * 模型明确给出 ESCALATE
   */
  public static final String AGENT_DECISION = "agent_decision";

  /**
   * 模型输出的决策无法识别
   */
  public static final String UNRECOGNIZED_DECISION = "unrecognized_decision";

  /**
   * 决策阶段调用失败
   */
  public static final String INTERNAL_ERROR = "internal_error";

  public static final String ERROR_IN_PROCESSING = "error_in_processing";
  public static final String SENSITIVE_TOPIC = "sensitive_topic_detected";
  public static final String LOW_CONFIDENCE = "confidence_below_threshold";
  public static final String RESPONSE_GENERATION_ERROR = "response_generation_error";
  public static final String TOOL_FAILURE = "tool_failure";
  public static final String ORCHESTRATION_ERROR = "orchestration_error";

  private EscalationReasons() {
  }
}
