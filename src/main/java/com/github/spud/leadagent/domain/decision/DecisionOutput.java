package com.github.spud.leadagent.domain.decision;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * 决策结果，创建后不可变
 */
@Value
@Builder
public class DecisionOutput {

  DecisionType decision;

  /**
   * 置信度，[0, 1]
   */
  double confidence;

  String reasoning;

  /**
   * 需要执行的动作名称
   */
  List<String> toolsNeeded;

  boolean retrievalNeeded;

  /**
   * 仅当 decision 为 ESCALATE 时有值
   */
  String escalationReason;

  /**
   * 决策阶段失败时的兜底结果
   */
  public static DecisionOutput failClosed(String error) {
    return DecisionOutput.builder()
      .decision(DecisionType.ESCALATE)
      .confidence(0.0)
      .reasoning("Decision engine error: " + error)
      .toolsNeeded(List.of())
      .retrievalNeeded(false)
      .escalationReason(EscalationReasons.INTERNAL_ERROR)
      .build();
  }
}
