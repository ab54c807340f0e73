package com.github.spud.leadagent.domain.decision;

import java.util.Locale;
import java.util.Optional;

/**
 * 决策类型（封闭集合）
 */
public enum DecisionType {
  /**
   * 需要检索知识库
   */
  RETRIEVE,

  /**
   * 直接推理回答
   */
  REASON_ONLY,

  /**
   * 需要执行外部动作
   */
  USE_TOOL,

  /**
   * 需要向线索澄清
   */
  CLARIFY,

  /**
   * 转人工
   */
  ESCALATE;

  /**
   * 解析模型输出的决策标签，大小写、空格与连字符不敏感；无法识别返回 empty
   */
  public static Optional<DecisionType> fromTag(String tag) {
    if (tag == null) {
      return Optional.empty();
    }
    String normalized = tag.trim()
      .toUpperCase(Locale.ROOT)
      .replaceAll("[\\s-]+", "_")
      .replaceAll("[^A-Z_]", "");
    for (DecisionType type : values()) {
      if (type.name().equals(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
