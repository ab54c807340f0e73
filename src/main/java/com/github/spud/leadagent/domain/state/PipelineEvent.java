package com.github.spud.leadagent.domain.state;

/**
 * 流水线状态机事件枚举
 */
public enum PipelineEvent {
  /**
   * 请求已接收
   */
  ACCEPTED,

  /**
   * 上下文加载完成
   */
  CONTEXT_LOADED,

  /**
   * 决策完成，需要检索
   */
  RETRIEVAL_REQUIRED,

  /**
   * 决策完成，跳过检索
   */
  RETRIEVAL_SKIPPED,

  /**
   * 证据已就绪（可以为空）
   */
  EVIDENCE_READY,

  /**
   * 回复生成后需要转人工
   */
  ESCALATION_REQUIRED,

  /**
   * 回复生成后有待执行的动作
   */
  ACTIONS_PENDING,

  /**
   * 回复生成完成，无需动作
   */
  RESPONSE_READY,

  /**
   * 动作执行完成
   */
  ACTIONS_DONE,

  /**
   * 转人工处理完成
   */
  HANDOFF_DONE,

  /**
   * 交互记录已写入
   */
  MEMORY_WRITTEN
}
