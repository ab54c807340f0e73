package com.github.spud.leadagent.domain.state;

/**
 * 单次线索处理流水线的状态枚举
 * <pre>
 * INTAKE → LOAD_CONTEXT → DECIDE → (RETRIEVE) → COMPOSE → ESCALATE / TOOLS → MEMORY → FINALIZE
 * </pre>
 */
public enum PipelineState {
  /**
   * 接收请求，初始化运行记录
   */
  INTAKE,

  /**
   * 加载线索与历史对话
   */
  LOAD_CONTEXT,

  /**
   * 决策阶段，调用 LLM 判定动作类型
   */
  DECIDE,

  /**
   * 检索并重排证据
   */
  RETRIEVE,

  /**
   * 生成回复
   */
  COMPOSE,

  /**
   * 转人工
   */
  ESCALATE,

  /**
   * 执行外部动作（CRM / 日历 / 邮件）
   */
  TOOLS,

  /**
   * 写入交互记录
   */
  MEMORY,

  /**
   * 结束（终态）
   */
  FINALIZE;

  /**
   * 是否为终态
   */
  public static boolean isFinal(PipelineState state) {
    return state == FINALIZE;
  }
}
