package com.github.spud.leadagent.domain.tools;

import lombok.Builder;
import lombok.Data;

/**
 * 一个请求动作的执行结果，type 为空表示动作名称无法识别
 */
@Data
@Builder
public class ActionOutcome {

  private String actionName;
  private ActionType type;
  private ToolResult result;
  private long durationMs;
}
