package com.github.spud.leadagent.domain.tools;

import java.util.Map;

/**
 * 外部动作适配器
 * <p>
 * 实现方对未知 action 返回不可重试失败；处理过程中的异常返回可重试失败。
 */
public interface ActionAdapter {

  ActionType type();

  ToolResult execute(String action, Map<String, Object> params);
}
