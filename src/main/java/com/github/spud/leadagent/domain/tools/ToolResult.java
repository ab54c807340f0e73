package com.github.spud.leadagent.domain.tools;

import java.util.Map;

/**
 * 动作执行结果
 * <p>
 * retryAllowed 仅对失败结果有意义，表示该失败可以安全重试。
 */
public record ToolResult(boolean success, Map<String, Object> data, String error,
                         boolean retryAllowed) {

  public static ToolResult ok(Map<String, Object> data) {
    return new ToolResult(true, data != null ? data : Map.of(), null, false);
  }

  public static ToolResult retryableFailure(String error) {
    return new ToolResult(false, Map.of(), error, true);
  }

  public static ToolResult terminalFailure(String error) {
    return new ToolResult(false, Map.of(), error, false);
  }

  public boolean shouldRetry() {
    return !success && retryAllowed;
  }
}
