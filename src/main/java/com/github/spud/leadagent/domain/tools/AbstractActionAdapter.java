package com.github.spud.leadagent.domain.tools;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * 动作适配器基类：按 action 名称分发到处理函数
 * <p>
 * 未知 action 与参数错误为不可重试失败，其余异常为可重试失败。
 */
@Slf4j
public abstract class AbstractActionAdapter implements ActionAdapter {

  private final Map<String, Function<Map<String, Object>, ToolResult>> handlers =
    new LinkedHashMap<>();

  protected void register(String action, Function<Map<String, Object>, ToolResult> handler) {
    handlers.put(action, handler);
  }

  @Override
  public ToolResult execute(String action, Map<String, Object> params) {
    Function<Map<String, Object>, ToolResult> handler = handlers.get(action);
    if (handler == null) {
      return ToolResult.terminalFailure("Unknown action: " + action);
    }
    try {
      return handler.apply(params != null ? params : Map.of());
    } catch (IllegalArgumentException e) {
      log.warn("Invalid params for {}.{}: {}", type().value(), action, e.getMessage());
      return ToolResult.terminalFailure(e.getMessage());
    } catch (Exception e) {
      log.error("{}.{} failed: {}", type().value(), action, e.getMessage(), e);
      return ToolResult.retryableFailure(
        type().name() + " operation failed: " + e.getMessage());
    }
  }

  protected static String requireString(Map<String, Object> params, String key) {
    Object value = params.get(key);
    if (value == null || value.toString().isBlank()) {
      throw new IllegalArgumentException("Missing required parameter: " + key);
    }
    return value.toString();
  }

  protected static String optionalString(Map<String, Object> params, String key) {
    Object value = params.get(key);
    return value != null ? value.toString() : null;
  }

  protected static String optionalString(Map<String, Object> params, String key,
    String fallback) {
    String value = optionalString(params, key);
    return value != null && !value.isBlank() ? value : fallback;
  }

  protected static double doubleParam(Map<String, Object> params, String key, double fallback) {
    Object value = params.get(key);
    if (value == null) {
      return fallback;
    }
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    try {
      return Double.parseDouble(value.toString());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
    }
  }

  protected static int intParam(Map<String, Object> params, String key, int fallback) {
    return (int) doubleParam(params, key, fallback);
  }
}
