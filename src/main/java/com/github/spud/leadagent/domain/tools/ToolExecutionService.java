package com.github.spud.leadagent.domain.tools;

import com.github.spud.leadagent.config.AgentProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 工具执行服务 统一捕获异常并返回结构化结果
 * <p>
 * 重试只针对 retryAllowed=true 的失败结果，指数退避；适配器抛出的异常转为不可重试失败，不会重试。
 */
@Slf4j
@Service
public class ToolExecutionService {

  private final Map<ActionType, ActionAdapter> adapters = new EnumMap<>(ActionType.class);
  private final RetryRegistry retryRegistry;

  public ToolExecutionService(List<ActionAdapter> actionAdapters,
    AgentProperties agentProperties) {
    for (ActionAdapter adapter : actionAdapters) {
      ActionAdapter previous = adapters.put(adapter.type(), adapter);
      if (previous != null) {
        throw new IllegalStateException("Duplicate action adapter for " + adapter.type());
      }
    }

    AgentProperties.RetryConfig retry = agentProperties.getRetry();
    RetryConfig config = RetryConfig.<ToolResult>custom()
      .maxAttempts(retry.getMaxAttempts())
      .intervalFunction(
        IntervalFunction.ofExponentialBackoff(retry.getInitialInterval(), retry.getMultiplier()))
      .retryOnResult(ToolResult::shouldRetry)
      .retryOnException(e -> false)
      .build();
    this.retryRegistry = RetryRegistry.of(config);
    this.retryRegistry.getEventPublisher().onEntryAdded(added -> added.getAddedEntry()
      .getEventPublisher()
      .onRetry(event -> log.warn("Retrying {} (retry {}): waitMs={}", event.getName(),
        event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis())));

    log.info("Registered action adapters: {}", adapters.keySet());
  }

  /**
   * 带重试执行动作，重试耗尽后原样返回最后一次失败结果
   */
  public ToolResult executeWithRetry(ActionType type, String action, Map<String, Object> params) {
    Retry retry = retryRegistry.retry(type.value() + "." + action);

    ToolResult result = Retry.decorateSupplier(retry, () -> executeOnce(type, action, params))
      .get();

    if (!result.success()) {
      log.error("Action {}.{} failed: {}", type.value(), action, result.error());
    }
    return result;
  }

  /**
   * 单次执行动作，不重试
   */
  public ToolResult executeOnce(ActionType type, String action, Map<String, Object> params) {
    ActionAdapter adapter = adapters.get(type);
    if (adapter == null) {
      return ToolResult.terminalFailure("No adapter registered for " + type.value());
    }

    long startTime = System.currentTimeMillis();
    try {
      log.debug("Executing action: {}.{} with params: {}", type.value(), action, params.keySet());
      ToolResult result = adapter.execute(action, params);
      if (result == null) {
        return ToolResult.terminalFailure("Adapter returned no result");
      }
      log.debug("Action {}.{} completed in {}ms: success={}", type.value(), action,
        System.currentTimeMillis() - startTime, result.success());
      return result;
    } catch (Exception e) {
      log.error("Action execution failed: {}.{} - {}", type.value(), action, e.getMessage(), e);
      return ToolResult.terminalFailure(e.getMessage() != null
        ? e.getMessage() : e.getClass().getSimpleName());
    }
  }
}
