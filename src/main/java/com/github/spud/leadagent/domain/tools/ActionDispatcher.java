package com.github.spud.leadagent.domain.tools;

import com.github.spud.leadagent.domain.decision.EscalationReasons;
import com.github.spud.leadagent.domain.kernel.RunState;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 动作阶段：把决策中请求的动作逐个路由到适配器执行
 * <p>
 * 任一 CALENDAR 动作失败即转人工（tool_failure）。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActionDispatcher {

  static final String EMAIL_SUBJECT = "Re: Your inquiry";
  static final String NO_BOOKING_MESSAGE = "No meeting booking needed";
  private static final List<String> BOOKING_KEYWORDS = List.of("call", "meeting", "schedule");

  private final ToolExecutionService toolExecutionService;

  public void dispatch(RunState state) {
    for (String actionName : state.getToolsToUse()) {
      long startTime = System.currentTimeMillis();
      Optional<ActionType> type = ActionType.resolve(actionName);

      ToolResult result = type
        .map(t -> execute(t, state))
        .orElseGet(() -> ToolResult.terminalFailure("Unknown tool: " + actionName));

      state.getActionOutcomes().add(ActionOutcome.builder()
        .actionName(actionName)
        .type(type.orElse(null))
        .result(result)
        .durationMs(System.currentTimeMillis() - startTime)
        .build());

      if (!result.success()) {
        state.getToolErrors().add(actionName + ": " + result.error());
        log.warn("Action {} failed: {}", actionName, result.error());
      }
    }

    boolean calendarFailed = state.getActionOutcomes().stream()
      .anyMatch(o -> o.getType() == ActionType.CALENDAR && !o.getResult().success());
    if (calendarFailed) {
      log.warn("Calendar action failed, escalating: traceId={}", state.getTraceId());
      state.escalate(EscalationReasons.TOOL_FAILURE);
    }
  }

  private ToolResult execute(ActionType type, RunState state) {
    switch (type) {
      case CRM:
        return updateCrm(state);
      case CALENDAR:
        return bookMeetingIfRequested(state);
      case EMAIL:
        return sendReply(state);
      default:
        return ToolResult.terminalFailure("Unsupported action type: " + type);
    }
  }

  /**
   * 创建或更新线索，成功后标记为已联系；标记失败只记日志，不影响创建结果
   */
  private ToolResult updateCrm(RunState state) {
    Map<String, Object> params = new HashMap<>();
    params.put("email", state.getLeadEmail());
    params.put("name", state.getLeadName());
    params.put("source", state.getSource());
    ToolResult result = toolExecutionService.executeWithRetry(ActionType.CRM,
      CrmActionAdapter.UPSERT, params);

    if (result.success() && result.data().get("lead_id") != null) {
      ToolResult statusResult = toolExecutionService.executeOnce(ActionType.CRM,
        CrmActionAdapter.UPDATE_STATUS,
        Map.of("lead_id", result.data().get("lead_id"), "status", "contacted"));
      if (!statusResult.success()) {
        log.warn("CRM status update failed after upsert: leadId={}, error={}",
          result.data().get("lead_id"), statusResult.error());
      }
    }
    return result;
  }

  /**
   * 只有提到通话 / 会议 / 预约时才预约会议
   */
  private ToolResult bookMeetingIfRequested(RunState state) {
    String query = state.getQuery() != null ? state.getQuery().toLowerCase(Locale.ROOT) : "";
    if (BOOKING_KEYWORDS.stream().noneMatch(query::contains)) {
      return ToolResult.ok(Map.of("message", NO_BOOKING_MESSAGE));
    }
    Map<String, Object> params = new HashMap<>();
    params.put("lead_email", state.getLeadEmail());
    params.put("lead_name", state.getLead() != null && state.getLead().name() != null
      ? state.getLead().name() : state.getLeadEmail());
    params.put("meeting_type", "discovery_call");
    return toolExecutionService.executeWithRetry(ActionType.CALENDAR,
      CalendarActionAdapter.BOOK_MEETING, params);
  }

  private ToolResult sendReply(RunState state) {
    Map<String, Object> params = new HashMap<>();
    params.put("to_email", state.getLeadEmail());
    params.put("subject", EMAIL_SUBJECT);
    params.put("body", state.getResponseText());
    return toolExecutionService.executeWithRetry(ActionType.EMAIL, EmailActionAdapter.SEND,
      params);
  }
}
