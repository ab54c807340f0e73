package com.github.spud.leadagent.domain.followup;

import com.github.spud.leadagent.config.AgentProperties;
import com.github.spud.leadagent.domain.memory.LeadMemoryService;
import com.github.spud.leadagent.domain.tools.ActionType;
import com.github.spud.leadagent.domain.tools.EmailActionAdapter;
import com.github.spud.leadagent.domain.tools.ToolExecutionService;
import com.github.spud.leadagent.domain.tools.ToolResult;
import com.github.spud.leadagent.infrastructure.persistence.entity.Lead;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 跟进任务：定期向到期线索发送跟进邮件
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.agent.followup.enabled", havingValue = "true")
public class FollowUpScheduler {

  static final String FOLLOWUP_CONTEXT =
    "You were interested in learning more about our services.";

  private final LeadMemoryService leadMemoryService;
  private final ToolExecutionService toolExecutionService;
  private final AgentProperties agentProperties;

  @Scheduled(fixedDelayString = "${app.agent.followup.check-interval:PT30M}")
  public void checkFollowups() {
    List<Lead> leads = leadMemoryService.leadsDueForFollowup(
      agentProperties.getFollowup().getBatchSize());
    log.info("Checking follow-ups: dueLeads={}", leads.size());

    int sent = 0;
    for (Lead lead : leads) {
      try {
        if (sendFollowup(lead)) {
          sent++;
        }
      } catch (Exception e) {
        log.error("Follow-up failed: leadId={}, error={}", lead.getId(), e.getMessage(), e);
      }
    }
    log.info("Follow-up check finished: sent={}/{}", sent, leads.size());
  }

  boolean sendFollowup(Lead lead) {
    Map<String, Object> params = new HashMap<>();
    params.put("to_email", lead.getEmail());
    params.put("lead_name", lead.getName());
    params.put("context", FOLLOWUP_CONTEXT);

    ToolResult result = toolExecutionService.executeOnce(ActionType.EMAIL,
      EmailActionAdapter.SEND_FOLLOWUP, params);
    if (!result.success()) {
      log.warn("Follow-up email not sent: leadId={}, error={}", lead.getId(), result.error());
      return false;
    }

    OffsetDateTime next = OffsetDateTime.now(ZoneOffset.UTC)
      .plusDays(agentProperties.getFollowup().getIntervalDays());
    leadMemoryService.markFollowedUp(lead.getId(), next);
    log.info("Follow-up sent: leadId={}, nextFollowupAt={}", lead.getId(), next);
    return true;
  }
}
