package com.github.spud.leadagent.domain.tools;

import com.github.spud.leadagent.domain.memory.LeadMemoryService;
import com.github.spud.leadagent.domain.memory.LeadSource;
import com.github.spud.leadagent.domain.memory.LeadStatus;
import com.github.spud.leadagent.infrastructure.persistence.entity.Lead;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * CRM 适配器，基于线索库实现
 * <p>
 * 支持：upsert / qualify / update_status / get_lead / schedule_followup
 */
@Slf4j
@Component
public class CrmActionAdapter extends AbstractActionAdapter {

  public static final String UPSERT = "upsert";
  public static final String QUALIFY = "qualify";
  public static final String UPDATE_STATUS = "update_status";
  public static final String GET_LEAD = "get_lead";
  public static final String SCHEDULE_FOLLOWUP = "schedule_followup";

  static final int DEFAULT_FOLLOWUP_DAYS = 3;

  private final LeadMemoryService leadMemoryService;

  public CrmActionAdapter(LeadMemoryService leadMemoryService) {
    this.leadMemoryService = leadMemoryService;
    register(UPSERT, this::upsert);
    register(QUALIFY, params -> withLead(params, lead -> qualify(lead, params)));
    register(UPDATE_STATUS, params -> withLead(params, lead -> updateStatus(lead, params)));
    register(GET_LEAD, params -> withLead(params, lead -> ToolResult.ok(toData(lead))));
    register(SCHEDULE_FOLLOWUP, params -> withLead(params, lead -> scheduleFollowup(lead, params)));
  }

  @Override
  public ActionType type() {
    return ActionType.CRM;
  }

  private ToolResult upsert(Map<String, Object> params) {
    Lead lead = leadMemoryService.upsertLead(
      requireString(params, "email"),
      optionalString(params, "name"),
      optionalString(params, "company"),
      optionalString(params, "phone"),
      LeadSource.fromValue(optionalString(params, "source")));
    return ToolResult.ok(toData(lead));
  }

  private ToolResult qualify(Lead lead, Map<String, Object> params) {
    double score = doubleParam(params, "score", 0.5);
    Object decisionMaker = params.get("decision_maker");
    Lead updated = leadMemoryService.qualify(lead.getId(), score,
      optionalString(params, "budget_range"),
      optionalString(params, "timeline"),
      decisionMaker != null ? Boolean.valueOf(decisionMaker.toString()) : null);
    return ToolResult.ok(toData(updated));
  }

  private ToolResult updateStatus(Lead lead, Map<String, Object> params) {
    LeadStatus status = LeadStatus.fromValue(requireString(params, "status"));
    Lead updated = leadMemoryService.updateStatus(lead.getId(), status);
    return ToolResult.ok(toData(updated));
  }

  private ToolResult scheduleFollowup(Lead lead, Map<String, Object> params) {
    int days = intParam(params, "days_ahead", DEFAULT_FOLLOWUP_DAYS);
    OffsetDateTime followupAt = OffsetDateTime.now(ZoneOffset.UTC).plusDays(days);
    Lead updated = leadMemoryService.scheduleFollowup(lead.getId(), followupAt);
    Map<String, Object> data = toData(updated);
    data.put("followup_date", followupAt.toString());
    return ToolResult.ok(data);
  }

  private ToolResult withLead(Map<String, Object> params, Function<Lead, ToolResult> action) {
    UUID leadId = UUID.fromString(requireString(params, "lead_id"));
    Optional<Lead> lead = leadMemoryService.findLead(leadId);
    if (lead.isEmpty()) {
      return ToolResult.terminalFailure("Lead not found: " + leadId);
    }
    return action.apply(lead.get());
  }

  static Map<String, Object> toData(Lead lead) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("lead_id", lead.getId() != null ? lead.getId().toString() : null);
    data.put("email", lead.getEmail());
    data.put("name", lead.getName());
    data.put("company", lead.getCompany());
    data.put("status", lead.getStatus() != null ? lead.getStatus().value() : null);
    data.put("qualification_score", lead.getQualificationScore());
    return data;
  }
}
