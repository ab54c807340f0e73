package com.github.spud.leadagent.domain.memory;

import com.github.spud.leadagent.domain.kernel.ConversationTurn;
import com.github.spud.leadagent.domain.kernel.LeadSnapshot;
import com.github.spud.leadagent.infrastructure.persistence.entity.EscalationEvent;
import com.github.spud.leadagent.infrastructure.persistence.entity.Interaction;
import com.github.spud.leadagent.infrastructure.persistence.entity.Lead;
import com.github.spud.leadagent.infrastructure.persistence.repository.EscalationEventRepository;
import com.github.spud.leadagent.infrastructure.persistence.repository.InteractionRepository;
import com.github.spud.leadagent.infrastructure.persistence.repository.LeadRepository;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Limit;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 线索事实记忆服务：线索、交互记录与转人工事件的持久化
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LeadMemoryService {

  private static final List<LeadStatus> FOLLOWUP_STATUSES =
    List.of(LeadStatus.CONTACTED, LeadStatus.QUALIFIED);

  private final LeadRepository leadRepository;
  private final InteractionRepository interactionRepository;
  private final EscalationEventRepository escalationEventRepository;

  /**
   * 按邮箱获取线索，不存在时创建
   */
  @Transactional
  public Lead getOrCreateLead(String email, String name, LeadSource source) {
    String normalized = normalizeEmail(email);
    return leadRepository.findByEmail(normalized).orElseGet(() -> {
      Lead lead = new Lead();
      lead.setEmail(normalized);
      lead.setName(name);
      lead.setSource(source != null ? source : LeadSource.OTHER);
      lead.setStatus(LeadStatus.NEW);
      Lead saved = leadRepository.save(lead);
      log.info("Created lead: id={}, source={}", saved.getId(), saved.getSource());
      return saved;
    });
  }

  /**
   * 创建或更新线索，只覆盖非空字段
   */
  @Transactional
  public Lead upsertLead(String email, String name, String company, String phone,
    LeadSource source) {
    Lead lead = getOrCreateLead(email, name, source);
    if (name != null && !name.isBlank()) {
      lead.setName(name);
    }
    if (company != null && !company.isBlank()) {
      lead.setCompany(company);
    }
    if (phone != null && !phone.isBlank()) {
      lead.setPhone(phone);
    }
    return leadRepository.save(lead);
  }

  @Transactional(readOnly = true)
  public Optional<Lead> findLead(UUID leadId) {
    return leadRepository.findById(leadId);
  }

  @Transactional(readOnly = true)
  public Lead getLead(UUID leadId) {
    return leadRepository.findById(leadId)
      .orElseThrow(() -> new LeadNotFoundException("Lead not found: " + leadId));
  }

  /**
   * 更新线索状态并记录最近联系时间
   */
  @Transactional
  public Lead updateStatus(UUID leadId, LeadStatus status) {
    Lead lead = getLead(leadId);
    lead.setStatus(status);
    lead.setLastContactedAt(now());
    log.info("Lead status updated: id={}, status={}", leadId, status);
    return leadRepository.save(lead);
  }

  /**
   * 更新资格评估信息，score >= 0.7 为 QUALIFIED，< 0.4 为 UNQUALIFIED
   */
  @Transactional
  public Lead qualify(UUID leadId, double score, String budgetRange, String timeline,
    Boolean decisionMaker) {
    Lead lead = getLead(leadId);
    lead.setQualificationScore(score);
    if (budgetRange != null) {
      lead.setBudgetRange(budgetRange);
    }
    if (timeline != null) {
      lead.setTimeline(timeline);
    }
    if (decisionMaker != null) {
      lead.setDecisionMaker(decisionMaker);
    }
    if (score >= 0.7) {
      lead.setStatus(LeadStatus.QUALIFIED);
    } else if (score < 0.4) {
      lead.setStatus(LeadStatus.UNQUALIFIED);
    }
    return leadRepository.save(lead);
  }

  @Transactional
  public Lead scheduleFollowup(UUID leadId, OffsetDateTime followupAt) {
    Lead lead = getLead(leadId);
    lead.setNextFollowupAt(followupAt);
    return leadRepository.save(lead);
  }

  /**
   * 跟进完成：记录联系时间并推迟下一次跟进
   */
  @Transactional
  public Lead markFollowedUp(UUID leadId, OffsetDateTime nextFollowupAt) {
    Lead lead = getLead(leadId);
    lead.setLastContactedAt(now());
    lead.setNextFollowupAt(nextFollowupAt);
    return leadRepository.save(lead);
  }

  @Transactional
  public Interaction addInteraction(UUID leadId, String from, String text, String decisionType,
    Double confidence, List<String> toolsUsed, List<String> sources) {
    Interaction interaction = new Interaction();
    interaction.setLeadId(leadId);
    interaction.setMessageFrom(from);
    interaction.setMessageText(text != null ? text : "");
    interaction.setDecisionType(decisionType);
    interaction.setConfidenceScore(confidence);
    interaction.setToolsUsed(toolsUsed != null ? new ArrayList<>(toolsUsed) : new ArrayList<>());
    interaction.setSourcesRetrieved(sources != null ? new ArrayList<>(sources) : new ArrayList<>());
    return interactionRepository.save(interaction);
  }

  /**
   * 最近 limit 条交互（倒序）
   */
  @Transactional(readOnly = true)
  public List<Interaction> recentInteractions(UUID leadId, int limit) {
    return interactionRepository.findByLeadIdOrderByCreatedAtDescIdDesc(leadId, Limit.of(limit));
  }

  /**
   * 最近 limit 条对话，按时间正序
   */
  @Transactional(readOnly = true)
  public List<ConversationTurn> recentConversation(UUID leadId, int limit) {
    List<ConversationTurn> turns = recentInteractions(leadId, limit).stream()
      .map(i -> new ConversationTurn(i.getMessageFrom(), i.getMessageText()))
      .collect(Collectors.toCollection(ArrayList::new));
    Collections.reverse(turns);
    return turns;
  }

  @Transactional
  public EscalationEvent recordEscalation(UUID leadId, String reason, Double confidence,
    Map<String, Object> context) {
    EscalationEvent event = new EscalationEvent();
    event.setLeadId(leadId);
    event.setReason(reason);
    event.setConfidenceScore(confidence);
    event.setContext(context != null ? new HashMap<>(context) : new HashMap<>());
    EscalationEvent saved = escalationEventRepository.save(event);
    log.info("Escalation recorded: leadId={}, reason={}", leadId, reason);
    return saved;
  }

  /**
   * 到期需要跟进的线索
   */
  @Transactional(readOnly = true)
  public List<Lead> leadsDueForFollowup(int batchSize) {
    return leadRepository.findDueForFollowup(now(), FOLLOWUP_STATUSES,
      PageRequest.of(0, batchSize));
  }

  public static LeadSnapshot toSnapshot(Lead lead) {
    return new LeadSnapshot(
      lead.getId() != null ? lead.getId().toString() : null,
      lead.getEmail(),
      lead.getName(),
      lead.getCompany(),
      lead.getStatus() != null ? lead.getStatus().value() : null);
  }

  private static String normalizeEmail(String email) {
    if (email == null || email.isBlank()) {
      throw new IllegalArgumentException("Lead email is required");
    }
    return email.trim().toLowerCase();
  }

  private static OffsetDateTime now() {
    return OffsetDateTime.now(ZoneOffset.UTC);
  }

  public static class LeadNotFoundException extends RuntimeException {

    public LeadNotFoundException(String message) {
      super(message);
    }
  }
}
