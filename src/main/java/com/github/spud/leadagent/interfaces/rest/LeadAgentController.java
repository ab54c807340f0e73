package com.github.spud.leadagent.interfaces.rest;

import com.github.spud.leadagent.domain.kernel.InboundLead;
import com.github.spud.leadagent.domain.kernel.LeadAgentOrchestrator;
import com.github.spud.leadagent.domain.kernel.PipelineResult;
import com.github.spud.leadagent.domain.memory.LeadMemoryService;
import com.github.spud.leadagent.infrastructure.persistence.entity.Interaction;
import com.github.spud.leadagent.infrastructure.persistence.entity.Lead;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 线索 Agent API Controller 提供入站 webhook、线索状态与健康检查
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class LeadAgentController {

  static final String VERSION = "1.0.0";

  static final int STATUS_INTERACTION_LIMIT = 10;

  private final LeadAgentOrchestrator orchestrator;
  private final LeadMemoryService leadMemoryService;

  /**
   * 入站线索 webhook，同步执行流水线
   */
  @PostMapping("/webhook/lead")
  public Mono<ResponseEntity<PipelineResult>> webhookLead(
    @Valid @RequestBody LeadWebhookRequest request) {
    return Mono.fromCallable(() -> {
      log.info("Received lead webhook: source={}, message='{}'", request.getSource(),
        StringUtils.truncate(request.getMessage(), 100));

      PipelineResult result = orchestrator.run(new InboundLead(
        request.getEmail(),
        request.getName(),
        request.getMessage(),
        request.getSource(),
        request.getMetadata()));

      return ResponseEntity.ok(result);
    }).subscribeOn(Schedulers.boundedElastic());
  }

  /**
   * 线索状态与最近交互
   */
  @GetMapping("/agent/status/{leadId}")
  public Mono<ResponseEntity<LeadStatusResponse>> leadStatus(@PathVariable String leadId) {
    return Mono.fromCallable(() -> {
      UUID id = UUID.fromString(leadId);
      Lead lead = leadMemoryService.getLead(id);
      List<Interaction> interactions = leadMemoryService.recentInteractions(id,
        STATUS_INTERACTION_LIMIT);
      return ResponseEntity.ok(LeadStatusResponse.from(lead, interactions));
    }).subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/health")
  public ResponseEntity<HealthResponse> health() {
    HealthResponse response = new HealthResponse();
    response.setStatus("healthy");
    response.setVersion(VERSION);
    response.setTimestamp(OffsetDateTime.now());
    return ResponseEntity.ok(response);
  }

  // ===== Request/Response DTOs =====

  @Data
  public static class LeadWebhookRequest {

    @NotBlank
    @Email
    private String email;

    private String name;

    @NotBlank
    private String message;

    private String source = "website_form";

    private Map<String, Object> metadata;
  }

  @Data
  public static class LeadStatusResponse {

    private String leadId;
    private String email;
    private String name;
    private String company;
    private String status;
    private double qualificationScore;
    private OffsetDateTime createdAt;
    private OffsetDateTime lastContactedAt;
    private OffsetDateTime nextFollowupAt;
    private List<InteractionView> recentInteractions;

    public static LeadStatusResponse from(Lead lead, List<Interaction> interactions) {
      LeadStatusResponse resp = new LeadStatusResponse();
      resp.setLeadId(lead.getId().toString());
      resp.setEmail(lead.getEmail());
      resp.setName(lead.getName());
      resp.setCompany(lead.getCompany());
      resp.setStatus(lead.getStatus() != null ? lead.getStatus().value() : "unknown");
      resp.setQualificationScore(lead.getQualificationScore() != null
        ? lead.getQualificationScore() : 0.0);
      resp.setCreatedAt(lead.getCreatedAt());
      resp.setLastContactedAt(lead.getLastContactedAt());
      resp.setNextFollowupAt(lead.getNextFollowupAt());
      resp.setRecentInteractions(interactions.stream().map(InteractionView::from).toList());
      return resp;
    }
  }

  @Data
  public static class InteractionView {

    private Long id;
    private String messageFrom;
    private String messageText;
    private String decisionType;
    private Double confidenceScore;
    private List<String> toolsUsed;
    private List<String> sourcesRetrieved;
    private OffsetDateTime createdAt;

    public static InteractionView from(Interaction interaction) {
      InteractionView view = new InteractionView();
      view.setId(interaction.getId());
      view.setMessageFrom(interaction.getMessageFrom());
      view.setMessageText(interaction.getMessageText());
      view.setDecisionType(interaction.getDecisionType());
      view.setConfidenceScore(interaction.getConfidenceScore());
      view.setToolsUsed(interaction.getToolsUsed());
      view.setSourcesRetrieved(interaction.getSourcesRetrieved());
      view.setCreatedAt(interaction.getCreatedAt());
      return view;
    }
  }

  @Data
  public static class HealthResponse {

    private String status;
    private String version;
    private OffsetDateTime timestamp;
  }
}
