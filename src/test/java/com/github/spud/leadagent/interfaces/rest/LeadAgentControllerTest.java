package com.github.spud.leadagent.interfaces.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.spud.leadagent.domain.decision.DecisionType;
import com.github.spud.leadagent.domain.kernel.InboundLead;
import com.github.spud.leadagent.domain.kernel.LeadAgentOrchestrator;
import com.github.spud.leadagent.domain.kernel.PipelineResult;
import com.github.spud.leadagent.domain.memory.LeadMemoryService;
import com.github.spud.leadagent.domain.memory.LeadMemoryService.LeadNotFoundException;
import com.github.spud.leadagent.domain.memory.LeadStatus;
import com.github.spud.leadagent.infrastructure.persistence.entity.Interaction;
import com.github.spud.leadagent.infrastructure.persistence.entity.Lead;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;

/**
 * Web 层切片测试：编排器与记忆服务均为 mock
 */
@WebFluxTest(controllers = LeadAgentController.class)
@ActiveProfiles("test")
class LeadAgentControllerTest {

  @Autowired
  private WebTestClient webTestClient;

  @MockitoBean
  private LeadAgentOrchestrator orchestrator;

  @MockitoBean
  private LeadMemoryService leadMemoryService;

  @Test
  void shouldRunPipelineForWebhook() {
    when(orchestrator.run(any())).thenReturn(PipelineResult.builder()
      .traceId("trace-1")
      .leadId("lead-1")
      .responseText("Our Pro plan is $99/month.")
      .confidence(0.85)
      .decisionType(DecisionType.RETRIEVE)
      .sourcesUsed(List.of("Pricing Sheet"))
      .toolsCalled(List.of())
      .grounded(true)
      .errors(List.of())
      .stageRecords(List.of())
      .build());

    String body = """
      {
        "email": "jane@acme.com",
        "name": "Jane",
        "message": "What are your prices?"
      }
      """;

    webTestClient.post()
      .uri("/webhook/lead")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue(body)
      .exchange()
      .expectStatus().isOk()
      .expectBody()
      .jsonPath("$.responseText").isEqualTo("Our Pro plan is $99/month.")
      .jsonPath("$.grounded").isEqualTo(true)
      .jsonPath("$.escalated").isEqualTo(false)
      .jsonPath("$.sourcesUsed[0]").isEqualTo("Pricing Sheet");

    ArgumentCaptor<InboundLead> captor = ArgumentCaptor.forClass(InboundLead.class);
    verify(orchestrator).run(captor.capture());
    assertThat(captor.getValue().email()).isEqualTo("jane@acme.com");
    assertThat(captor.getValue().source()).isEqualTo("website_form");
  }

  @Test
  void shouldRejectWebhookWithoutMessage() {
    webTestClient.post()
      .uri("/webhook/lead")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue("{\"email\": \"not-an-email\"}")
      .exchange()
      .expectStatus().isBadRequest()
      .expectBody()
      .jsonPath("$.code").isEqualTo("VALIDATION_ERROR")
      .jsonPath("$.details.fieldErrors.message").exists()
      .jsonPath("$.details.fieldErrors.email").exists();

    verify(orchestrator, never()).run(any());
  }

  @Test
  void shouldRejectMalformedJson() {
    webTestClient.post()
      .uri("/webhook/lead")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue("{\"email\": ")
      .exchange()
      .expectStatus().isBadRequest()
      .expectBody()
      .jsonPath("$.code").isEqualTo("INVALID_REQUEST");
  }

  @Test
  void shouldReturnLeadStatus() {
    UUID leadId = UUID.randomUUID();
    Lead lead = new Lead();
    lead.setId(leadId);
    lead.setEmail("jane@acme.com");
    lead.setStatus(LeadStatus.CONTACTED);

    Interaction interaction = new Interaction();
    interaction.setMessageFrom("agent");
    interaction.setMessageText("Hello Jane");

    when(leadMemoryService.getLead(leadId)).thenReturn(lead);
    when(leadMemoryService.recentInteractions(leadId, 10)).thenReturn(List.of(interaction));

    webTestClient.get()
      .uri("/agent/status/" + leadId)
      .exchange()
      .expectStatus().isOk()
      .expectBody()
      .jsonPath("$.leadId").isEqualTo(leadId.toString())
      .jsonPath("$.status").isEqualTo("contacted")
      .jsonPath("$.qualificationScore").isEqualTo(0.0)
      .jsonPath("$.recentInteractions[0].messageText").isEqualTo("Hello Jane");
  }

  @Test
  void shouldReturn404ForUnknownLead() {
    UUID leadId = UUID.randomUUID();
    when(leadMemoryService.getLead(leadId))
      .thenThrow(new LeadNotFoundException("Lead not found: " + leadId));

    webTestClient.get()
      .uri("/agent/status/" + leadId)
      .exchange()
      .expectStatus().isNotFound()
      .expectBody()
      .jsonPath("$.code").isEqualTo("LEAD_NOT_FOUND");
  }

  @Test
  void shouldReturn400ForMalformedLeadId() {
    webTestClient.get()
      .uri("/agent/status/not-a-uuid")
      .exchange()
      .expectStatus().isBadRequest()
      .expectBody()
      .jsonPath("$.code").isEqualTo("INVALID_ARGUMENT");
  }

  @Test
  void shouldReportHealthy() {
    webTestClient.get()
      .uri("/health")
      .exchange()
      .expectStatus().isOk()
      .expectBody()
      .jsonPath("$.status").isEqualTo("healthy")
      .jsonPath("$.version").isEqualTo("1.0.0");
  }
}
