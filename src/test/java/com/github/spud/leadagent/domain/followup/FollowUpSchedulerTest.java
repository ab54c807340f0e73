package com.github.spud.leadagent.domain.followup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.spud.leadagent.config.AgentProperties;
import com.github.spud.leadagent.domain.memory.LeadMemoryService;
import com.github.spud.leadagent.domain.tools.ActionType;
import com.github.spud.leadagent.domain.tools.EmailActionAdapter;
import com.github.spud.leadagent.domain.tools.ToolExecutionService;
import com.github.spud.leadagent.domain.tools.ToolResult;
import com.github.spud.leadagent.infrastructure.persistence.entity.Lead;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FollowUpSchedulerTest {

  @Mock
  private LeadMemoryService leadMemoryService;

  @Mock
  private ToolExecutionService toolExecutionService;

  private FollowUpScheduler scheduler;

  @BeforeEach
  void setUp() {
    scheduler = new FollowUpScheduler(leadMemoryService, toolExecutionService,
      new AgentProperties());
  }

  private static Lead lead(String email) {
    Lead lead = new Lead();
    lead.setId(UUID.randomUUID());
    lead.setEmail(email);
    lead.setName("Lead " + email);
    return lead;
  }

  @Test
  void shouldSendFollowupAndScheduleNext() {
    Lead lead = lead("a@acme.com");
    when(toolExecutionService.executeOnce(eq(ActionType.EMAIL),
      eq(EmailActionAdapter.SEND_FOLLOWUP), anyMap())).thenReturn(ToolResult.ok(Map.of()));

    OffsetDateTime before = OffsetDateTime.now();
    assertThat(scheduler.sendFollowup(lead)).isTrue();

    verify(toolExecutionService).executeOnce(eq(ActionType.EMAIL),
      eq(EmailActionAdapter.SEND_FOLLOWUP), argThat(params ->
        "a@acme.com".equals(params.get("to_email"))
          && FollowUpScheduler.FOLLOWUP_CONTEXT.equals(params.get("context"))));
    verify(leadMemoryService).markFollowedUp(eq(lead.getId()),
      argThat(next -> !next.isBefore(before.plusDays(7).minusMinutes(1))));
  }

  @Test
  void shouldNotMarkLeadWhenEmailFails() {
    Lead lead = lead("a@acme.com");
    when(toolExecutionService.executeOnce(any(), any(), anyMap()))
      .thenReturn(ToolResult.terminalFailure("smtp down"));

    assertThat(scheduler.sendFollowup(lead)).isFalse();

    verify(leadMemoryService, never()).markFollowedUp(any(), any());
  }

  @Test
  void failureForOneLeadShouldNotStopTheBatch() {
    Lead broken = lead("broken@acme.com");
    Lead healthy = lead("ok@acme.com");
    when(leadMemoryService.leadsDueForFollowup(50)).thenReturn(List.of(broken, healthy));
    when(toolExecutionService.executeOnce(eq(ActionType.EMAIL),
      eq(EmailActionAdapter.SEND_FOLLOWUP), anyMap())).thenAnswer(inv -> {
        Map<String, Object> params = inv.getArgument(2);
        if ("broken@acme.com".equals(params.get("to_email"))) {
          throw new IllegalStateException("boom");
        }
        return ToolResult.ok(Map.of());
      });

    scheduler.checkFollowups();

    verify(leadMemoryService).markFollowedUp(eq(healthy.getId()), any());
    verify(leadMemoryService, never()).markFollowedUp(eq(broken.getId()), any());
  }
}
