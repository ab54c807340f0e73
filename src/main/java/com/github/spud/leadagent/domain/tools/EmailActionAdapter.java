package com.github.spud.leadagent.domain.tools;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 邮件适配器，进程内发件箱，不对外投递
 * <p>
 * 支持：send / send_followup。发件箱只保留最近 {@value #DEFAULT_CAPACITY} 封，超出后丢弃最早的。
 */
@Slf4j
@Component
public class EmailActionAdapter extends AbstractActionAdapter {

  public static final String SEND = "send";
  public static final String SEND_FOLLOWUP = "send_followup";

  private static final String FOLLOWUP_SUBJECT = "Following up on your inquiry";
  private static final String FOLLOWUP_TEMPLATE = """
    Hi %s,

    %sI wanted to follow up on our previous conversation. Do you have any questions I can help with, \
    or would you like to schedule a quick call?

    Best regards""";

  static final int DEFAULT_CAPACITY = 500;

  private final Deque<Map<String, Object>> outbox = new ArrayDeque<>();
  private final int capacity;

  public EmailActionAdapter() {
    this(DEFAULT_CAPACITY);
  }

  EmailActionAdapter(int capacity) {
    this.capacity = capacity;
    register(SEND, this::send);
    register(SEND_FOLLOWUP, this::sendFollowup);
  }

  @Override
  public ActionType type() {
    return ActionType.EMAIL;
  }

  private ToolResult send(Map<String, Object> params) {
    return deliver(requireString(params, "to_email"),
      requireString(params, "subject"),
      requireString(params, "body"));
  }

  private ToolResult sendFollowup(Map<String, Object> params) {
    String email = requireString(params, "to_email");
    String name = optionalString(params, "lead_name", "there");
    String context = optionalString(params, "context");
    String opening = context != null && !context.isBlank() ? context.trim() + " " : "";
    return deliver(email, FOLLOWUP_SUBJECT, FOLLOWUP_TEMPLATE.formatted(name, opening));
  }

  private ToolResult deliver(String to, String subject, String body) {
    String messageId = UUID.randomUUID().toString();
    Map<String, Object> message = new LinkedHashMap<>();
    message.put("message_id", messageId);
    message.put("to_email", to);
    message.put("subject", subject);
    message.put("body", body);
    message.put("sent_at", OffsetDateTime.now(ZoneOffset.UTC).toString());
    synchronized (outbox) {
      outbox.addLast(message);
      while (outbox.size() > capacity) {
        outbox.removeFirst();
      }
    }

    log.info("Email queued: messageId={}, subject='{}'", messageId, subject);
    return ToolResult.ok(Map.of("message_id", messageId, "to_email", to));
  }

  /**
   * 已发送邮件快照
   */
  public List<Map<String, Object>> sentMessages() {
    synchronized (outbox) {
      return new ArrayList<>(outbox);
    }
  }
}
