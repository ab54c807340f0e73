package com.github.spud.leadagent.domain.kernel;

/**
 * 一轮对话，role 为 lead 或 agent
 */
public record ConversationTurn(String role, String content) {

  public static final String LEAD = "lead";
  public static final String AGENT = "agent";

  public String format() {
    return role + ": " + content;
  }
}
