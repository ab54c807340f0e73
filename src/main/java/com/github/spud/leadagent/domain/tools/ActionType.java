package com.github.spud.leadagent.domain.tools;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * 外部动作类型
 * <p>
 * 决策输出的动作名称按分词匹配关键词，例如 crm_update → CRM，calendar_booking → CALENDAR。
 */
public enum ActionType {
  CRM("crm"),
  CALENDAR("calendar", "meeting", "booking"),
  EMAIL("email", "mail");

  private final Set<String> keywords;

  ActionType(String... keywords) {
    this.keywords = Set.of(keywords);
  }

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * 解析动作名称，无匹配返回 empty
   */
  public static Optional<ActionType> resolve(String actionName) {
    if (actionName == null || actionName.isBlank()) {
      return Optional.empty();
    }
    String[] tokens = actionName.toLowerCase(Locale.ROOT).split("[^a-z0-9]+");
    for (ActionType type : values()) {
      if (Arrays.stream(tokens).anyMatch(type.keywords::contains)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
