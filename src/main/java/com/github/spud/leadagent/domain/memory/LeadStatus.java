package com.github.spud.leadagent.domain.memory;

import java.util.Locale;

/**
 * 线索状态
 */
public enum LeadStatus {
  NEW,
  CONTACTED,
  QUALIFIED,
  UNQUALIFIED,
  MEETING_SCHEDULED,
  PROPOSAL_SENT,
  WON,
  LOST,
  ESCALATED;

  /**
   * 对外展示的小写值
   */
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * 按小写值或枚举名解析，无法识别时抛出 IllegalArgumentException
   */
  public static LeadStatus fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Lead status is required");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown lead status: " + value, e);
    }
  }
}
