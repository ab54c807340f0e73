package com.github.spud.leadagent.domain.memory;

import java.util.Locale;

/**
 * 线索来源渠道
 */
public enum LeadSource {
  WEBSITE_FORM,
  EMAIL,
  PHONE,
  REFERRAL,
  SOCIAL_MEDIA,
  OTHER;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * 宽松解析，未知渠道归为 OTHER
   */
  public static LeadSource fromValue(String value) {
    if (value == null || value.isBlank()) {
      return OTHER;
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    for (LeadSource source : values()) {
      if (source.name().equals(normalized)) {
        return source;
      }
    }
    return OTHER;
  }
}
