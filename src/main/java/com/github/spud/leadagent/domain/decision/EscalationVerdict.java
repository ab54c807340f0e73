package com.github.spud.leadagent.domain.decision;

/**
 * 转人工判定结果，escalate 为 false 时 reason 为 null
 */
public record EscalationVerdict(boolean escalate, String reason) {

  private static final EscalationVerdict NONE = new EscalationVerdict(false, null);

  public static EscalationVerdict none() {
    return NONE;
  }

  public static EscalationVerdict of(String reason) {
    return new EscalationVerdict(true, reason);
  }
}
