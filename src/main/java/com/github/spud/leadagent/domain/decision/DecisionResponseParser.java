package com.github.spud.leadagent.domain.decision;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 决策响应解析器
 * <p>
 * 响应格式为 KEY: VALUE 行，必需键：DECISION / CONFIDENCE / REASONING / TOOLS_NEEDED / RETRIEVAL_NEEDED。
 * 解析是全函数：任意输入都返回合法结果，无法识别的决策一律归为 ESCALATE。
 */
@Slf4j
@Component
public class DecisionResponseParser {

  static final double DEFAULT_CONFIDENCE = 0.5;
  static final String DEFAULT_REASONING = "No reasoning provided";

  /**
   * 十进制小数，可带指数；不接受 0.9f、0x1p-1、Infinity 这类 Java 字面量
   */
  private static final Pattern DECIMAL =
    Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

  public DecisionOutput parse(String text) {
    Map<String, String> fields = readFields(text);

    String rawDecision = fields.get("DECISION");
    DecisionType decision = DecisionType.fromTag(rawDecision).orElse(null);
    String escalationReason = null;
    if (decision == null) {
      log.warn("Unrecognized decision '{}', failing closed to ESCALATE", rawDecision);
      decision = DecisionType.ESCALATE;
      escalationReason = EscalationReasons.UNRECOGNIZED_DECISION;
    } else if (decision == DecisionType.ESCALATE) {
      escalationReason = EscalationReasons.AGENT_DECISION;
    }

    String reasoning = fields.get("REASONING");
    if (reasoning == null || reasoning.isBlank()) {
      reasoning = DEFAULT_REASONING;
    }

    return DecisionOutput.builder()
      .decision(decision)
      .confidence(parseConfidence(fields.get("CONFIDENCE")))
      .reasoning(reasoning)
      .toolsNeeded(parseTools(fields.get("TOOLS_NEEDED")))
      .retrievalNeeded("yes".equalsIgnoreCase(trimToEmpty(fields.get("RETRIEVAL_NEEDED"))))
      .escalationReason(escalationReason)
      .build();
  }

  /**
   * 逐行读取 KEY: VALUE，按第一个冒号切分，键忽略大小写与 markdown 加粗
   */
  static Map<String, String> readFields(String text) {
    Map<String, String> fields = new HashMap<>();
    if (text == null) {
      return fields;
    }
    for (String line : text.split("\\R")) {
      int idx = line.indexOf(':');
      if (idx <= 0) {
        continue;
      }
      String key = line.substring(0, idx)
        .replace("*", "")
        .trim()
        .toUpperCase(Locale.ROOT);
      String value = line.substring(idx + 1).replace("*", "").trim();
      fields.putIfAbsent(key, value);
    }
    return fields;
  }

  static double parseConfidence(String value) {
    if (value == null || !DECIMAL.matcher(value.trim()).matches()) {
      log.debug("Unparsable confidence '{}', using {}", value, DEFAULT_CONFIDENCE);
      return DEFAULT_CONFIDENCE;
    }
    return clamp(Double.parseDouble(value.trim()));
  }

  static List<String> parseTools(String value) {
    String trimmed = trimToEmpty(value);
    if (trimmed.isEmpty() || "none".equalsIgnoreCase(trimmed)) {
      return List.of();
    }
    List<String> tools = Arrays.stream(trimmed.split(","))
      .map(String::trim)
      .filter(s -> !s.isEmpty())
      .collect(Collectors.toCollection(ArrayList::new));
    return List.copyOf(tools);
  }

  static double clamp(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }

  private static String trimToEmpty(String value) {
    return value == null ? "" : value.trim();
  }
}
