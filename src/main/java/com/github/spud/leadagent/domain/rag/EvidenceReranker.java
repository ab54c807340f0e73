package com.github.spud.leadagent.domain.rag;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.DoubleSummaryStatistics;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * 证据重排器
 * <p>
 * 综合分 = w1 * 相似度 + w2 * 时效 + w3 * 类型质量，按综合分稳定降序。综合分只依赖原始相似度与元数据，重复调用结果不变。
 */
@Slf4j
@Component
public class EvidenceReranker {

  private static final List<Function<String, Instant>> TIMESTAMP_PARSERS = List.of(
    v -> OffsetDateTime.parse(v).toInstant(),
    v -> Instant.parse(v),
    v -> LocalDateTime.parse(v).toInstant(ZoneOffset.UTC),
    v -> LocalDate.parse(v).atStartOfDay().toInstant(ZoneOffset.UTC));

  private final RagProperties ragProperties;
  private final Clock clock;

  @Autowired
  public EvidenceReranker(RagProperties ragProperties) {
    this(ragProperties, Clock.systemUTC());
  }

  EvidenceReranker(RagProperties ragProperties, Clock clock) {
    this.ragProperties = ragProperties;
    this.clock = clock;
  }

  /**
   * 原地重排：覆盖 score 并按综合分降序（稳定排序）
   */
  public List<Evidence> rerank(List<Evidence> evidence) {
    if (evidence.isEmpty()) {
      return evidence;
    }
    for (Evidence item : evidence) {
      item.setScore(compositeScore(item));
    }
    // List.sort 为稳定排序，同分保持输入顺序
    evidence.sort(Comparator.comparingDouble(Evidence::getScore).reversed());

    log.debug("Reranked {} evidence, top score={}", evidence.size(), evidence.get(0).getScore());
    return evidence;
  }

  /**
   * 计算单条证据的综合分
   */
  public double compositeScore(Evidence item) {
    RagProperties.Rerank cfg = ragProperties.getRerank();
    return cfg.getSimilarityWeight() * item.getSimilarity()
      + cfg.getRecencyWeight() * recency(item.getMetadata())
      + cfg.getQualityWeight() * quality(item.getDocType());
  }

  /**
   * 过滤综合分低于阈值的证据
   */
  public List<Evidence> filterLowQuality(List<Evidence> evidence, double threshold) {
    List<Evidence> kept = evidence.stream()
      .filter(item -> item.isHighQuality(threshold))
      .collect(Collectors.toList());
    if (kept.size() < evidence.size()) {
      log.debug("Filtered {} low quality evidence below {}", evidence.size() - kept.size(),
        threshold);
    }
    return kept;
  }

  /**
   * 冲突检测：pricing / policy 同类证据中分差超过阈值即视为冲突
   */
  public boolean detectConflicts(List<Evidence> evidence) {
    RagProperties.Rerank cfg = ragProperties.getRerank();
    Map<String, DoubleSummaryStatistics> byType = evidence.stream()
      .filter(item -> item.getDocType() != null)
      .collect(Collectors.groupingBy(item -> item.getDocType().toLowerCase(Locale.ROOT),
        Collectors.summarizingDouble(Evidence::getScore)));

    for (String type : cfg.getConflictTypes()) {
      DoubleSummaryStatistics stats = byType.get(type);
      if (stats != null && stats.getCount() > 1
        && stats.getMax() - stats.getMin() > cfg.getConflictSpread()) {
        log.info("Conflict detected in {} evidence: spread={}", type,
          stats.getMax() - stats.getMin());
        return true;
      }
    }
    return false;
  }

  double recency(Map<String, Object> metadata) {
    RagProperties.Rerank cfg = ragProperties.getRerank();
    Object raw = metadata != null ? metadata.get(MetadataKeys.UPDATED_AT) : null;
    if (raw == null) {
      return cfg.getDefaultRecency();
    }
    Instant updatedAt = parseTimestamp(raw.toString());
    if (updatedAt == null) {
      return cfg.getDefaultRecency();
    }
    long days = Math.max(0, ChronoUnit.DAYS.between(updatedAt, clock.instant()));
    return Math.exp(-days / cfg.getRecencyDecayDays());
  }

  double quality(String docType) {
    RagProperties.Rerank cfg = ragProperties.getRerank();
    if (docType == null) {
      return cfg.getDefaultQuality();
    }
    return cfg.getQualityByType()
      .getOrDefault(docType.toLowerCase(Locale.ROOT), cfg.getDefaultQuality());
  }

  private static Instant parseTimestamp(String value) {
    DateTimeParseException last = null;
    for (Function<String, Instant> parser : TIMESTAMP_PARSERS) {
      try {
        return parser.apply(value);
      } catch (DateTimeParseException e) {
        last = e;
      }
    }
    log.debug("Unparsable updated_at '{}', using default recency: {}", value,
      last != null ? last.getMessage() : null);
    return null;
  }
}
