package com.github.spud.leadagent.domain.rag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * 证据重排测试：综合分、稳定排序、过滤与冲突检测
 */
class EvidenceRerankerTest {

  private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

  private EvidenceReranker reranker;

  @BeforeEach
  void setUp() {
    reranker = new EvidenceReranker(new RagProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static Evidence evidence(String id, String type, double similarity) {
    return Evidence.builder()
      .sourceId(id)
      .docTitle(id)
      .docType(type)
      .similarity(similarity)
      .score(similarity)
      .build();
  }

  private static Evidence scored(String type, double score) {
    return Evidence.builder().sourceId(type + score).docType(type).score(score).build();
  }

  @Test
  void shouldComputeCompositeScoreWithDefaults() {
    // 无 updated_at 时时效分取 0.7，pricing 质量分 1.0
    Evidence pricing = evidence("p", "pricing", 0.9);

    assertThat(reranker.compositeScore(pricing))
      .isCloseTo(0.6 * 0.9 + 0.2 * 0.7 + 0.2 * 1.0, offset(1e-9));
  }

  @Test
  void shouldUseDefaultQualityForUnknownType() {
    assertThat(reranker.quality("whitepaper")).isEqualTo(0.7);
    assertThat(reranker.quality(null)).isEqualTo(0.7);
    assertThat(reranker.quality("SOP")).isEqualTo(0.95);
  }

  @Test
  void shouldDecayRecencyByAge() {
    Map<String, Object> fresh = new HashMap<>();
    fresh.put(MetadataKeys.UPDATED_AT, NOW.toString());
    Map<String, Object> old = new HashMap<>();
    old.put(MetadataKeys.UPDATED_AT, "2024-03-03");
    Map<String, Object> future = new HashMap<>();
    future.put(MetadataKeys.UPDATED_AT, "2025-01-01T00:00:00Z");
    Map<String, Object> broken = new HashMap<>();
    broken.put(MetadataKeys.UPDATED_AT, "yesterday");

    assertThat(reranker.recency(fresh)).isEqualTo(1.0);
    assertThat(reranker.recency(old)).isCloseTo(Math.exp(-90 / 90.0), offset(1e-9));
    assertThat(reranker.recency(future)).isEqualTo(1.0);
    assertThat(reranker.recency(broken)).isEqualTo(0.7);
    assertThat(reranker.recency(Map.of())).isEqualTo(0.7);
  }

  @Test
  void shouldSortDescendingAndKeepInputOrderOnTies() {
    List<Evidence> list = new ArrayList<>(List.of(
      evidence("a", "faq", 0.5),
      evidence("b", "faq", 0.9),
      evidence("c", "faq", 0.5)));

    List<Evidence> ranked = reranker.rerank(list);

    assertThat(ranked).extracting(Evidence::getSourceId).containsExactly("b", "a", "c");
    for (int i = 1; i < ranked.size(); i++) {
      assertThat(ranked.get(i - 1).getScore()).isGreaterThanOrEqualTo(ranked.get(i).getScore());
    }
  }

  @Test
  void shouldBeIdempotent() {
    List<Evidence> list = new ArrayList<>(List.of(
      evidence("a", "general", 0.8),
      evidence("b", "pricing", 0.7),
      evidence("c", "faq", 0.75)));

    List<Evidence> once = Evidence.copyAll(reranker.rerank(list));
    List<Evidence> twice = reranker.rerank(list);

    assertThat(twice).extracting(Evidence::getSourceId)
      .containsExactlyElementsOf(once.stream().map(Evidence::getSourceId).toList());
    assertThat(twice).extracting(Evidence::getScore)
      .containsExactlyElementsOf(once.stream().map(Evidence::getScore).toList());
  }

  @Test
  void shouldReturnEmptyForEmptyInput() {
    assertThat(reranker.rerank(new ArrayList<>())).isEmpty();
  }

  @Test
  void shouldFilterBelowThresholdInclusive() {
    List<Evidence> list = List.of(scored("faq", 0.6), scored("faq", 0.59), scored("faq", 0.9));

    List<Evidence> kept = reranker.filterLowQuality(list, 0.6);

    assertThat(kept).extracting(Evidence::getScore).containsExactly(0.6, 0.9);
    assertThat(list).hasSize(3);
  }

  @Test
  void shouldDetectPricingConflictBySpread() {
    assertThat(reranker.detectConflicts(List.of(scored("pricing", 0.9), scored("pricing", 0.5))))
      .isTrue();
    assertThat(reranker.detectConflicts(List.of(scored("pricing", 0.9), scored("pricing", 0.7))))
      .isFalse();
  }

  @Test
  void shouldIgnoreNonConflictTypesAndSingletons() {
    assertThat(reranker.detectConflicts(List.of(scored("faq", 0.95), scored("faq", 0.1))))
      .isFalse();
    assertThat(reranker.detectConflicts(List.of(scored("policy", 0.9), scored("pricing", 0.1))))
      .isFalse();
    assertThat(reranker.detectConflicts(List.of())).isFalse();
  }
}
