package com.github.spud.leadagent.domain.rag;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Data;

/**
 * 检索得到的一段证据
 * <p>
 * similarity 为向量库返回的原始相似度，score 在重排后被综合分覆盖。
 */
@Data
@Builder(toBuilder = true)
public class Evidence {

  private String sourceId;

  private String docTitle;

  /**
   * 类型标签：pricing / sop / policy / faq / general
   */
  private String docType;

  private String chunkText;

  /**
   * 原始相似度（1 - distance）
   */
  private double similarity;

  /**
   * 当前得分，重排后为综合分
   */
  private double score;

  private int chunkIndex;

  private String sourceFile;

  @Builder.Default
  private Map<String, Object> metadata = new HashMap<>();

  @Builder.Default
  private Instant retrievedAt = Instant.now();

  /**
   * 引用格式：[标题 - 类型]
   */
  public String formatCitation() {
    return "[" + docTitle + " - " + docType + "]";
  }

  public boolean isHighQuality(double threshold) {
    return score >= threshold;
  }

  /**
   * 复制一份，用于保留原始检索结果
   */
  public Evidence copy() {
    return toBuilder().metadata(new HashMap<>(metadata)).build();
  }

  /**
   * 深拷贝列表
   */
  public static List<Evidence> copyAll(List<Evidence> evidence) {
    if (evidence == null) {
      return new ArrayList<>();
    }
    return evidence.stream().map(Evidence::copy).collect(Collectors.toList());
  }
}
