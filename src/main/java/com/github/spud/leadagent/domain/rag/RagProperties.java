package com.github.spud.leadagent.domain.rag;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * RAG 配置属性
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.rag")
public class RagProperties {

  /**
   * 检索返回的证据数量
   */
  private int topK = 8;

  /**
   * 按文档类型检索时每类返回数量
   */
  private int topKPerType = 3;

  /**
   * 携带上下文检索时拼接的历史轮数
   */
  private int contextTurns = 3;

  /**
   * 重排后保留证据的最低综合分
   */
  private double confidenceThreshold = 0.6;

  /**
   * 检测到证据冲突时对运行置信度的乘数
   */
  private double conflictPenalty = 0.7;

  /**
   * 文档切分大小（token）
   */
  private int chunkSize = 600;

  /**
   * 切分块最小字符数
   */
  private int minChunkChars = 100;

  /**
   * 重排配置
   */
  private Rerank rerank = new Rerank();

  /**
   * 缓存配置
   */
  private CacheConfig cache = new CacheConfig();

  @Data
  public static class Rerank {

    private double similarityWeight = 0.6;

    private double recencyWeight = 0.2;

    private double qualityWeight = 0.2;

    /**
     * 时效衰减常数（天），recency = exp(-days / decayDays)
     */
    private double recencyDecayDays = 90.0;

    /**
     * 缺失 updated_at 时的时效分
     */
    private double defaultRecency = 0.7;

    /**
     * 未知类型的质量分
     */
    private double defaultQuality = 0.7;

    /**
     * 同类证据分差超过该值视为冲突
     */
    private double conflictSpread = 0.3;

    /**
     * 参与冲突检测的文档类型
     */
    private List<String> conflictTypes = List.of("pricing", "policy");

    /**
     * 文档类型质量分
     */
    private Map<String, Double> qualityByType = defaultQualityByType();

    private static Map<String, Double> defaultQualityByType() {
      Map<String, Double> quality = new LinkedHashMap<>();
      quality.put("pricing", 1.0);
      quality.put("sop", 0.95);
      quality.put("procedure", 0.95);
      quality.put("policy", 0.9);
      quality.put("faq", 0.8);
      quality.put("general", 0.7);
      return quality;
    }
  }

  @Data
  public static class CacheConfig {

    /**
     * Embedding 缓存 TTL（秒）
     */
    private long embeddingTtl = 86400;
  }
}
