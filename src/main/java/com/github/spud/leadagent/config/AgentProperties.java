package com.github.spud.leadagent.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 线索 Agent 配置属性
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.agent")
public class AgentProperties {

  /**
   * 置信度阈值
   */
  private Confidence confidence = new Confidence();

  /**
   * 决策阶段的生成参数（低温度，用于分类）
   */
  private Generation decision = new Generation(0.3, 500, 5);

  /**
   * 回复生成阶段的生成参数
   */
  private Generation compose = new Generation(0.7, 500, 3);

  /**
   * 回复中引用的证据条数上限
   */
  private int evidenceLimit = 3;

  /**
   * 加载上下文时读取的历史交互条数
   */
  private int historyLimit = 10;

  /**
   * 敏感话题关键词，命中即转人工
   */
  private List<String> sensitiveTopics = new ArrayList<>();

  /**
   * 工具重试策略
   */
  private RetryConfig retry = new RetryConfig();

  /**
   * 跟进任务配置
   */
  private FollowupConfig followup = new FollowupConfig();

  @Data
  public static class Confidence {

    private double highThreshold = 0.75;

    private double lowThreshold = 0.5;
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Generation {

    private double temperature;

    private int maxTokens;

    /**
     * 提示词中携带的最近对话轮数
     */
    private int historyWindow;
  }

  @Data
  public static class RetryConfig {

    /**
     * 总尝试次数（含首次）
     */
    private int maxAttempts = 4;

    private Duration initialInterval = Duration.ofMillis(200);

    private double multiplier = 2.0;
  }

  @Data
  public static class FollowupConfig {

    private boolean enabled = false;

    /**
     * 到期检查周期
     */
    private Duration checkInterval = Duration.ofMinutes(30);

    /**
     * 下一次跟进的间隔天数
     */
    private int intervalDays = 7;

    /**
     * 单批处理的线索数量上限
     */
    private int batchSize = 50;
  }
}
