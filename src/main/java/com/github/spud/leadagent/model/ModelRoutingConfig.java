package com.github.spud.leadagent.model;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * 模型路由配置
 * <p>
 * provider 由 app.model.provider 指定（openai / ollama），需与 spring.ai.model.chat、spring.ai.model.embedding
 * 保持一致，由 Spring AI 自动配置只创建对应的 ChatModel / EmbeddingModel。
 */
@Slf4j
@Configuration
public class ModelRoutingConfig {

  @Value("${app.model.provider:openai}")
  private String modelProvider;

  /**
   * 主 ChatClient，决策与回复生成共用
   */
  @Bean
  @Primary
  public ChatClient chatClient(ChatModel chatModel) {
    log.info("Using {} as primary chat model: {}", modelProvider,
      chatModel.getClass().getSimpleName());
    return ChatClient.builder(chatModel).build();
  }
}
