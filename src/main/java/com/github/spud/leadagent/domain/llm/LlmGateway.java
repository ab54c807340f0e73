package com.github.spud.leadagent.domain.llm;

import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Component;

/**
 * 文本生成网关，单次阻塞调用，不做重试
 * <p>
 * 模型异常与空响应都转换为失败的 {@link GenerationResult}，不向调用方抛出。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmGateway {

  private final ChatClient chatClient;

  public GenerationResult generate(String prompt, String systemPrompt, double temperature,
    int maxTokens) {
    long startTime = System.currentTimeMillis();

    List<Message> messages = new ArrayList<>();
    if (systemPrompt != null && !systemPrompt.isBlank()) {
      messages.add(new SystemMessage(systemPrompt));
    }
    messages.add(new UserMessage(prompt));

    ChatOptions options = ChatOptions.builder()
      .temperature(temperature)
      .maxTokens(maxTokens)
      .build();

    try {
      ChatResponse response = chatClient.prompt(new Prompt(messages, options))
        .call()
        .chatResponse();

      if (response == null || response.getResult() == null
        || response.getResult().getOutput() == null) {
        return GenerationResult.failed("Empty response from model");
      }

      String text = response.getResult().getOutput().getText();
      if (text == null || text.isBlank()) {
        return GenerationResult.failed("Empty response from model");
      }

      log.debug("Generation completed in {}ms: temperature={}, length={}",
        System.currentTimeMillis() - startTime, temperature, text.length());
      return GenerationResult.ok(text.trim());

    } catch (Exception e) {
      log.error("Generation failed: {}", e.getMessage(), e);
      return GenerationResult.failed(e.getMessage() != null
        ? e.getMessage() : e.getClass().getSimpleName());
    }
  }
}
