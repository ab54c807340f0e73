package com.github.spud.leadagent.domain.llm;

/**
 * 文本生成结果：成功时携带文本，失败时携带错误信息
 */
public record GenerationResult(boolean success, String text, String error) {

  public static GenerationResult ok(String text) {
    return new GenerationResult(true, text, null);
  }

  public static GenerationResult failed(String error) {
    return new GenerationResult(false, null, error);
  }
}
