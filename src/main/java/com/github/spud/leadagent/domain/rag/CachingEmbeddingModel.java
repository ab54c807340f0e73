package com.github.spud.leadagent.domain.rag;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.document.Document;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingRequest;
import org.springframework.ai.embedding.EmbeddingResponse;

/**
 * 查询向量缓存装饰器
 * <p>
 * 只缓存单条文本的 {@link #embed(String)}（检索查询走这里）；文档批量向量化直接透传给底层模型。
 */
@Slf4j
public class CachingEmbeddingModel implements EmbeddingModel {

  private final EmbeddingModel delegate;
  private final EmbeddingCache embeddingCache;
  private final String modelName;

  public CachingEmbeddingModel(EmbeddingModel delegate, EmbeddingCache embeddingCache,
    String modelName) {
    this.delegate = delegate;
    this.embeddingCache = embeddingCache;
    this.modelName = modelName;
  }

  @Override
  public float[] embed(String text) {
    return embeddingCache.get(text, modelName).orElseGet(() -> {
      float[] vector = delegate.embed(text);
      embeddingCache.put(text, modelName, vector);
      log.debug("Embedded query with model {}: dims={}", modelName, vector.length);
      return vector;
    });
  }

  @Override
  public float[] embed(Document document) {
    return delegate.embed(document);
  }

  @Override
  public EmbeddingResponse call(EmbeddingRequest request) {
    return delegate.call(request);
  }

  @Override
  public int dimensions() {
    return delegate.dimensions();
  }
}
