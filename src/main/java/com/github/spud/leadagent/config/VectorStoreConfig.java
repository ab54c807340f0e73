package com.github.spud.leadagent.config;

import com.github.spud.leadagent.domain.rag.CachingEmbeddingModel;
import com.github.spud.leadagent.domain.rag.EmbeddingCache;
import org.springframework.ai.embedding.BatchingStrategy;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.vectorstore.pgvector.PgVectorStore;
import org.springframework.ai.vectorstore.pgvector.autoconfigure.PgVectorStoreProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
public class VectorStoreConfig {

  /**
   * 知识库向量存储，查询向量经 Redis 缓存
   * <p>
   * 缓存装饰器不注册为 Bean，避免顶替自动配置的 EmbeddingModel。
   */
  @Bean
  public PgVectorStore vectorStore(JdbcTemplate jdbcTemplate, EmbeddingModel embeddingModel,
    EmbeddingCache embeddingCache, PgVectorStoreProperties properties,
    BatchingStrategy batchingStrategy,
    @Value("${app.rag.embedding-model-name:default}") String modelName) {
    return PgVectorStore.builder(jdbcTemplate,
        new CachingEmbeddingModel(embeddingModel, embeddingCache, modelName))
      .schemaName(properties.getSchemaName())
      .vectorTableName(properties.getTableName())
      .dimensions(properties.getDimensions())
      .distanceType(properties.getDistanceType())
      .indexType(properties.getIndexType())
      .initializeSchema(properties.isInitializeSchema())
      .batchingStrategy(batchingStrategy)
      .maxDocumentBatchSize(properties.getMaxDocumentBatchSize())
      .build();
  }
}
