package com.github.spud.leadagent.infrastructure.vector;

import com.github.spud.leadagent.domain.rag.KnowledgeStore;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.document.Document;
import org.springframework.ai.document.DocumentMetadata;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.ai.vectorstore.filter.Filter;
import org.springframework.ai.vectorstore.filter.FilterExpressionBuilder;
import org.springframework.ai.vectorstore.filter.FilterExpressionBuilder.Op;
import org.springframework.ai.vectorstore.pgvector.autoconfigure.PgVectorStoreProperties;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * 基于 pgvector 的知识库存储
 * <p>
 * 写入、删除与相似度检索走 Spring AI {@link VectorStore}；{@link VectorStore} 没有计数与清空，这两项直接访问同一张表。
 */
@Slf4j
@Component
public class PgVectorKnowledgeStore implements KnowledgeStore {

  static final String DISTANCE_KEY = DocumentMetadata.DISTANCE.value();

  private final VectorStore vectorStore;
  private final JdbcTemplate jdbcTemplate;
  private final String tableName;

  public PgVectorKnowledgeStore(VectorStore vectorStore, JdbcTemplate jdbcTemplate,
    PgVectorStoreProperties properties) {
    this.vectorStore = vectorStore;
    this.jdbcTemplate = jdbcTemplate;
    this.tableName = properties.getSchemaName() + "." + properties.getTableName();
  }

  @Override
  public void add(List<Document> documents) {
    if (documents.isEmpty()) {
      return;
    }
    vectorStore.add(documents);
    log.info("Added {} documents to {}", documents.size(), tableName);
  }

  @Override
  public List<VectorHit> query(String query, int n, Map<String, Object> where) {
    SearchRequest.Builder request = SearchRequest.builder().query(query).topK(n);
    Filter.Expression filter = filterOf(where);
    if (filter != null) {
      request.filterExpression(filter);
    }
    List<Document> documents = vectorStore.similaritySearch(request.build());
    if (documents == null) {
      return List.of();
    }
    return documents.stream().map(PgVectorKnowledgeStore::toHit).collect(Collectors.toList());
  }

  @Override
  public void delete(List<String> ids) {
    if (ids.isEmpty()) {
      return;
    }
    vectorStore.delete(ids);
    log.info("Deleted {} documents from {}", ids.size(), tableName);
  }

  @Override
  public long count() {
    Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + tableName, Long.class);
    return count != null ? count : 0L;
  }

  @Override
  public void clear() {
    int deleted = jdbcTemplate.update("DELETE FROM " + tableName);
    log.info("Cleared knowledge store {}: {} rows", tableName, deleted);
  }

  /**
   * 各条件按键名排序后以 AND 连接，空条件返回 null
   */
  static Filter.Expression filterOf(Map<String, Object> where) {
    if (where == null || where.isEmpty()) {
      return null;
    }
    FilterExpressionBuilder b = new FilterExpressionBuilder();
    Op combined = null;
    for (Map.Entry<String, Object> entry : new TreeMap<>(where).entrySet()) {
      Op eq = b.eq(entry.getKey(), entry.getValue());
      combined = combined == null ? eq : b.and(combined, eq);
    }
    return combined.build();
  }

  /**
   * 优先取文档分数，缺失时用 1 - distance
   */
  static VectorHit toHit(Document document) {
    Map<String, Object> metadata = new HashMap<>(document.getMetadata());
    Object distance = metadata.remove(DISTANCE_KEY);
    double similarity;
    if (document.getScore() != null) {
      similarity = document.getScore();
    } else if (distance instanceof Number number) {
      similarity = 1.0 - number.doubleValue();
    } else {
      similarity = 0.0;
    }
    return new VectorHit(document.getId(), document.getText(), metadata, similarity);
  }
}
