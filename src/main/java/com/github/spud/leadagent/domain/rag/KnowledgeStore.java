package com.github.spud.leadagent.domain.rag;

import java.util.List;
import java.util.Map;
import org.springframework.ai.document.Document;

/**
 * 知识库向量存储
 */
public interface KnowledgeStore {

  /**
   * 写入文档（id / 文本 / 元数据），已存在的 id 会被覆盖
   */
  void add(List<Document> documents);

  /**
   * 相似度检索最相近的 n 条记录，where 为元数据等值过滤条件，可为空
   */
  List<VectorHit> query(String query, int n, Map<String, Object> where);

  void delete(List<String> ids);

  long count();

  void clear();

  /**
   * 一条检索结果，similarity 为 1 - 距离，越大越相似
   */
  record VectorHit(String id, String document, Map<String, Object> metadata, double similarity) {

  }
}
