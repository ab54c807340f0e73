package com.github.spud.leadagent.domain.rag;

import com.github.spud.leadagent.domain.kernel.ConversationTurn;
import com.github.spud.leadagent.domain.rag.KnowledgeStore.VectorHit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 证据检索服务
 * <p>
 * 检索知识库并转换为 {@link Evidence}。任何检索异常都降级为空结果，不中断流水线。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EvidenceRetriever {

  static final String DEFAULT_TITLE = "unknown";
  static final String DEFAULT_TYPE = "general";

  private final KnowledgeStore knowledgeStore;
  private final RagProperties ragProperties;

  public List<Evidence> retrieve(String query, int topK) {
    return retrieve(query, topK, null, null);
  }

  /**
   * 检索证据，docType 与 metadataFilter 合并为元数据过滤条件
   */
  public List<Evidence> retrieve(String query, int topK, String docType,
    Map<String, Object> metadataFilter) {
    Map<String, Object> where = new HashMap<>();
    if (metadataFilter != null) {
      where.putAll(metadataFilter);
    }
    if (docType != null) {
      where.put(MetadataKeys.DOC_TYPE, docType);
    }

    try {
      List<VectorHit> hits = knowledgeStore.query(query, topK, where.isEmpty() ? null : where);

      List<Evidence> evidence = hits.stream()
        .map(this::toEvidence)
        .collect(Collectors.toList());
      log.info("Retrieved {} evidence for query '{}'", evidence.size(), truncate(query, 80));
      return evidence;
    } catch (Exception e) {
      log.warn("Retrieval failed, degrading to empty evidence: {}", e.getMessage(), e);
      return new ArrayList<>();
    }
  }

  /**
   * 携带最近对话上下文检索，提升追问场景的召回
   */
  public List<Evidence> retrieveWithContext(String query, List<ConversationTurn> history,
    int topK) {
    if (history == null || history.isEmpty()) {
      return retrieve(query, topK);
    }
    int turns = ragProperties.getContextTurns();
    String context = history.subList(Math.max(0, history.size() - turns), history.size())
      .stream()
      .map(ConversationTurn::content)
      .collect(Collectors.joining(" "));
    return retrieve(context + "\n\nCurrent query: " + query, topK);
  }

  /**
   * 按文档类型分别检索，每类取配置的 top-k-per-type 条
   */
  public List<Evidence> retrieveByDocType(String query, List<String> docTypes) {
    return retrieveByDocType(query, docTypes, ragProperties.getTopKPerType());
  }

  /**
   * 按文档类型分别检索，结果按类型顺序拼接
   */
  public List<Evidence> retrieveByDocType(String query, List<String> docTypes,
    int topKPerType) {
    List<Evidence> all = new ArrayList<>();
    for (String docType : docTypes) {
      all.addAll(retrieve(query, topKPerType, docType, null));
    }
    return all;
  }

  Evidence toEvidence(VectorHit hit) {
    Map<String, Object> metadata = hit.metadata() != null
      ? new HashMap<>(hit.metadata()) : new HashMap<>();
    double similarity = hit.similarity();

    return Evidence.builder()
      .sourceId(hit.id())
      .docTitle(stringValue(metadata, MetadataKeys.DOC_TITLE, DEFAULT_TITLE))
      .docType(stringValue(metadata, MetadataKeys.DOC_TYPE, DEFAULT_TYPE))
      .chunkText(hit.document())
      .similarity(similarity)
      .score(similarity)
      .chunkIndex(intValue(metadata.get(MetadataKeys.CHUNK_INDEX)))
      .sourceFile(stringValue(metadata, MetadataKeys.SOURCE_FILE, DEFAULT_TITLE))
      .metadata(metadata)
      .build();
  }

  private static String stringValue(Map<String, Object> metadata, String key, String fallback) {
    Object value = metadata.get(key);
    return value != null ? value.toString() : fallback;
  }

  private static int intValue(Object value) {
    if (value instanceof Number number) {
      return number.intValue();
    }
    if (value != null) {
      try {
        return Integer.parseInt(value.toString());
      } catch (NumberFormatException e) {
        log.debug("Invalid chunk_index '{}', using 0", value);
      }
    }
    return 0;
  }

  private static String truncate(String text, int maxLen) {
    if (text == null) {
      return "";
    }
    return text.length() > maxLen ? text.substring(0, maxLen) + "..." : text;
  }
}
