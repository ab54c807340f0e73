package com.github.spud.leadagent.domain.rag;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.document.Document;
import org.springframework.ai.document.DocumentReader;
import org.springframework.ai.reader.TextReader;
import org.springframework.ai.transformer.splitter.TokenTextSplitter;
import org.springframework.core.io.FileSystemResource;
import org.springframework.stereotype.Service;

/**
 * 知识库摄取服务 负责文档加载、切分，并以确定性 id 写入向量库
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KnowledgeIngestService {

  static final String INLINE_SOURCE_PREFIX = "inline:";

  private final KnowledgeStore knowledgeStore;
  private final RagProperties ragProperties;

  /**
   * 摄取单个 .txt / .md 文件，文档类型由路径推断；其它扩展名抛出 IllegalArgumentException
   */
  public int ingestFile(Path filePath) throws IOException {
    if (!isTextFile(filePath.toString())) {
      throw new IllegalArgumentException(
        "Unsupported file type, only .txt and .md can be ingested: " + filePath);
    }
    log.info("Ingesting file: {}", filePath);

    DocumentReader reader = new TextReader(new FileSystemResource(filePath));
    Map<String, Object> metadata = fileMetadata(filePath);
    List<Document> documents = reader.get().stream()
      .map(doc -> new Document(doc.getText(), new HashMap<>(metadata)))
      .toList();

    return ingestDocuments(documents);
  }

  /**
   * 摄取目录下所有 .txt / .md 文件，单个文件失败不影响其余文件
   */
  public int ingestDirectory(Path directory) throws IOException {
    log.info("Ingesting directory: {}", directory);

    List<Path> files;
    try (Stream<Path> paths = Files.walk(directory)) {
      files = paths.filter(Files::isRegularFile)
        .filter(p -> isTextFile(p.toString()))
        .sorted()
        .toList();
    }

    int total = 0;
    for (Path file : files) {
      try {
        total += ingestFile(file);
      } catch (Exception e) {
        log.warn("Failed to ingest file: {} - {}", file, e.getMessage());
      }
    }

    log.info("Directory ingestion finished: files={}, chunks={}", files.size(), total);
    return total;
  }

  /**
   * 直接摄取文本内容
   */
  public int ingestText(String content, Map<String, Object> metadata) {
    if (content == null || content.isBlank()) {
      throw new IllegalArgumentException("Content must not be blank");
    }

    Map<String, Object> merged = new HashMap<>();
    if (metadata != null) {
      merged.putAll(metadata);
    }
    merged.putIfAbsent(MetadataKeys.SOURCE_FILE, INLINE_SOURCE_PREFIX
      + UUID.nameUUIDFromBytes(content.getBytes(StandardCharsets.UTF_8)));
    merged.putIfAbsent(MetadataKeys.DOC_TITLE, "inline");
    merged.putIfAbsent(MetadataKeys.DOC_TYPE, "general");
    merged.putIfAbsent(MetadataKeys.UPDATED_AT, Instant.now().toString());

    return ingestDocuments(List.of(new Document(content, merged)));
  }

  /**
   * 切分并写入，分块 id 为 source_file#chunk_index 的名字型 UUID，重复摄取会覆盖
   */
  public int ingestDocuments(List<Document> documents) {
    if (documents.isEmpty()) {
      log.warn("No documents to ingest");
      return 0;
    }

    TokenTextSplitter splitter = new TokenTextSplitter(
      ragProperties.getChunkSize(),
      ragProperties.getMinChunkChars(),
      5,
      10000,
      true
    );

    List<Document> chunks = new ArrayList<>();
    Map<String, Integer> indexBySource = new HashMap<>();
    for (Document split : splitter.apply(documents)) {
      Map<String, Object> metadata = new HashMap<>(split.getMetadata());
      String sourceFile = String.valueOf(
        metadata.getOrDefault(MetadataKeys.SOURCE_FILE, "unknown"));
      int chunkIndex = indexBySource.merge(sourceFile, 1, Integer::sum) - 1;
      metadata.put(MetadataKeys.CHUNK_INDEX, chunkIndex);
      chunks.add(new Document(chunkId(sourceFile, chunkIndex), split.getText(), metadata));
    }
    log.info("Split {} documents into {} chunks", documents.size(), chunks.size());

    knowledgeStore.add(chunks);
    log.info("Successfully ingested {} chunks into knowledge store", chunks.size());
    return chunks.size();
  }

  public long count() {
    return knowledgeStore.count();
  }

  public void clear() {
    log.warn("Clearing knowledge store");
    knowledgeStore.clear();
  }

  static String chunkId(String sourceFile, int chunkIndex) {
    return UUID.nameUUIDFromBytes((sourceFile + "#" + chunkIndex)
      .getBytes(StandardCharsets.UTF_8)).toString();
  }

  /**
   * 按路径片段推断文档类型
   */
  static String inferDocType(Path path) {
    String p = path.toString().toLowerCase(Locale.ROOT);
    if (p.contains("sops")) {
      return "sop";
    }
    if (p.contains("faqs")) {
      return "faq";
    }
    if (p.contains("pricing")) {
      return "pricing";
    }
    if (p.contains("policies")) {
      return "policy";
    }
    return "general";
  }

  private static Map<String, Object> fileMetadata(Path filePath) throws IOException {
    String fileName = filePath.getFileName().toString();
    int dot = fileName.lastIndexOf('.');
    Map<String, Object> metadata = new HashMap<>();
    metadata.put(MetadataKeys.SOURCE_FILE, filePath.toString());
    metadata.put(MetadataKeys.DOC_TITLE, dot > 0 ? fileName.substring(0, dot) : fileName);
    metadata.put(MetadataKeys.DOC_TYPE, inferDocType(filePath));
    metadata.put(MetadataKeys.UPDATED_AT,
      Files.getLastModifiedTime(filePath).toInstant().toString());
    return metadata;
  }

  private static boolean isTextFile(String filename) {
    String lower = filename.toLowerCase(Locale.ROOT);
    return lower.endsWith(".txt") || lower.endsWith(".md");
  }
}
