package com.github.spud.leadagent.domain.rag;

/**
 * 知识库分块元数据键
 */
public final class MetadataKeys {

  public static final String DOC_TITLE = "doc_title";
  public static final String DOC_TYPE = "doc_type";
  public static final String SOURCE_FILE = "source_file";
  public static final String CHUNK_INDEX = "chunk_index";
  public static final String UPDATED_AT = "updated_at";

  private MetadataKeys() {
  }
}
