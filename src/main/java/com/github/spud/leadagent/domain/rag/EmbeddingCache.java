package com.github.spud.leadagent.domain.rag;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * 查询向量缓存
 * <p>
 * 键为 模型名 + 规范化查询文本的 SHA-256，值为 float32 小端序的 Base64。Redis 读写失败只告警，按未命中处理；
 * 无法解码的条目会被删除。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EmbeddingCache {

  static final String KEY_PREFIX = "lead-agent:query-emb:";

  private final StringRedisTemplate redisTemplate;
  private final RagProperties ragProperties;

  public Optional<float[]> get(String query, String modelName) {
    String key = keyFor(query, modelName);
    String cached;
    try {
      cached = redisTemplate.opsForValue().get(key);
    } catch (Exception e) {
      log.warn("Embedding cache unavailable on read: {}", e.getMessage());
      return Optional.empty();
    }
    if (cached == null) {
      return Optional.empty();
    }

    float[] vector = decode(cached);
    if (vector == null) {
      log.warn("Dropping undecodable embedding cache entry: {}", key);
      evict(key);
      return Optional.empty();
    }
    log.debug("Embedding cache hit: model={}, dims={}", modelName, vector.length);
    return Optional.of(vector);
  }

  public void put(String query, String modelName, float[] vector) {
    if (vector == null || vector.length == 0) {
      return;
    }
    Duration ttl = Duration.ofSeconds(ragProperties.getCache().getEmbeddingTtl());
    try {
      redisTemplate.opsForValue().set(keyFor(query, modelName), encode(vector), ttl);
    } catch (Exception e) {
      log.warn("Embedding cache unavailable on write: {}", e.getMessage());
    }
  }

  private void evict(String key) {
    try {
      redisTemplate.delete(key);
    } catch (Exception e) {
      log.warn("Failed to evict embedding cache entry {}: {}", key, e.getMessage());
    }
  }

  /**
   * 首尾空白与连续空白不影响命中
   */
  static String normalize(String query) {
    return query == null ? "" : query.strip().replaceAll("\\s+", " ");
  }

  static String keyFor(String query, String modelName) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(normalize(query).getBytes(StandardCharsets.UTF_8));
      return KEY_PREFIX + modelName + ":" + HexFormat.of().formatHex(hash);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  static String encode(float[] vector) {
    ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES)
      .order(ByteOrder.LITTLE_ENDIAN);
    for (float v : vector) {
      buffer.putFloat(v);
    }
    return Base64.getEncoder().encodeToString(buffer.array());
  }

  /**
   * 解码失败返回 null
   */
  static float[] decode(String encoded) {
    byte[] bytes;
    try {
      bytes = Base64.getDecoder().decode(encoded);
    } catch (IllegalArgumentException e) {
      return null;
    }
    if (bytes.length == 0 || bytes.length % Float.BYTES != 0) {
      return null;
    }
    ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    float[] vector = new float[bytes.length / Float.BYTES];
    for (int i = 0; i < vector.length; i++) {
      vector[i] = buffer.getFloat();
    }
    return vector;
  }
}
