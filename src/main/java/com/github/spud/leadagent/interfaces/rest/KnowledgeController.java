package com.github.spud.leadagent.interfaces.rest;

import com.github.spud.leadagent.domain.rag.KnowledgeIngestService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 知识库维护接口：文本 / 文件 / 目录摄取，计数与清空
 */
@Slf4j
@RestController
@RequestMapping("/agent/knowledge")
@RequiredArgsConstructor
public class KnowledgeController {

  private final KnowledgeIngestService knowledgeIngestService;

  @PostMapping("/ingest/text")
  public Mono<ResponseEntity<IngestResponse>> ingestText(@Valid @RequestBody IngestText request) {
    return blocking(() -> {
      int chunks = knowledgeIngestService.ingestText(request.content(), request.metadata());
      return ingested(chunks, "inline text");
    });
  }

  /**
   * 单个 .txt / .md 文件
   */
  @PostMapping("/ingest/file")
  public Mono<ResponseEntity<IngestResponse>> ingestFile(@Valid @RequestBody IngestPath request) {
    return blocking(() -> {
      Path file = Path.of(request.path());
      if (!Files.isRegularFile(file)) {
        return ResponseEntity.badRequest().body(IngestResponse.rejected("Not a file: " + file));
      }
      return ingested(knowledgeIngestService.ingestFile(file), file.toString());
    });
  }

  /**
   * 递归摄取目录，单个文件失败不影响其余文件
   */
  @PostMapping("/ingest/directory")
  public Mono<ResponseEntity<IngestResponse>> ingestDirectory(
    @Valid @RequestBody IngestPath request) {
    return blocking(() -> {
      Path directory = Path.of(request.path());
      if (!Files.isDirectory(directory)) {
        return ResponseEntity.badRequest()
          .body(IngestResponse.rejected("Not a directory: " + directory));
      }
      return ingested(knowledgeIngestService.ingestDirectory(directory), directory.toString());
    });
  }

  @GetMapping("/count")
  public Mono<ResponseEntity<Map<String, Long>>> count() {
    return blocking(() -> ResponseEntity.ok(Map.of("count", knowledgeIngestService.count())));
  }

  @DeleteMapping
  public Mono<ResponseEntity<Map<String, Long>>> clear() {
    return blocking(() -> {
      long before = knowledgeIngestService.count();
      knowledgeIngestService.clear();
      log.warn("Knowledge base cleared: removedChunks={}", before);
      return ResponseEntity.ok(Map.of("removed", before));
    });
  }

  private static ResponseEntity<IngestResponse> ingested(int chunks, String source) {
    log.info("Ingested {} chunks from {}", chunks, source);
    return ResponseEntity.ok(
      new IngestResponse(true, chunks, "Ingested " + chunks + " chunks from " + source));
  }

  private static <T> Mono<T> blocking(Callable<T> work) {
    return Mono.fromCallable(work).subscribeOn(Schedulers.boundedElastic());
  }

  public record IngestText(@NotBlank String content, Map<String, Object> metadata) {

  }

  public record IngestPath(@NotBlank String path) {

  }

  public record IngestResponse(boolean success, int chunks, String message) {

    static IngestResponse rejected(String reason) {
      return new IngestResponse(false, 0, reason);
    }
  }
}
