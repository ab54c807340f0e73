package com.github.spud.leadagent.interfaces.rest;

import com.github.spud.leadagent.domain.memory.LeadMemoryService.LeadNotFoundException;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

/**
 * 统一错误响应：{code, message, timestamp, details}
 * <p>
 * 流水线自身不会抛出到这里，只有线索查询、请求校验和知识库接口的异常会落到此处。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @Data
  @Builder
  public static class ErrorResponse {

    private String code;
    private String message;
    private OffsetDateTime timestamp;
    private Map<String, Object> details;
  }

  @ExceptionHandler(LeadNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleLeadNotFound(LeadNotFoundException e) {
    log.info("Lead lookup failed: {}", e.getMessage());
    return respond(HttpStatus.NOT_FOUND, "LEAD_NOT_FOUND", e.getMessage(), null);
  }

  /**
   * 请求体字段校验失败，按字段汇总，同一字段只保留第一条
   */
  @ExceptionHandler(WebExchangeBindException.class)
  public ResponseEntity<ErrorResponse> handleValidation(WebExchangeBindException e) {
    Map<String, String> fieldErrors = new LinkedHashMap<>();
    e.getBindingResult().getFieldErrors()
      .forEach(fe -> fieldErrors.putIfAbsent(fe.getField(), fe.getDefaultMessage()));
    return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Request validation failed",
      Map.of("fieldErrors", fieldErrors));
  }

  /**
   * 请求体无法解析（非法 JSON、类型不匹配等）
   */
  @ExceptionHandler(ServerWebInputException.class)
  public ResponseEntity<ErrorResponse> handleUnreadableInput(ServerWebInputException e) {
    return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST",
      e.getReason() != null ? e.getReason() : "Malformed request", null);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
    return respond(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", e.getMessage(), null);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
    log.error("Unhandled exception in request", e);
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("exception", e.getClass().getSimpleName());
    if (e.getCause() != null && e.getCause().getMessage() != null) {
      details.put("cause", e.getCause().getMessage());
    }
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
      "An unexpected error occurred", details);
  }

  private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String code,
    String message, Map<String, Object> details) {
    return ResponseEntity.status(status).body(ErrorResponse.builder()
      .code(code)
      .message(message)
      .timestamp(OffsetDateTime.now())
      .details(details)
      .build());
  }
}
