package com.curriculum.insight.exception;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @Value("${app.environment:production}")
  private String environment;

  @Value("${app.debug.enabled:false}")
  private boolean debugEnabled;

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
      IllegalArgumentException ex, WebRequest request) {
    log.warn("Rejected request: {}", ex.getMessage());
    return respond(errorBody(HttpStatus.BAD_REQUEST, ex.getMessage(), request));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidationExceptions(
      MethodArgumentNotValidException ex, WebRequest request) {
    Map<String, String> errors = new LinkedHashMap<>();
    for (ObjectError error : ex.getBindingResult().getAllErrors()) {
      String field =
          error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
      errors.putIfAbsent(field, error.getDefaultMessage());
    }
    log.warn("Validation failed: {}", errors);
    return respond(
        errorBody(HttpStatus.BAD_REQUEST, "Invalid request data", request)
            .error("Validation Failed")
            .validationErrors(errors));
  }

  @ExceptionHandler(ResourceNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
      ResourceNotFoundException ex, WebRequest request) {
    log.warn("Resource not found: {}", ex.getMessage());
    return respond(errorBody(HttpStatus.NOT_FOUND, ex.getMessage(), request));
  }

  @ExceptionHandler(RetrievalFailedException.class)
  public ResponseEntity<ErrorResponse> handleRetrievalFailed(
      RetrievalFailedException ex, WebRequest request) {
    log.error("Retrieval failed [operation={}]: {}", ex.getOperation(), ex.getMessage());
    return respond(errorBody(statusForCause(ex.getCause()), ex.getMessage(), request));
  }

  @ExceptionHandler(BenchmarkFailedException.class)
  public ResponseEntity<ErrorResponse> handleBenchmarkFailed(
      BenchmarkFailedException ex, WebRequest request) {
    log.error("Benchmark failed [programId={}]: {}", ex.getProgramId(), ex.getMessage());
    return respond(errorBody(statusForCause(ex.getCause()), ex.getMessage(), request));
  }

  @ExceptionHandler(EmbeddingException.class)
  public ResponseEntity<ErrorResponse> handleEmbeddingException(
      EmbeddingException ex, WebRequest request) {
    log.error("Embedding provider failure [{}]: {}", ex.getReason(), ex.getMessage());
    return respond(errorBody(statusForCause(ex), ex.getMessage(), request));
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<ErrorResponse> handleNoResourceFound(
      NoResourceFoundException ex, WebRequest request) {
    log.debug("No handler for {}", ex.getResourcePath());
    String message = "No endpoint at /" + ex.getResourcePath();
    return respond(errorBody(HttpStatus.NOT_FOUND, message, request));
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ErrorResponse> handleHttpRequestMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, WebRequest request) {
    String message = String.format("Request method '%s' is not supported", ex.getMethod());
    return respond(errorBody(HttpStatus.METHOD_NOT_ALLOWED, message, request));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
      HttpMessageNotReadableException ex, WebRequest request) {
    log.warn("Unreadable request body: {}", ex.getMessage());
    return respond(errorBody(HttpStatus.BAD_REQUEST, "Malformed JSON request", request));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGlobalException(Exception ex, WebRequest request) {
    log.error("Unexpected error occurred", ex);
    ErrorResponse.ErrorResponseBuilder body =
        errorBody(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", request);
    if (debugEnabled && !"production".equals(environment)) {
      body.debugMessage(ex.getMessage());
    }
    return respond(body);
  }

  /** Rate limits and timeouts from the embedding provider are surfaced distinctly. */
  static HttpStatus statusForCause(Throwable cause) {
    for (Throwable current = cause; current != null; current = current.getCause()) {
      if (current instanceof EmbeddingException) {
        EmbeddingException embeddingException = (EmbeddingException) current;
        if (embeddingException.isRateLimited()) {
          return HttpStatus.TOO_MANY_REQUESTS;
        }
        return embeddingException.isTimeout() ? HttpStatus.GATEWAY_TIMEOUT : HttpStatus.BAD_GATEWAY;
      }
    }
    return HttpStatus.INTERNAL_SERVER_ERROR;
  }

  private static ErrorResponse.ErrorResponseBuilder errorBody(
      HttpStatus status, String message, WebRequest request) {
    return ErrorResponse.builder()
        .timestamp(LocalDateTime.now())
        .status(status.value())
        .error(status.getReasonPhrase())
        .message(message)
        .path(request.getDescription(false).replace("uri=", ""));
  }

  private static ResponseEntity<ErrorResponse> respond(ErrorResponse.ErrorResponseBuilder body) {
    ErrorResponse response = body.build();
    return ResponseEntity.status(response.getStatus()).body(response);
  }

  /** Standard error response structure */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @Schema(description = "Standard error response")
  public static class ErrorResponse {
    private LocalDateTime timestamp;
    private int status;
    private String error;
    private String message;
    private String path;
    private Map<String, String> validationErrors;
    private String debugMessage;

    public Map<String, String> getValidationErrors() {
      return validationErrors == null ? null : Collections.unmodifiableMap(validationErrors);
    }
  }
}
