package com.flamingo.ai.constitution.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(ContentNotFoundException.class)
  public ResponseEntity<ApiError> handleContentNotFound(
      ContentNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("content_not_found");
    String errorId = generateErrorId();
    log.warn("Content not found [{}]: {} {}", errorId, ex.getContentType(), ex.getReference());

    return build(HttpStatus.NOT_FOUND, errorId, ApiError.CONTENT_NOT_FOUND, ex, request);
  }

  @ExceptionHandler(InvalidQueryException.class)
  public ResponseEntity<ApiError> handleInvalidQuery(
      InvalidQueryException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_query");
    String errorId = generateErrorId();
    log.warn("Invalid query [{}]: {}", errorId, ex.getMessage());

    return build(HttpStatus.BAD_REQUEST, errorId, ApiError.INVALID_QUERY, ex, request);
  }

  @ExceptionHandler(SourceUnavailableException.class)
  public ResponseEntity<ApiError> handleSourceUnavailable(
      SourceUnavailableException ex, HttpServletRequest request) {

    incrementErrorCounter("source_unavailable");
    String errorId = generateErrorId();
    log.error("Constitution source unavailable [{}]: {}", errorId, ex.getMessage(), ex);

    return build(HttpStatus.SERVICE_UNAVAILABLE, errorId, ApiError.SOURCE_UNAVAILABLE, ex, request);
  }

  @ExceptionHandler({
    MissingServletRequestParameterException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ApiError> handleBadParameter(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Validation error [{}]: {}", errorId, ex.getMessage());

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.VALIDATION_ERROR)
                .kind(ErrorKind.INVALID_QUERY)
                .message(ex.getMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.INTERNAL_ERROR)
                .message("An unexpected error occurred. Please try again later.")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status,
      String errorId,
      String code,
      ConstitutionException ex,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .kind(ex.getKind())
                .message(ex.getUserMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
