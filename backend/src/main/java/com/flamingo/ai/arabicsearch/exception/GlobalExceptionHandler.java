package com.flamingo.ai.arabicsearch.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(SearchValidationException.class)
  public ResponseEntity<ApiError> handleSearchValidation(
      SearchValidationException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Invalid search request [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST, ApiError.VALIDATION_ERROR, ex.getMessage(), errorId, request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return build(HttpStatus.BAD_REQUEST, ApiError.VALIDATION_ERROR, message, errorId, request);
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiError> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    String message = ex.getName() + ": invalid value '" + ex.getValue() + "'";
    log.warn("Validation error [{}]: {}", errorId, message);

    return build(HttpStatus.BAD_REQUEST, ApiError.VALIDATION_ERROR, message, errorId, request);
  }

  @ExceptionHandler(ModeUnavailableException.class)
  public ResponseEntity<ApiError> handleModeUnavailable(
      ModeUnavailableException ex, HttpServletRequest request) {

    incrementErrorCounter("mode_unavailable");
    String errorId = generateErrorId();
    log.warn("Search mode unavailable [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        ApiError.MODE_UNAVAILABLE,
        "Search mode '" + ex.getMode().value() + "' is temporarily unavailable.",
        errorId,
        request);
  }

  @ExceptionHandler(ModelUnavailableException.class)
  public ResponseEntity<ApiError> handleModelUnavailable(
      ModelUnavailableException ex, HttpServletRequest request) {

    incrementErrorCounter("model_unavailable");
    String errorId = generateErrorId();
    log.warn("Embedding model unavailable [{}]: {}", errorId, ex.getReason());

    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        ApiError.MODEL_UNAVAILABLE,
        "The embedding model is not available.",
        errorId,
        request);
  }

  @ExceptionHandler(BackendUnavailableException.class)
  public ResponseEntity<ApiError> handleBackendUnavailable(
      BackendUnavailableException ex, HttpServletRequest request) {

    incrementErrorCounter("backend_unavailable");
    String errorId = generateErrorId();
    log.error("Search backend unavailable [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        ApiError.BACKEND_UNAVAILABLE,
        ex.getUserMessage(),
        errorId,
        request);
  }

  @ExceptionHandler(SearchException.class)
  public ResponseEntity<ApiError> handleSearch(SearchException ex, HttpServletRequest request) {

    incrementErrorCounter("search_error");
    String errorId = generateErrorId();
    log.error("Search error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.BAD_GATEWAY, ApiError.SEARCH_FAILED, ex.getUserMessage(), errorId, request);
  }

  @ExceptionHandler(IndexingAlreadyRunningException.class)
  public ResponseEntity<ApiError> handleIndexingRunning(
      IndexingAlreadyRunningException ex, HttpServletRequest request) {

    incrementErrorCounter("indexing_in_progress");
    String errorId = generateErrorId();
    log.warn("Indexing request rejected [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.CONFLICT, ApiError.INDEXING_IN_PROGRESS, ex.getMessage(), errorId, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        errorId,
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status, String code, String message, String errorId, HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
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
