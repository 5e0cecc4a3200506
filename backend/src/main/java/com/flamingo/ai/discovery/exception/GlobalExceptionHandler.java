package com.flamingo.ai.discovery.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(MissingIdentityException.class)
  public ResponseEntity<ApiError> handleMissingIdentity(
      MissingIdentityException ex, HttpServletRequest request) {

    incrementErrorCounter("identity_missing");
    String errorId = generateErrorId();
    log.warn("Missing identity [{}]: {}", errorId, ex.getMessage());

    return error(
        HttpStatus.UNAUTHORIZED, errorId, ApiError.IDENTITY_MISSING, ex.getMessage(), request);
  }

  @ExceptionHandler(CatalogAuthException.class)
  public ResponseEntity<ApiError> handleCatalogAuth(
      CatalogAuthException ex, HttpServletRequest request) {

    incrementErrorCounter("catalog_auth");
    String errorId = generateErrorId();
    log.warn("Catalog auth failed [{}]: {}", errorId, ex.getMessage());

    return error(
        HttpStatus.UNAUTHORIZED,
        errorId,
        ApiError.CATALOG_AUTH_FAILED,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(CatalogRateLimitException.class)
  public ResponseEntity<ApiError> handleCatalogRateLimit(
      CatalogRateLimitException ex, HttpServletRequest request) {

    incrementErrorCounter("catalog_rate_limited");
    String errorId = generateErrorId();
    log.warn("Catalog rate limited [{}]: retryAfter={}", errorId, ex.getRetryAfter());

    ResponseEntity.BodyBuilder builder = ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS);
    if (ex.getRetryAfter() != null) {
      builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfter().toSeconds()));
    }
    return builder.body(
        build(errorId, ApiError.CATALOG_RATE_LIMITED, ex.getUserMessage(), request));
  }

  @ExceptionHandler(CatalogException.class)
  public ResponseEntity<ApiError> handleCatalog(CatalogException ex, HttpServletRequest request) {

    incrementErrorCounter("catalog_error");
    String errorId = generateErrorId();
    log.error("Catalog error [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.BAD_GATEWAY, errorId, ApiError.CATALOG_ERROR, ex.getUserMessage(), request);
  }

  @ExceptionHandler(LlmServiceException.class)
  public ResponseEntity<ApiError> handleLlmService(
      LlmServiceException ex, HttpServletRequest request) {

    String errorType = ex.isRateLimited() ? "llm_rate_limited" : "llm_error";
    incrementErrorCounter(errorType);
    String errorId = generateErrorId();
    log.error("LLM service error [{}]: {}", errorId, ex.getMessage(), ex);

    String code = ex.isRateLimited() ? ApiError.LLM_RATE_LIMITED : ApiError.LLM_UNAVAILABLE;
    return error(HttpStatus.SERVICE_UNAVAILABLE, errorId, code, ex.getUserMessage(), request);
  }

  @ExceptionHandler(LlmResponseParseException.class)
  public ResponseEntity<ApiError> handleLlmParse(
      LlmResponseParseException ex, HttpServletRequest request) {

    incrementErrorCounter("llm_parse_error");
    String errorId = generateErrorId();
    log.error("LLM {} response unusable [{}]: {}", ex.getStage(), errorId, ex.getMessage());

    return error(
        HttpStatus.BAD_GATEWAY, errorId, ApiError.LLM_PARSE_ERROR, ex.getUserMessage(), request);
  }

  @ExceptionHandler(SearchResultExpiredException.class)
  public ResponseEntity<ApiError> handleResultExpired(
      SearchResultExpiredException ex, HttpServletRequest request) {

    incrementErrorCounter("result_expired");
    String errorId = generateErrorId();
    log.info("Search result expired [{}]: {}", errorId, ex.getSearchHash());

    return error(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.RESULT_EXPIRED,
        "Search result has expired",
        request);
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

    return error(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadable(
      HttpMessageNotReadableException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Unreadable request body [{}]: {}", errorId, ex.getMessage());

    return error(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.VALIDATION_ERROR,
        "Request body is missing or malformed",
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> error(
      HttpStatus status, String errorId, String code, String message, HttpServletRequest request) {
    return ResponseEntity.status(status).body(build(errorId, code, message, request));
  }

  private ApiError build(String errorId, String code, String message, HttpServletRequest request) {
    return ApiError.builder()
        .errorId(errorId)
        .code(code)
        .message(message)
        .path(request.getRequestURI())
        .timestamp(Instant.now())
        .build();
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
