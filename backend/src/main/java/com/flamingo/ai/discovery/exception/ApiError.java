package com.flamingo.ai.discovery.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String IDENTITY_MISSING = "AUTH_001";
  public static final String CATALOG_AUTH_FAILED = "CATALOG_001";
  public static final String CATALOG_RATE_LIMITED = "CATALOG_002";
  public static final String CATALOG_ERROR = "CATALOG_003";
  public static final String LLM_UNAVAILABLE = "LLM_001";
  public static final String LLM_RATE_LIMITED = "LLM_002";
  public static final String LLM_PARSE_ERROR = "LLM_003";
  public static final String RESULT_EXPIRED = "RESULT_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
