package com.flamingo.ai.discovery.exception;

import java.time.Duration;

/** Exception thrown when the catalog answers 429. */
public class CatalogRateLimitException extends CatalogException {

  private final Duration retryAfter;

  public CatalogRateLimitException(String message, Duration retryAfter) {
    super(message, 429, "Rate limit exceeded. Please try again later.");
    this.retryAfter = retryAfter;
  }

  /** Upstream Retry-After hint, or null when none was sent. */
  public Duration getRetryAfter() {
    return retryAfter;
  }
}
