package com.flamingo.ai.discovery.exception;

/** Exception thrown when a completion call to the LLM provider fails. */
public class LlmServiceException extends RuntimeException {

  private final boolean rateLimited;
  private final String userMessage;

  public LlmServiceException(String message, Throwable cause) {
    this(message, cause, false);
  }

  public LlmServiceException(String message, Throwable cause, boolean rateLimited) {
    super(message, cause);
    this.rateLimited = rateLimited;
    this.userMessage =
        rateLimited
            ? "AI service is busy. Please try again in a moment."
            : "AI service request failed: " + rootMessage(cause);
  }

  public boolean isRateLimited() {
    return rateLimited;
  }

  public String getUserMessage() {
    return userMessage;
  }

  private static String rootMessage(Throwable cause) {
    if (cause == null || cause.getMessage() == null) {
      return "unknown provider error";
    }
    return cause.getMessage();
  }
}
