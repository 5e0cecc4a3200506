package com.flamingo.ai.discovery.exception;

/** Exception thrown when the music catalog API fails for a reason other than auth or rate limit. */
public class CatalogException extends RuntimeException {

  private final int status;
  private final String userMessage;

  public CatalogException(String message, int status) {
    super(message);
    this.status = status;
    this.userMessage = "Music catalog is temporarily unavailable. Please try again.";
  }

  public CatalogException(String message, Throwable cause) {
    super(message, cause);
    this.status = 0;
    this.userMessage = "Music catalog is temporarily unavailable. Please try again.";
  }

  protected CatalogException(String message, int status, String userMessage) {
    super(message);
    this.status = status;
    this.userMessage = userMessage;
  }

  /** Upstream HTTP status, or 0 when no response was received. */
  public int getStatus() {
    return status;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
