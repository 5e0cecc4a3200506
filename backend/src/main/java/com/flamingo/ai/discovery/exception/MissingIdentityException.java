package com.flamingo.ai.discovery.exception;

/** Exception thrown when a request arrives without the caller identity or catalog credential. */
public class MissingIdentityException extends RuntimeException {

  public MissingIdentityException(String message) {
    super(message);
  }
}
