package com.flamingo.ai.discovery.exception;

/** Exception thrown when the catalog rejects the caller's access credential. */
public class CatalogAuthException extends CatalogException {

  public CatalogAuthException(String message) {
    super(message, 401, "Authentication failed. Please log in again.");
  }
}
