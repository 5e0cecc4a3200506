package com.flamingo.ai.discovery.exception;

/** Exception thrown when a cached discovery result is no longer available. */
public class SearchResultExpiredException extends RuntimeException {

  private final String searchHash;

  public SearchResultExpiredException(String searchHash) {
    super("Search result has expired: " + searchHash);
    this.searchHash = searchHash;
  }

  public String getSearchHash() {
    return searchHash;
  }
}
