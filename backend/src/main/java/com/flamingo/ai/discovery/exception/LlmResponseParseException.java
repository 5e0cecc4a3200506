package com.flamingo.ai.discovery.exception;

/** Exception thrown when an LLM response holds no usable structure, even after lenient recovery. */
public class LlmResponseParseException extends RuntimeException {

  private final String stage;

  public LlmResponseParseException(String stage, String message) {
    super(message);
    this.stage = stage;
  }

  /** Pipeline stage whose response could not be parsed, e.g. "selection". */
  public String getStage() {
    return stage;
  }

  public String getUserMessage() {
    return "Playlist " + stage + " response parsing failed: " + getMessage();
  }
}
