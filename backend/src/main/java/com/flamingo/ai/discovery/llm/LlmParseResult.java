package com.flamingo.ai.discovery.llm;

import java.util.Optional;

/**
 * Outcome of parsing an LLM response into a typed value.
 *
 * @param value the parsed value, null when {@code status} is {@link Status#FAILED}
 * @param detail what was wrong with the raw content, null for a strict parse
 */
public record LlmParseResult<T>(Status status, T value, String detail) {

  public enum Status {
    /** The content was a valid JSON object of the expected shape. */
    STRICT,
    /** The expected shape was only reached after lenient recovery. */
    RECOVERED,
    /** No usable structure was found. */
    FAILED
  }

  public static <T> LlmParseResult<T> strict(T value) {
    return new LlmParseResult<>(Status.STRICT, value, null);
  }

  public static <T> LlmParseResult<T> recovered(T value, String detail) {
    return new LlmParseResult<>(Status.RECOVERED, value, detail);
  }

  public static <T> LlmParseResult<T> failed(String detail) {
    return new LlmParseResult<>(Status.FAILED, null, detail);
  }

  public boolean isUsable() {
    return status != Status.FAILED;
  }

  public Optional<T> toOptional() {
    return Optional.ofNullable(value);
  }
}
