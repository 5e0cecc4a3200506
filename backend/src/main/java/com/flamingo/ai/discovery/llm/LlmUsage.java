package com.flamingo.ai.discovery.llm;

/** Token usage reported by the provider. Counts are null when the provider did not report them. */
public record LlmUsage(Integer promptTokens, Integer completionTokens, Integer totalTokens) {

  public static LlmUsage unknown() {
    return new LlmUsage(null, null, null);
  }
}
