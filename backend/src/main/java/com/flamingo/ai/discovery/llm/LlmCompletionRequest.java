package com.flamingo.ai.discovery.llm;

import dev.langchain4j.model.chat.request.json.JsonSchema;
import java.util.List;

/**
 * A single JSON-mode completion request.
 *
 * @param responseSchema optional schema attached to the request, null for plain JSON mode
 */
public record LlmCompletionRequest(
    String model,
    List<LlmMessage> messages,
    JsonSchema responseSchema,
    double temperature,
    int maxTokens) {

  public LlmCompletionRequest {
    messages = messages == null ? List.of() : List.copyOf(messages);
  }
}
