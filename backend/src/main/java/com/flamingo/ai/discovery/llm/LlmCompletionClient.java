package com.flamingo.ai.discovery.llm;

/**
 * Blocking chat completion against an LLM provider.
 *
 * <p>Implementations throw {@link com.flamingo.ai.discovery.exception.LlmServiceException} when the
 * provider cannot be reached or rejects the call. Parsing the returned content is the caller's job.
 */
public interface LlmCompletionClient {

  LlmCompletionResponse complete(LlmCompletionRequest request);
}
