package com.flamingo.ai.discovery.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the LangChain4j chat model. The OpenAI client talks to any OpenAI-compatible
 * gateway, so the model id of each request selects the actual provider model.
 */
@Configuration
@RequiredArgsConstructor
public class LangChain4jConfig {

  private final DiscoveryConfig discoveryConfig;

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.base-url:https://openrouter.ai/api/v1}")
  private String baseUrl;

  @Value("${langchain4j.openai.chat-model.timeout:120s}")
  private Duration timeout;

  @Value("${langchain4j.openai.chat-model.log-requests:false}")
  private boolean logRequests;

  @Bean
  public ChatModel chatModel() {
    validateApiKey();

    // retries are owned by the resilience4j "llm" instance
    return OpenAiChatModel.builder()
        .baseUrl(baseUrl)
        .apiKey(openAiApiKey)
        .modelName(discoveryConfig.getLlm().getDefaultModel())
        .timeout(timeout)
        .maxRetries(0)
        .logRequests(logRequests)
        .logResponses(false)
        .build();
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "LLM API key is required. Set the LLM_API_KEY environment variable.");
    }
  }
}
