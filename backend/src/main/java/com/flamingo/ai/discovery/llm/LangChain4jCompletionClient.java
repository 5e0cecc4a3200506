package com.flamingo.ai.discovery.llm;

import com.flamingo.ai.discovery.config.DiscoveryConfig;
import com.flamingo.ai.discovery.exception.LlmServiceException;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** {@link LlmCompletionClient} on a LangChain4j {@link ChatModel} with JSON mode always on. */
@Component
@RequiredArgsConstructor
@Slf4j
public class LangChain4jCompletionClient implements LlmCompletionClient {

  private final ChatModel chatModel;
  private final DiscoveryConfig discoveryConfig;

  @Override
  @Timed(value = "discovery.llm.completion", description = "Time for one LLM completion call")
  @Retry(name = "llm")
  public LlmCompletionResponse complete(LlmCompletionRequest request) {
    ChatRequest chatRequest =
        ChatRequest.builder()
            .messages(toChatMessages(request.messages()))
            .modelName(request.model())
            .temperature(request.temperature())
            .maxOutputTokens(request.maxTokens())
            .responseFormat(responseFormat(request))
            .build();

    long start = System.currentTimeMillis();
    ChatResponse response;
    try {
      response = chatModel.chat(chatRequest);
    } catch (RateLimitException e) {
      log.warn("LLM provider rate limited model {}: {}", request.model(), e.getMessage());
      throw new LlmServiceException("LLM rate limit exceeded", e, true);
    } catch (RuntimeException e) {
      log.error("LLM completion failed for model {}: {}", request.model(), e.getMessage());
      throw new LlmServiceException("LLM completion failed: " + e.getMessage(), e);
    }
    long latencyMs = System.currentTimeMillis() - start;

    String content =
        response.aiMessage() != null && response.aiMessage().text() != null
            ? response.aiMessage().text()
            : "";
    String model = response.modelName() != null ? response.modelName() : request.model();
    log.debug(
        "LLM completion: model={}, latency={}ms, chars={}", model, latencyMs, content.length());
    return new LlmCompletionResponse(
        content,
        toUsage(response.tokenUsage()),
        latencyMs,
        model,
        discoveryConfig.getLlm().getProvider());
  }

  private ResponseFormat responseFormat(LlmCompletionRequest request) {
    if (request.responseSchema() == null) {
      return ResponseFormat.JSON;
    }
    return ResponseFormat.builder()
        .type(ResponseFormatType.JSON)
        .jsonSchema(request.responseSchema())
        .build();
  }

  private static List<ChatMessage> toChatMessages(List<LlmMessage> messages) {
    return messages.stream()
        .map(
            message ->
                message.role() == LlmMessage.Role.SYSTEM
                    ? (ChatMessage) SystemMessage.from(message.content())
                    : UserMessage.from(message.content()))
        .toList();
  }

  private static LlmUsage toUsage(TokenUsage tokenUsage) {
    if (tokenUsage == null) {
      return LlmUsage.unknown();
    }
    return new LlmUsage(
        tokenUsage.inputTokenCount(), tokenUsage.outputTokenCount(), tokenUsage.totalTokenCount());
  }
}
