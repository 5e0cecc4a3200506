package com.flamingo.ai.discovery.llm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.discovery.config.DiscoveryConfig;
import com.flamingo.ai.discovery.exception.LlmServiceException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LangChain4jCompletionClientTest {

  @Mock private ChatModel chatModel;
  @Captor private ArgumentCaptor<ChatRequest> requestCaptor;

  private LangChain4jCompletionClient client;

  @BeforeEach
  void setUp() {
    client = new LangChain4jCompletionClient(chatModel, new DiscoveryConfig());
  }

  private static LlmCompletionRequest request(JsonSchema schema) {
    return new LlmCompletionRequest(
        "google/gemini-2.5-flash",
        List.of(LlmMessage.system("sys"), LlmMessage.user("hello")),
        schema,
        0.3,
        16_000);
  }

  @Test
  @DisplayName("should send a JSON-mode request and map the response")
  void shouldCompleteInJsonMode() {
    // Given
    when(chatModel.chat(any(ChatRequest.class)))
        .thenReturn(
            ChatResponse.builder()
                .aiMessage(AiMessage.from("{\"ok\":true}"))
                .tokenUsage(new TokenUsage(120, 30))
                .modelName("google/gemini-2.5-flash")
                .build());

    // When
    LlmCompletionResponse response = client.complete(request(null));

    // Then
    verify(chatModel).chat(requestCaptor.capture());
    ChatRequest sent = requestCaptor.getValue();
    assertThat(sent.messages()).hasSize(2);
    assertThat(sent.messages().get(0)).isInstanceOf(SystemMessage.class);
    assertThat(sent.messages().get(1)).isInstanceOf(UserMessage.class);
    assertThat(sent.responseFormat().type()).isEqualTo(ResponseFormatType.JSON);
    assertThat(sent.responseFormat().jsonSchema()).isNull();
    assertThat(sent.maxOutputTokens()).isEqualTo(16_000);
    assertThat(sent.temperature()).isEqualTo(0.3);

    assertThat(response.content()).isEqualTo("{\"ok\":true}");
    assertThat(response.usage().promptTokens()).isEqualTo(120);
    assertThat(response.usage().completionTokens()).isEqualTo(30);
    assertThat(response.usage().totalTokens()).isEqualTo(150);
    assertThat(response.provider()).isEqualTo("openrouter");
  }

  @Test
  @DisplayName("should attach the response schema when one is given")
  void shouldAttachSchema() {
    JsonSchema schema =
        JsonSchema.builder()
            .name("Test")
            .rootElement(JsonObjectSchema.builder().addStringProperty("a").build())
            .build();
    when(chatModel.chat(any(ChatRequest.class)))
        .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("{}")).build());

    LlmCompletionResponse response = client.complete(request(schema));

    verify(chatModel).chat(requestCaptor.capture());
    assertThat(requestCaptor.getValue().responseFormat().jsonSchema()).isEqualTo(schema);
    assertThat(response.usage().totalTokens()).isNull();
    assertThat(response.model()).isEqualTo("google/gemini-2.5-flash");
  }

  @Test
  @DisplayName("should flag provider rate limits")
  void shouldWrapRateLimit() {
    when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RateLimitException("429"));

    assertThatThrownBy(() -> client.complete(request(null)))
        .isInstanceOf(LlmServiceException.class)
        .satisfies(e -> assertThat(((LlmServiceException) e).isRateLimited()).isTrue());
  }

  @Test
  @DisplayName("should wrap other provider failures")
  void shouldWrapFailure() {
    when(chatModel.chat(any(ChatRequest.class)))
        .thenThrow(new IllegalStateException("upstream exploded"));

    assertThatThrownBy(() -> client.complete(request(null)))
        .isInstanceOf(LlmServiceException.class)
        .hasMessageContaining("upstream exploded")
        .satisfies(e -> assertThat(((LlmServiceException) e).isRateLimited()).isFalse());
  }
}
