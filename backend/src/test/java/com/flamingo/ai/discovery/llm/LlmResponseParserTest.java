package com.flamingo.ai.discovery.llm;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.discovery.domain.enums.AlignmentLevel;
import com.flamingo.ai.discovery.domain.model.SelectionResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class LlmResponseParserTest {

  private SimpleMeterRegistry meterRegistry;
  private LlmResponseParser parser;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    parser = new LlmResponseParser(new ObjectMapper(), meterRegistry);
  }

  @Nested
  @DisplayName("Selection responses")
  class Selection {

    @Test
    @DisplayName("should parse a well-formed object strictly")
    void shouldParseStrict() {
      // When
      LlmParseResult<SelectionResult> result =
          parser.parseSelection(
              "{\"selectedPlaylistIds\": [\"a\", \"b\"], \"reasoning\": \"closest matches\"}");

      // Then
      assertThat(result.status()).isEqualTo(LlmParseResult.Status.STRICT);
      assertThat(result.value().selectedIds()).containsExactly("a", "b");
      assertThat(result.value().reasoning()).isEqualTo("closest matches");
    }

    @Test
    @DisplayName("should recover an object wrapped in a code fence")
    void shouldRecoverFromCodeFence() {
      String content = "Here you go:\n```json\n{\"selectedPlaylistIds\": [\"x\"]}\n```\nEnjoy!";

      LlmParseResult<SelectionResult> result = parser.parseSelection(content);

      assertThat(result.status()).isEqualTo(LlmParseResult.Status.RECOVERED);
      assertThat(result.value().selectedIds()).containsExactly("x");
    }

    @Test
    @DisplayName("should scan the id array out of a truncated response")
    void shouldRecoverFromTruncatedJson() {
      String content =
          "{\"selectedPlaylistIds\": [\"a\", \"b\", \"c\"], \"reasoning\": \"The first one is";

      LlmParseResult<SelectionResult> result = parser.parseSelection(content);

      assertThat(result.status()).isEqualTo(LlmParseResult.Status.RECOVERED);
      assertThat(result.value().selectedIds()).containsExactly("a", "b", "c");
    }

    @Test
    @DisplayName("should fail when no id array is present")
    void shouldFail_whenNoIds() {
      LlmParseResult<SelectionResult> result = parser.parseSelection("I cannot help with that.");

      assertThat(result.status()).isEqualTo(LlmParseResult.Status.FAILED);
      assertThat(result.isUsable()).isFalse();
      assertThat(result.detail()).isEqualTo("No valid selectedPlaylistIds found in response");
    }

    @Test
    @DisplayName("should skip non-string ids")
    void shouldSkipNonStringIds() {
      LlmParseResult<SelectionResult> result =
          parser.parseSelection("{\"selectedPlaylistIds\": [\"a\", 7, null, \"\", \"b\"]}");

      assertThat(result.value().selectedIds()).containsExactly("a", "b");
    }
  }

  @Nested
  @DisplayName("Summary responses")
  class Summary {

    @Test
    @DisplayName("should parse a complete summary strictly")
    void shouldParseStrict() {
      String content =
          """
          {
            "summary": "About 7 of 10 tracks are lofi piano.",
            "alignmentLevel": "strong",
            "characteristics": {
              "primaryGenre": "Lofi",
              "mood": "Calm",
              "instrumentation": ["piano", "drums"],
              "tempo": "slow",
              "decadeRange": "2010s"
            },
            "matchScore": 0.85,
            "reasoning": "Mostly on target"
          }""";

      LlmParseResult<SummaryPayload> result = parser.parseSummary(content);

      assertThat(result.status()).isEqualTo(LlmParseResult.Status.STRICT);
      SummaryPayload payload = result.value();
      assertThat(payload.alignmentLevel()).isEqualTo(AlignmentLevel.STRONG);
      assertThat(payload.matchScore()).isEqualTo(0.85);
      assertThat(payload.characteristics().instrumentation()).containsExactly("piano", "drums");
    }

    @Test
    @DisplayName("should mark mistyped fields as recovered and keep what is usable")
    void shouldRecover_whenFieldsMistyped() {
      String content =
          "{\"summary\": \"ok\", \"alignmentLevel\": \"perfect\", \"matchScore\": \"0.4\","
              + " \"characteristics\": {\"instrumentation\": \"guitar\"}}";

      LlmParseResult<SummaryPayload> result = parser.parseSummary(content);

      assertThat(result.status()).isEqualTo(LlmParseResult.Status.RECOVERED);
      assertThat(result.value().alignmentLevel()).isNull();
      assertThat(result.value().matchScore()).isEqualTo(0.4);
      assertThat(result.value().characteristics().instrumentation()).containsExactly("guitar");
    }

    @Test
    @DisplayName("should treat an out-of-range score as recovered")
    void shouldRecover_whenScoreOutOfRange() {
      LlmParseResult<SummaryPayload> result =
          parser.parseSummary("{\"summary\": \"ok\", \"matchScore\": 1.5}");

      assertThat(result.status()).isEqualTo(LlmParseResult.Status.RECOVERED);
      assertThat(result.value().matchScore()).isEqualTo(1.5);
    }

    @Test
    @DisplayName("should extract an object embedded in prose")
    void shouldRecoverFromProse() {
      LlmParseResult<SummaryPayload> result =
          parser.parseSummary("Sure! {\"summary\": \"fits\", \"matchScore\": 0.5} Hope it helps");

      assertThat(result.status()).isEqualTo(LlmParseResult.Status.RECOVERED);
      assertThat(result.value().summary()).isEqualTo("fits");
    }

    @Test
    @DisplayName("should fail when there is no object at all")
    void shouldFail_whenNoObject() {
      LlmParseResult<SummaryPayload> result = parser.parseSummary("");

      assertThat(result.status()).isEqualTo(LlmParseResult.Status.FAILED);
    }
  }

  @Test
  @DisplayName("should count parse outcomes per stage")
  void shouldRecordOutcomeMetrics() {
    parser.parseSelection("{\"selectedPlaylistIds\": []}");
    parser.parseSelection("nothing");

    assertThat(
            meterRegistry
                .counter("discovery.llm.parse", "stage", "selection", "outcome", "strict")
                .count())
        .isEqualTo(1.0);
    assertThat(
            meterRegistry
                .counter("discovery.llm.parse", "stage", "selection", "outcome", "failed")
                .count())
        .isEqualTo(1.0);
  }
}
