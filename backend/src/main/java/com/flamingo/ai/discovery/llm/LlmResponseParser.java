package com.flamingo.ai.discovery.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.discovery.domain.enums.AlignmentLevel;
import com.flamingo.ai.discovery.domain.model.PlaylistCharacteristics;
import com.flamingo.ai.discovery.domain.model.SelectionResult;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns raw completion text into selection and summary values. Tries a strict parse first and
 * falls back to lenient recovery: code fences are stripped, the outermost JSON object is extracted
 * and, for selections, the id array is scanned out of otherwise malformed text.
 *
 * <p>Never throws; callers decide what a {@link LlmParseResult.Status#FAILED} result means.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmResponseParser {

  static final String SELECTED_IDS_FIELD = "selectedPlaylistIds";

  private static final Pattern CODE_FENCE =
      Pattern.compile("```(?:json)?\\s*(.*?)\\s*```", Pattern.DOTALL);
  private static final Pattern SELECTED_IDS_ARRAY =
      Pattern.compile("\"" + SELECTED_IDS_FIELD + "\"\\s*:\\s*\\[([^\\]]*)");
  private static final Pattern QUOTED = Pattern.compile("\"([^\"]+)\"");

  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  public LlmParseResult<SelectionResult> parseSelection(String content) {
    LlmParseResult<SelectionResult> result = doParseSelection(content);
    record("selection", result);
    return result;
  }

  public LlmParseResult<SummaryPayload> parseSummary(String content) {
    LlmParseResult<SummaryPayload> result = doParseSummary(content);
    record("summary", result);
    return result;
  }

  private LlmParseResult<SelectionResult> doParseSelection(String content) {
    Optional<JsonNode> direct = readObject(content);
    if (direct.isPresent() && direct.get().path(SELECTED_IDS_FIELD).isArray()) {
      return LlmParseResult.strict(toSelection(direct.get()));
    }

    Optional<JsonNode> recovered = direct.isPresent() ? Optional.empty() : recoverObject(content);
    if (recovered.isPresent() && recovered.get().path(SELECTED_IDS_FIELD).isArray()) {
      return LlmParseResult.recovered(
          toSelection(recovered.get()), "JSON object recovered from surrounding text");
    }

    List<String> scanned = scanSelectedIds(content);
    if (!scanned.isEmpty()) {
      return LlmParseResult.recovered(
          new SelectionResult(scanned, null), "selected ids scanned from malformed JSON");
    }
    return LlmParseResult.failed("No valid " + SELECTED_IDS_FIELD + " found in response");
  }

  private LlmParseResult<SummaryPayload> doParseSummary(String content) {
    Optional<JsonNode> direct = readObject(content);
    if (direct.isPresent()) {
      JsonNode node = direct.get();
      SummaryPayload payload = toSummary(node);
      if (isWellFormedSummary(node, payload)) {
        return LlmParseResult.strict(payload);
      }
      return LlmParseResult.recovered(payload, "summary fields missing or mistyped");
    }

    Optional<JsonNode> recovered = recoverObject(content);
    if (recovered.isPresent()) {
      return LlmParseResult.recovered(
          toSummary(recovered.get()), "JSON object recovered from surrounding text");
    }
    return LlmParseResult.failed("No JSON object found in summary response");
  }

  private Optional<JsonNode> readObject(String text) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    try {
      JsonNode node = objectMapper.readTree(text.trim());
      return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
    } catch (JsonProcessingException e) {
      return Optional.empty();
    }
  }

  private Optional<JsonNode> recoverObject(String content) {
    if (content == null) {
      return Optional.empty();
    }
    String text = content;
    Matcher fence = CODE_FENCE.matcher(content);
    if (fence.find()) {
      text = fence.group(1);
      Optional<JsonNode> fenced = readObject(text);
      if (fenced.isPresent()) {
        return fenced;
      }
    }
    int start = text.indexOf('{');
    int end = text.lastIndexOf('}');
    if (start < 0 || end <= start) {
      return Optional.empty();
    }
    return readObject(text.substring(start, end + 1));
  }

  private static List<String> scanSelectedIds(String content) {
    if (content == null) {
      return List.of();
    }
    Matcher array = SELECTED_IDS_ARRAY.matcher(content);
    if (!array.find()) {
      return List.of();
    }
    List<String> ids = new ArrayList<>();
    Matcher quoted = QUOTED.matcher(array.group(1));
    while (quoted.find()) {
      ids.add(quoted.group(1));
    }
    return ids;
  }

  private static SelectionResult toSelection(JsonNode node) {
    List<String> ids = new ArrayList<>();
    for (JsonNode id : node.path(SELECTED_IDS_FIELD)) {
      if (id.isTextual() && !id.asText().isBlank()) {
        ids.add(id.asText());
      }
    }
    return new SelectionResult(ids, text(node, "reasoning"));
  }

  private static SummaryPayload toSummary(JsonNode node) {
    return new SummaryPayload(
        text(node, "summary"),
        AlignmentLevel.fromWire(text(node, "alignmentLevel")),
        toCharacteristics(node.get("characteristics")),
        score(node.get("matchScore")),
        text(node, "reasoning"));
  }

  private static boolean isWellFormedSummary(JsonNode node, SummaryPayload payload) {
    if (payload.summary() == null) {
      return false;
    }
    if (node.has("alignmentLevel") && payload.alignmentLevel() == null) {
      return false;
    }
    if (node.has("matchScore")) {
      JsonNode score = node.get("matchScore");
      if (!score.isNumber() || score.asDouble() < 0.0 || score.asDouble() > 1.0) {
        return false;
      }
    }
    return !node.has("characteristics") || node.get("characteristics").isObject();
  }

  private static PlaylistCharacteristics toCharacteristics(JsonNode node) {
    if (node == null || !node.isObject()) {
      return null;
    }
    List<String> instrumentation = null;
    JsonNode instruments = node.get("instrumentation");
    if (instruments != null && instruments.isArray()) {
      instrumentation = new ArrayList<>();
      for (JsonNode instrument : instruments) {
        if (instrument.isTextual()) {
          instrumentation.add(instrument.asText());
        }
      }
    } else if (instruments != null && instruments.isTextual()) {
      instrumentation = List.of(instruments.asText());
    }
    return new PlaylistCharacteristics(
        text(node, "primaryGenre"),
        text(node, "mood"),
        instrumentation,
        text(node, "tempo"),
        text(node, "decadeRange"));
  }

  private static Double score(JsonNode node) {
    if (node == null) {
      return null;
    }
    if (node.isNumber()) {
      return node.asDouble();
    }
    if (node.isTextual()) {
      try {
        return Double.parseDouble(node.asText().trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value != null && value.isTextual() ? value.asText() : null;
  }

  private void record(String stage, LlmParseResult<?> result) {
    if (result.status() != LlmParseResult.Status.STRICT) {
      log.warn("Lenient {} parse: status={}, detail={}", stage, result.status(), result.detail());
    }
    String outcome = result.status().name().toLowerCase(Locale.ROOT);
    meterRegistry.counter("discovery.llm.parse", "stage", stage, "outcome", outcome).increment();
  }
}
