package com.flamingo.ai.discovery.service.selection;

import com.flamingo.ai.discovery.domain.model.Candidate;
import com.flamingo.ai.discovery.domain.model.RequestIdentity;
import com.flamingo.ai.discovery.domain.model.SelectionResult;
import com.flamingo.ai.discovery.exception.LlmResponseParseException;
import com.flamingo.ai.discovery.exception.LlmServiceException;
import com.flamingo.ai.discovery.llm.LlmCompletionClient;
import com.flamingo.ai.discovery.llm.LlmCompletionRequest;
import com.flamingo.ai.discovery.llm.LlmCompletionResponse;
import com.flamingo.ai.discovery.llm.LlmInteraction;
import com.flamingo.ai.discovery.llm.LlmInteractionLogger;
import com.flamingo.ai.discovery.llm.LlmParseResult;
import com.flamingo.ai.discovery.llm.LlmResponseParser;
import com.flamingo.ai.discovery.llm.LlmUsage;
import com.flamingo.ai.discovery.llm.PlaylistPrompts;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Narrows the search candidates to a short list with one LLM call. The model's order is kept;
 * ids that do not name a candidate are dropped and the list is cut to the render limit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SelectionRanker {

  private final LlmCompletionClient llmClient;
  private final LlmResponseParser parser;
  private final PlaylistPrompts prompts;
  private final LlmInteractionLogger interactionLogger;

  @Timed(value = "discovery.selection", description = "Time to select candidates with the LLM")
  public SelectionOutcome select(
      RequestIdentity identity,
      String query,
      List<Candidate> candidates,
      int renderLimit,
      String model) {
    LlmCompletionRequest request = prompts.selection(query, candidates, renderLimit, model);
    String command = "playlist_selection: " + query;
    log.info(
        "Selecting from {} candidates for '{}' (renderLimit={}, maxTokens={})",
        candidates.size(),
        query,
        renderLimit,
        request.maxTokens());

    LlmCompletionResponse response;
    try {
      response = llmClient.complete(request);
    } catch (LlmServiceException e) {
      interactionLogger.record(
          new LlmInteraction(
              identity.userId(),
              identity.sessionId(),
              command,
              model,
              null,
              0,
              LlmUsage.unknown(),
              null,
              false,
              e.getMessage()));
      throw e;
    }

    LlmParseResult<SelectionResult> parsed = parser.parseSelection(response.content());
    interactionLogger.record(
        new LlmInteraction(
            identity.userId(),
            identity.sessionId(),
            command,
            response.model(),
            response.provider(),
            response.latencyMs(),
            response.usage(),
            parsed.status(),
            parsed.isUsable(),
            parsed.isUsable()
                ? "Selected " + parsed.value().selectedIds().size() + " playlists"
                : parsed.detail()));
    if (!parsed.isUsable()) {
      log.error("Selection response unusable for '{}': {}", query, parsed.detail());
      throw new LlmResponseParseException("selection", parsed.detail());
    }

    SelectionResult result = parsed.value();
    List<Candidate> known = resolve(result, candidates);
    List<Candidate> selected = known.subList(0, Math.min(renderLimit, known.size()));
    if (known.size() < result.selectedIds().size()) {
      log.warn(
          "Model returned {} ids not present in search results",
          result.selectedIds().size() - known.size());
    }
    if (result.reasoning() != null) {
      log.debug("Selection reasoning: {}", result.reasoning());
    }
    log.info("Selected {} playlists in {}ms", selected.size(), response.latencyMs());
    SelectionResult resolved =
        new SelectionResult(selected.stream().map(Candidate::id).toList(), result.reasoning());
    return new SelectionOutcome(resolved, selected, response.model(), response.provider());
  }

  private static List<Candidate> resolve(SelectionResult result, List<Candidate> candidates) {
    Map<String, Candidate> byId =
        candidates.stream()
            .collect(Collectors.toMap(Candidate::id, Function.identity(), (first, dup) -> first));
    List<Candidate> selected = new ArrayList<>();
    for (String id : result.selectedIds()) {
      Candidate candidate = byId.get(id);
      if (candidate != null) {
        selected.add(candidate);
      }
    }
    return selected;
  }
}
