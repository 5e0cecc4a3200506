package com.flamingo.ai.discovery.service.summary;

import com.flamingo.ai.discovery.cache.DiscoveryCache;
import com.flamingo.ai.discovery.config.DiscoveryConfig;
import com.flamingo.ai.discovery.domain.enums.AlignmentLevel;
import com.flamingo.ai.discovery.domain.enums.Provenance;
import com.flamingo.ai.discovery.domain.model.PlaylistCharacteristics;
import com.flamingo.ai.discovery.domain.model.PlaylistDetail;
import com.flamingo.ai.discovery.domain.model.PlaylistSummary;
import com.flamingo.ai.discovery.domain.model.RankedPlaylist;
import com.flamingo.ai.discovery.domain.model.RequestIdentity;
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
import com.flamingo.ai.discovery.llm.SummaryPayload;
import com.flamingo.ai.discovery.progress.ProgressTracker;
import com.flamingo.ai.discovery.service.pacing.PacedSequencer;
import com.flamingo.ai.discovery.service.pacing.Sleeper;
import com.flamingo.ai.discovery.service.pacing.StepOutcome;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Cache-aside match analysis of a playlist against a query. Summaries are keyed by playlist and
 * normalized query, so the same playlist analysed for another query is a separate entry.
 *
 * <p>A response that still holds a JSON object is accepted with defaults for the missing fields. A
 * response with no object at all, or a failed call, is fatal unless fail-fast is switched off, in
 * which case the playlist is dropped.
 */
@Service
@Slf4j
public class SummarizerScorer {

  static final String DEFAULT_REASONING = "Analysis completed";

  private final LlmCompletionClient llmClient;
  private final LlmResponseParser parser;
  private final PlaylistPrompts prompts;
  private final LlmInteractionLogger interactionLogger;
  private final DiscoveryCache cache;
  private final DiscoveryConfig.Summarization settings;
  private final MeterRegistry meterRegistry;
  private final PacedSequencer pacer;

  public SummarizerScorer(
      LlmCompletionClient llmClient,
      LlmResponseParser parser,
      PlaylistPrompts prompts,
      LlmInteractionLogger interactionLogger,
      DiscoveryCache cache,
      DiscoveryConfig discoveryConfig,
      Sleeper sleeper,
      MeterRegistry meterRegistry) {
    this.llmClient = llmClient;
    this.parser = parser;
    this.prompts = prompts;
    this.interactionLogger = interactionLogger;
    this.cache = cache;
    this.settings = discoveryConfig.getSummarization();
    this.meterRegistry = meterRegistry;
    this.pacer = new PacedSequencer(settings.getDelay(), sleeper);
  }

  /**
   * Summarizes one playlist.
   *
   * @param query the user's query, or null for a query-less summary
   * @param batchSize number of playlists summarized in the same request
   * @throws LlmServiceException when the completion call fails
   * @throws LlmResponseParseException when the response holds no JSON object
   */
  public SummaryOutcome summarize(
      RequestIdentity identity,
      String query,
      PlaylistDetail detail,
      int trackSampleSize,
      int batchSize,
      String model) {
    Optional<PlaylistSummary> cached = cache.findSummary(detail.id(), query);
    if (cached.isPresent()) {
      log.debug("Summary cache hit for playlist {}", detail.id());
      return new SummaryOutcome(cached.get(), Provenance.FROM_CACHE);
    }

    LlmCompletionRequest request =
        prompts.summary(query, detail, trackSampleSize, batchSize, model);
    String command = "playlist_summarization: " + detail.name();
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

    LlmParseResult<SummaryPayload> parsed = parser.parseSummary(response.content());
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
            parsed.isUsable() ? "Summary generated" : parsed.detail()));
    if (!parsed.isUsable()) {
      throw new LlmResponseParseException("summary", parsed.detail());
    }

    PlaylistSummary summary = toSummary(detail, parsed.value(), response);
    cache.saveSummary(summary, query);
    log.debug(
        "Summarized playlist {} (score={}, alignment={}, status={})",
        detail.id(),
        summary.matchScore(),
        summary.alignmentLevel(),
        parsed.status());
    return new SummaryOutcome(summary, Provenance.FROM_API);
  }

  /** Summarizes each playlist in order and merges it with its detail. */
  @Timed(value = "discovery.summaries", description = "Time to summarize selected playlists")
  public List<RankedPlaylist> summarizeAll(
      RequestIdentity identity,
      String query,
      List<PlaylistDetail> details,
      int trackSampleSize,
      String model,
      ProgressTracker tracker) {
    List<RankedPlaylist> ranked = new ArrayList<>();
    int total = details.size();
    pacer.forEach(
        details,
        (detail, index) -> {
          tracker.item(
              "Analyzing \"%s\" (%d/%d)...".formatted(detail.name(), index + 1, total),
              index,
              total,
              false);
          try {
            SummaryOutcome outcome =
                summarize(identity, query, detail, trackSampleSize, total, model);
            ranked.add(RankedPlaylist.merge(detail, outcome.summary()));
            tracker.item(
                "Analyzed \"%s\" (%d/%d)".formatted(detail.name(), index + 1, total),
                index,
                total,
                true);
            return outcome.fromCache() ? StepOutcome.local() : StepOutcome.upstream();
          } catch (LlmServiceException | LlmResponseParseException e) {
            if (settings.isFailFast()) {
              log.error("Summarization failed for playlist {}: {}", detail.id(), e.getMessage());
              throw e;
            }
            log.warn("Dropping playlist {} after summary failure: {}", detail.id(), e.getMessage());
            meterRegistry.counter("discovery.playlists.dropped", "stage", "summary").increment();
            return StepOutcome.upstream();
          }
        });
    return ranked;
  }

  private PlaylistSummary toSummary(
      PlaylistDetail detail, SummaryPayload payload, LlmCompletionResponse response) {
    String text =
        payload.summary() != null && !payload.summary().isBlank()
            ? payload.summary()
            : "This playlist \"%s\" contains %d tracks."
                .formatted(detail.name(), detail.trackCount());
    AlignmentLevel alignment =
        payload.alignmentLevel() != null
            ? payload.alignmentLevel()
            : Optional.ofNullable(AlignmentLevel.fromWire(settings.getDefaultAlignment()))
                .orElse(AlignmentLevel.MODERATE);
    PlaylistCharacteristics characteristics =
        payload.characteristics() != null
            ? payload.characteristics()
            : PlaylistCharacteristics.fallback();
    double score = payload.matchScore() != null ? payload.matchScore() : settings.getDefaultScore();
    String reasoning = payload.reasoning() != null ? payload.reasoning() : DEFAULT_REASONING;
    return new PlaylistSummary(
        detail.id(),
        text,
        alignment,
        characteristics,
        score,
        reasoning,
        response.model(),
        response.provider());
  }
}
