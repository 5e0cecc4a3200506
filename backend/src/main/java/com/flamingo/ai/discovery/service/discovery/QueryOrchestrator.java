package com.flamingo.ai.discovery.service.discovery;

import com.flamingo.ai.discovery.config.DiscoveryConfig;
import com.flamingo.ai.discovery.domain.enums.DiscoveryPhase;
import com.flamingo.ai.discovery.domain.model.DiscoveryQuery;
import com.flamingo.ai.discovery.domain.model.DiscoveryResult;
import com.flamingo.ai.discovery.domain.model.FetchedDetail;
import com.flamingo.ai.discovery.domain.model.RankedPlaylist;
import com.flamingo.ai.discovery.domain.model.RequestIdentity;
import com.flamingo.ai.discovery.progress.ProgressPublisher;
import com.flamingo.ai.discovery.progress.ProgressTracker;
import com.flamingo.ai.discovery.service.detail.DetailBatch;
import com.flamingo.ai.discovery.service.detail.DetailFetcher;
import com.flamingo.ai.discovery.service.history.SearchHistoryService;
import com.flamingo.ai.discovery.service.pacing.Sleeper;
import com.flamingo.ai.discovery.service.search.CandidateSearchClient;
import com.flamingo.ai.discovery.service.search.SearchOutcome;
import com.flamingo.ai.discovery.service.selection.SelectionOutcome;
import com.flamingo.ai.discovery.service.selection.SelectionRanker;
import com.flamingo.ai.discovery.service.summary.SummarizerScorer;
import com.flamingo.ai.discovery.service.summary.SummaryOutcome;
import io.micrometer.core.annotation.Timed;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs a discovery request through search, selection, detail fetching and summarization, strictly
 * in that order and on the calling thread. Phase failures propagate to the caller; per-playlist
 * detail failures are absorbed by {@link DetailFetcher}.
 *
 * <p>Work is not cancelled when the client goes away. Progress events are best-effort.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryOrchestrator {

  /** Stable sort, so equal scores keep the selection order. */
  static final Comparator<RankedPlaylist> BY_SCORE_DESC =
      Comparator.comparingDouble(RankedPlaylist::matchScore).reversed();

  private final CandidateSearchClient searchClient;
  private final SelectionRanker selectionRanker;
  private final DetailFetcher detailFetcher;
  private final SummarizerScorer summarizer;
  private final SearchHistoryService historyService;
  private final ProgressPublisher progressPublisher;
  private final DiscoveryConfig discoveryConfig;
  private final Sleeper sleeper;
  private final Clock clock;

  @Timed(value = "discovery.full_search", description = "Time for a full discovery request")
  public DiscoveryResult discover(RequestIdentity identity, DiscoveryQuery query) {
    String model = query.modelOr(discoveryConfig.getLlm().getDefaultModel());
    ProgressTracker tracker = newTracker(identity);
    log.info(
        "Discovery started: query='{}', model={}, limits={}/{}/{}",
        query.text(),
        model,
        query.playlistLimit(),
        query.trackSampleSize(),
        query.renderLimit());
    try {
      CandidateSelection phaseOne = searchAndSelect(identity, query, model, tracker);
      if (phaseOne.selection() == null) {
        return DiscoveryResult.empty(query.text(), DiscoveryResult.NO_PLAYLISTS_FOUND);
      }
      SelectionOutcome selection = phaseOne.selection();
      if (selection.isEmpty()) {
        return DiscoveryResult.empty(query.text(), DiscoveryResult.NO_SUITABLE_PLAYLISTS);
      }

      tracker.enter(DiscoveryPhase.FETCHING);
      tracker.step(
          "Fetching details for %d playlists...".formatted(selection.selected().size()), 0);
      DetailBatch details =
          detailFetcher.fetchAll(
              identity, selection.result().selectedIds(), query.trackSampleSize(), tracker);

      tracker.enter(DiscoveryPhase.SUMMARIZING);
      tracker.step("Analyzing %d playlists...".formatted(details.fetched().size()), 0);
      List<RankedPlaylist> ranked =
          new ArrayList<>(
              summarizer.summarizeAll(
                  identity,
                  query.text(),
                  details.details(),
                  query.trackSampleSize(),
                  model,
                  tracker));
      ranked.sort(BY_SCORE_DESC);

      tracker.step("Finalizing results...", 1.0, Map.of("finalizing", true));
      pause(discoveryConfig.getProgress().getFinalizeDelay());

      DiscoveryResult result =
          DiscoveryResult.completed(
              query.text(), ranked, phaseOne.totalSearchResults(), selection.selected().size());
      historyService.record(identity.userId(), query.text(), model, result);

      tracker.enter(DiscoveryPhase.COMPLETE);
      tracker.absolute("Complete! Found %d playlists for you".formatted(ranked.size()), 100.0);
      log.info(
          "Discovery finished: query='{}', candidates={}, selected={}, final={}",
          query.text(),
          phaseOne.totalSearchResults(),
          selection.selected().size(),
          ranked.size());
      return result;
    } catch (RuntimeException e) {
      tracker.fail();
      log.error(
          "Discovery failed for '{}' in phase {}: {}",
          query.text(),
          tracker.getPhase(),
          e.getMessage());
      throw e;
    }
  }

  /** Search and selection only. */
  public CandidateSelection select(RequestIdentity identity, DiscoveryQuery query) {
    String model = query.modelOr(discoveryConfig.getLlm().getDefaultModel());
    return searchAndSelect(identity, query, model, newTracker(identity));
  }

  /** Details for explicit playlist ids, in request order. */
  public DetailBatch details(RequestIdentity identity, List<String> playlistIds, int sampleSize) {
    ProgressTracker tracker = newTracker(identity);
    tracker.enter(DiscoveryPhase.FETCHING);
    return detailFetcher.fetchAll(identity, playlistIds, sampleSize, tracker);
  }

  /**
   * Summary of one playlist, fetching its detail through the cache first.
   *
   * @param query the query to analyse against, or null for a general summary
   */
  public SummaryOutcome summarize(
      RequestIdentity identity, String playlistId, String query, String model, int sampleSize) {
    String effectiveModel =
        model == null || model.isBlank() ? discoveryConfig.getLlm().getDefaultModel() : model;
    FetchedDetail detail = detailFetcher.fetch(identity, playlistId, sampleSize);
    return summarizer.summarize(identity, query, detail.detail(), sampleSize, 1, effectiveModel);
  }

  private CandidateSelection searchAndSelect(
      RequestIdentity identity, DiscoveryQuery query, String model, ProgressTracker tracker) {
    tracker.enter(DiscoveryPhase.SEARCHING);
    tracker.step("Searching catalog for '%s'...".formatted(query.text()), 0);
    long searchStart = clock.millis();
    SearchOutcome search =
        searchClient.search(identity, query.text(), query.playlistLimit(), tracker);
    tracker.step(
        "Found %d playlists, sending to AI for analysis...".formatted(search.candidates().size()),
        1.0,
        Map.of(
            "searchTime", clock.millis() - searchStart,
            "playlistCount", search.candidates().size()));
    if (search.isEmpty()) {
      log.info("No candidates found for '{}'", query.text());
      return new CandidateSelection(query.text(), search, null);
    }

    tracker.enter(DiscoveryPhase.ANALYZING);
    tracker.step("AI analyzing %d playlists...".formatted(search.candidates().size()), 0);
    SelectionOutcome selection =
        selectionRanker.select(
            identity, query.text(), search.candidates(), query.renderLimit(), model);
    String reasoning = selection.result().reasoning();
    tracker.step(
        "AI selected %d best matches".formatted(selection.selected().size()),
        1.0,
        Map.of("reasoning", reasoning == null ? "" : reasoning));
    return new CandidateSelection(query.text(), search, selection);
  }

  private ProgressTracker newTracker(RequestIdentity identity) {
    return new ProgressTracker(
        progressPublisher, clock, identity.userId(), identity.sessionOrUnknown());
  }

  private void pause(Duration delay) {
    if (delay == null || delay.isZero() || delay.isNegative()) {
      return;
    }
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while finalizing discovery", e);
    }
  }
}
