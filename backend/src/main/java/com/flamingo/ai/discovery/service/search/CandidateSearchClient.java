package com.flamingo.ai.discovery.service.search;

import com.flamingo.ai.discovery.catalog.CatalogClient;
import com.flamingo.ai.discovery.catalog.dto.CatalogPage;
import com.flamingo.ai.discovery.catalog.dto.CatalogPlaylist;
import com.flamingo.ai.discovery.config.DiscoveryConfig;
import com.flamingo.ai.discovery.domain.model.Candidate;
import com.flamingo.ai.discovery.domain.model.RequestIdentity;
import com.flamingo.ai.discovery.progress.ProgressTracker;
import com.flamingo.ai.discovery.service.pacing.PacedSequencer;
import com.flamingo.ai.discovery.service.pacing.Sleeper;
import com.flamingo.ai.discovery.service.pacing.StepOutcome;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Collects playlist candidates for a query through paginated catalog search. Pages are fetched one
 * at a time with a fixed pause between them; a short page ends the search early.
 */
@Service
@Slf4j
public class CandidateSearchClient {

  private final CatalogClient catalogClient;
  private final int pageSize;
  private final PacedSequencer pager;

  public CandidateSearchClient(
      CatalogClient catalogClient, DiscoveryConfig discoveryConfig, Sleeper sleeper) {
    this.catalogClient = catalogClient;
    this.pageSize = discoveryConfig.getCatalog().getSearchPageSize();
    this.pager = new PacedSequencer(discoveryConfig.getCatalog().getSearchPageDelay(), sleeper);
  }

  /** Number of pages needed for {@code limit} candidates. */
  public int requiredPages(int limit) {
    return (limit + pageSize - 1) / pageSize;
  }

  @Timed(value = "discovery.search", description = "Time to collect search candidates")
  public SearchOutcome search(
      RequestIdentity identity, String query, int limit, ProgressTracker tracker) {
    int pages = requiredPages(limit);
    List<Candidate> candidates = new ArrayList<>();
    log.info("Searching catalog for '{}' (limit={}, pages={})", query, limit, pages);

    int fetched =
        pager.run(
            pages,
            page -> {
              int offset = page * pageSize;
              int pageLimit = Math.min(pageSize, limit - offset);
              CatalogPage<CatalogPlaylist> result =
                  catalogClient.searchPlaylists(identity.accessToken(), query, pageLimit, offset);
              for (CatalogPlaylist playlist : result.nonNullItems()) {
                if (playlist.id() != null) {
                  candidates.add(toCandidate(playlist));
                }
              }
              tracker.item(
                  "Fetching playlists page %d/%d... (%d/%d collected)"
                      .formatted(page + 1, pages, candidates.size(), limit),
                  page,
                  pages,
                  true,
                  pageMetadata(page + 1, pages, candidates.size(), limit));
              if (result.rawSize() < pageLimit) {
                log.debug("Reached end of search results at page {}", page + 1);
                return StepOutcome.stop();
              }
              return StepOutcome.upstream();
            },
            (nextPage, delay) ->
                tracker.item(
                    "Waiting to avoid rate limits... Next batch in %d seconds"
                        .formatted(delay.toSeconds()),
                    nextPage - 1,
                    pages,
                    true,
                    delayMetadata(nextPage, pages, delay.toMillis())));

    log.info(
        "Search for '{}' returned {} candidates in {} pages", query, candidates.size(), fetched);
    return new SearchOutcome(candidates, fetched);
  }

  private static Candidate toCandidate(CatalogPlaylist playlist) {
    return new Candidate(
        playlist.id(),
        playlist.name(),
        playlist.description(),
        playlist.ownerName(),
        playlist.trackTotal(),
        playlist.followerTotal(),
        Boolean.TRUE.equals(playlist.isPublic()),
        playlist.images());
  }

  private static Map<String, Object> pageMetadata(
      int batchNumber, int totalBatches, int fetched, int target) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("batchNumber", batchNumber);
    metadata.put("totalBatches", totalBatches);
    metadata.put("playlistsFetched", fetched);
    metadata.put("targetTotal", target);
    return metadata;
  }

  private static Map<String, Object> delayMetadata(int nextPage, int totalBatches, long delayMs) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("isRateLimitDelay", true);
    metadata.put("delayMs", delayMs);
    metadata.put("nextBatch", nextPage + 1);
    metadata.put("totalBatches", totalBatches);
    return metadata;
  }
}
