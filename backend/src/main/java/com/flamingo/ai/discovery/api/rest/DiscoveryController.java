package com.flamingo.ai.discovery.api.rest;

import com.flamingo.ai.discovery.api.RequestIdentityResolver;
import com.flamingo.ai.discovery.api.dto.request.BatchDetailsRequest;
import com.flamingo.ai.discovery.api.dto.request.DiscoveryRequest;
import com.flamingo.ai.discovery.api.dto.request.SummarizeRequest;
import com.flamingo.ai.discovery.api.dto.response.BatchDetailsResponse;
import com.flamingo.ai.discovery.api.dto.response.HistoryResponse;
import com.flamingo.ai.discovery.api.dto.response.SelectionResponse;
import com.flamingo.ai.discovery.api.dto.response.SummaryResponse;
import com.flamingo.ai.discovery.config.DiscoveryConfig;
import com.flamingo.ai.discovery.domain.model.DiscoveryQuery;
import com.flamingo.ai.discovery.domain.model.DiscoveryResult;
import com.flamingo.ai.discovery.domain.model.RequestIdentity;
import com.flamingo.ai.discovery.service.discovery.QueryOrchestrator;
import com.flamingo.ai.discovery.service.history.SearchHistoryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for playlist discovery. */
@RestController
@RequestMapping("/api/playlist-discovery")
@RequiredArgsConstructor
@Slf4j
public class DiscoveryController {

  private final QueryOrchestrator orchestrator;
  private final SearchHistoryService historyService;
  private final RequestIdentityResolver identityResolver;
  private final DiscoveryConfig discoveryConfig;

  /**
   * Runs the full pipeline: search, selection, details and summaries.
   *
   * @return the ranked result, or an empty result with a message
   */
  @PostMapping("/full-search")
  public ResponseEntity<DiscoveryResult> fullSearch(
      @RequestHeader(value = RequestIdentityResolver.USER_HEADER, required = false) String userId,
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
      @RequestHeader(value = RequestIdentityResolver.SESSION_HEADER, required = false)
          String sessionId,
      @Valid @RequestBody DiscoveryRequest request) {
    RequestIdentity identity = identityResolver.resolve(userId, authorization, sessionId);
    return ResponseEntity.ok(orchestrator.discover(identity, toQuery(request)));
  }

  /** Search and selection only. */
  @PostMapping("/search")
  public ResponseEntity<SelectionResponse> search(
      @RequestHeader(value = RequestIdentityResolver.USER_HEADER, required = false) String userId,
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
      @RequestHeader(value = RequestIdentityResolver.SESSION_HEADER, required = false)
          String sessionId,
      @Valid @RequestBody DiscoveryRequest request) {
    RequestIdentity identity = identityResolver.resolve(userId, authorization, sessionId);
    return ResponseEntity.ok(
        SelectionResponse.from(orchestrator.select(identity, toQuery(request))));
  }

  @PostMapping("/batch-details")
  public ResponseEntity<BatchDetailsResponse> batchDetails(
      @RequestHeader(value = RequestIdentityResolver.USER_HEADER, required = false) String userId,
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
      @RequestHeader(value = RequestIdentityResolver.SESSION_HEADER, required = false)
          String sessionId,
      @Valid @RequestBody BatchDetailsRequest request) {
    RequestIdentity identity = identityResolver.resolve(userId, authorization, sessionId);
    log.info("Batch details requested for {} playlists", request.getPlaylistIds().size());
    int sampleSize = sampleSize(request.getTrackSampleSize());
    return ResponseEntity.ok(
        BatchDetailsResponse.from(
            orchestrator.details(identity, request.getPlaylistIds(), sampleSize)));
  }

  @PostMapping("/summarize")
  public ResponseEntity<SummaryResponse> summarize(
      @RequestHeader(value = RequestIdentityResolver.USER_HEADER, required = false) String userId,
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
      @RequestHeader(value = RequestIdentityResolver.SESSION_HEADER, required = false)
          String sessionId,
      @Valid @RequestBody SummarizeRequest request) {
    RequestIdentity identity = identityResolver.resolve(userId, authorization, sessionId);
    return ResponseEntity.ok(
        SummaryResponse.from(
            orchestrator.summarize(
                identity,
                request.getPlaylistId(),
                request.getOriginalQuery(),
                request.getModel(),
                sampleSize(request.getTrackSampleSize()))));
  }

  /**
   * Lists the caller's recent searches.
   *
   * @return at most the configured number of entries, newest first
   */
  @GetMapping("/history")
  public ResponseEntity<HistoryResponse> history(
      @RequestHeader(value = RequestIdentityResolver.USER_HEADER, required = false)
          String userId) {
    String user = identityResolver.requireUser(userId);
    return ResponseEntity.ok(new HistoryResponse(historyService.history(user)));
  }

  /** Returns a stored result exactly as it was persisted. */
  @GetMapping(value = "/cached-result/{searchHash}", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<String> cachedResult(
      @RequestHeader(value = RequestIdentityResolver.USER_HEADER, required = false) String userId,
      @PathVariable String searchHash) {
    String user = identityResolver.requireUser(userId);
    return ResponseEntity.ok()
        .contentType(MediaType.APPLICATION_JSON)
        .body(historyService.cachedResult(user, searchHash));
  }

  private DiscoveryQuery toQuery(DiscoveryRequest request) {
    DiscoveryConfig.Limits limits = discoveryConfig.getLimits();
    return DiscoveryQuery.of(
        request.getQuery(),
        request.getModel(),
        request.getPlaylistLimit(),
        request.getTrackSampleSize(),
        request.getRenderLimit(),
        new DiscoveryQuery.Defaults(
            limits.getDefaultPlaylistLimit(),
            limits.getDefaultTrackSampleSize(),
            limits.getDefaultRenderLimit()));
  }

  private int sampleSize(Integer requested) {
    int value =
        requested != null ? requested : discoveryConfig.getLimits().getDefaultTrackSampleSize();
    return Math.min(
        Math.max(value, DiscoveryQuery.MIN_TRACK_SAMPLE_SIZE),
        DiscoveryQuery.MAX_TRACK_SAMPLE_SIZE);
  }
}
