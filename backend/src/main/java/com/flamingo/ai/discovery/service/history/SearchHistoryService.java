package com.flamingo.ai.discovery.service.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.discovery.cache.CacheKeys;
import com.flamingo.ai.discovery.cache.DiscoveryCache;
import com.flamingo.ai.discovery.domain.model.DiscoveryResult;
import com.flamingo.ai.discovery.domain.model.HistoryRecord;
import com.flamingo.ai.discovery.exception.SearchResultExpiredException;
import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Persists finished discovery results and serves a user's search history. */
@Service
@RequiredArgsConstructor
@Slf4j
public class SearchHistoryService {

  private final DiscoveryCache cache;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * Stores the result under the (user, query, model) hash and appends a history record.
   *
   * @return the search hash the result was stored under
   */
  public String record(String userId, String query, String model, DiscoveryResult result) {
    String searchHash = CacheKeys.searchHash(userId, query, model);
    cache.saveResult(userId, searchHash, result);
    int resultCount = result.finalCount() != null ? result.finalCount() : result.playlists().size();
    cache.appendHistory(
        userId, new HistoryRecord(searchHash, query, model, clock.millis(), resultCount));
    log.info("Stored discovery result {} ({} playlists)", searchHash, resultCount);
    return searchHash;
  }

  /** The caller's most recent searches, newest first. */
  public List<HistoryEntry> history(String userId) {
    return cache.history(userId).stream()
        .map(record -> HistoryEntry.of(record, cache.resultExists(userId, record.searchHash())))
        .toList();
  }

  /**
   * The stored result JSON exactly as it was persisted.
   *
   * @throws SearchResultExpiredException when the result is gone or no longer readable
   */
  public String cachedResult(String userId, String searchHash) {
    String json =
        cache
            .findResultJson(userId, searchHash)
            .orElseThrow(() -> new SearchResultExpiredException(searchHash));
    try {
      objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      log.warn("Stored result {} is corrupt: {}", searchHash, e.getOriginalMessage());
      throw new SearchResultExpiredException(searchHash);
    }
    return json;
  }
}
