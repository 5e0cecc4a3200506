package com.flamingo.ai.discovery.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.discovery.config.DiscoveryConfig;
import com.flamingo.ai.discovery.domain.model.DiscoveryResult;
import com.flamingo.ai.discovery.domain.model.HistoryRecord;
import com.flamingo.ai.discovery.domain.model.PlaylistDetail;
import com.flamingo.ai.discovery.domain.model.PlaylistSummary;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Typed, JSON-encoded view over the {@link CacheStore}. Values are always written whole; a value
 * that no longer deserializes is logged and treated as a miss.
 */
@Component
@Slf4j
public class DiscoveryCache {

  private final CacheStore store;
  private final ObjectMapper objectMapper;
  private final DiscoveryConfig.Cache settings;
  private final CacheKeys keys;

  public DiscoveryCache(CacheStore store, ObjectMapper objectMapper, DiscoveryConfig config) {
    this.store = store;
    this.objectMapper = objectMapper;
    this.settings = config.getCache();
    this.keys = new CacheKeys(settings.getKeyPrefix());
  }

  public Optional<PlaylistDetail> findDetail(String playlistId) {
    return read(keys.detail(playlistId), PlaylistDetail.class);
  }

  public void saveDetail(PlaylistDetail detail) {
    write(keys.detail(detail.id()), detail, settings.getDetailTtl());
  }

  public Optional<PlaylistSummary> findSummary(String playlistId, String query) {
    return read(keys.summary(playlistId, query), PlaylistSummary.class);
  }

  public void saveSummary(PlaylistSummary summary, String query) {
    write(keys.summary(summary.playlistId(), query), summary, settings.getSummaryTtl());
  }

  public void saveResult(String userId, String searchHash, DiscoveryResult result) {
    write(keys.result(userId, searchHash), result, settings.getResultTtl());
  }

  /** The stored result exactly as it was written. */
  public Optional<String> findResultJson(String userId, String searchHash) {
    return store.get(keys.result(userId, searchHash));
  }

  public boolean resultExists(String userId, String searchHash) {
    return store.exists(keys.result(userId, searchHash));
  }

  public void appendHistory(String userId, HistoryRecord record) {
    try {
      store.appendToIndex(
          keys.history(userId),
          objectMapper.writeValueAsString(record),
          record.timestamp(),
          settings.getHistoryCap());
    } catch (JsonProcessingException e) {
      log.warn("Could not encode history record for {}: {}", record.searchHash(), e.getMessage());
    }
  }

  /** Newest first, at most the configured cap. */
  public List<HistoryRecord> history(String userId) {
    List<HistoryRecord> records = new ArrayList<>();
    for (String member : store.rangeNewestFirst(keys.history(userId), settings.getHistoryCap())) {
      try {
        records.add(objectMapper.readValue(member, HistoryRecord.class));
      } catch (JsonProcessingException e) {
        log.warn("Skipping unreadable history entry for user: {}", e.getOriginalMessage());
      }
    }
    return records;
  }

  private <T> Optional<T> read(String key, Class<T> type) {
    Optional<String> raw = store.get(key);
    if (raw.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(raw.get(), type));
    } catch (JsonProcessingException e) {
      log.warn("Corrupt cache value at {}, treating as miss: {}", key, e.getOriginalMessage());
      return Optional.empty();
    }
  }

  private void write(String key, Object value, Duration ttl) {
    try {
      store.set(key, objectMapper.writeValueAsString(value), ttl);
    } catch (JsonProcessingException e) {
      log.warn("Could not encode cache value for {}: {}", key, e.getOriginalMessage());
    }
  }
}
