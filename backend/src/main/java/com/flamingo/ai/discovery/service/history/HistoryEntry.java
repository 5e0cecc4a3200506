package com.flamingo.ai.discovery.service.history;

import com.flamingo.ai.discovery.domain.model.HistoryRecord;

/**
 * A history record annotated with whether its stored result is still available.
 *
 * @param cached true while the result lookup for {@code searchHash} would succeed
 */
public record HistoryEntry(
    String searchHash,
    String query,
    String model,
    long timestamp,
    int resultCount,
    boolean cached) {

  public static HistoryEntry of(HistoryRecord record, boolean cached) {
    return new HistoryEntry(
        record.searchHash(),
        record.query(),
        record.model(),
        record.timestamp(),
        record.resultCount(),
        cached);
  }
}
