package com.flamingo.ai.discovery.domain.model;

/** One entry of a user's search history index. */
public record HistoryRecord(
    String searchHash, String query, String model, long timestamp, int resultCount) {}
