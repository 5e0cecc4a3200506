package com.flamingo.ai.discovery.cache;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Key/value store with per-key TTL plus score-ordered indexes. Shared across concurrent requests;
 * keys are namespaced by user and/or playlist id, so writers never need a lock and the last writer
 * wins.
 *
 * <p>Implementations never throw on backend failure: reads degrade to a miss and writes to a no-op,
 * with a warning logged.
 */
public interface CacheStore {

  Optional<String> get(String key);

  /** Overwrites the whole value and its TTL. */
  void set(String key, String value, Duration ttl);

  boolean exists(String key);

  /**
   * Adds {@code member} to a score-ordered index, then evicts the lowest-scored members so that at
   * most {@code cap} remain.
   */
  void appendToIndex(String indexKey, String member, double score, int cap);

  /** Up to {@code limit} members of an index, highest score first. */
  List<String> rangeNewestFirst(String indexKey, int limit);
}
