package com.flamingo.ai.discovery.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link CacheStore}. Used for local runs without Redis and in tests; expiry is
 * evaluated lazily against the injected clock.
 */
public class InMemoryCacheStore implements CacheStore {

  private final Clock clock;
  private final Map<String, Entry> values = new ConcurrentHashMap<>();
  private final Map<String, List<IndexMember>> indexes = new ConcurrentHashMap<>();

  public InMemoryCacheStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public Optional<String> get(String key) {
    Entry entry = values.get(key);
    if (entry == null) {
      return Optional.empty();
    }
    if (entry.isExpired(clock.instant())) {
      values.remove(key, entry);
      return Optional.empty();
    }
    return Optional.of(entry.value());
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    Instant expiresAt =
        ttl == null || ttl.isZero() || ttl.isNegative() ? null : clock.instant().plus(ttl);
    values.put(key, new Entry(value, expiresAt));
  }

  @Override
  public boolean exists(String key) {
    return get(key).isPresent();
  }

  @Override
  public void appendToIndex(String indexKey, String member, double score, int cap) {
    indexes.compute(
        indexKey,
        (key, members) -> {
          List<IndexMember> updated =
              members == null ? new ArrayList<>() : new ArrayList<>(members);
          updated.removeIf(existing -> existing.member().equals(member));
          updated.add(new IndexMember(member, score));
          updated.sort(Comparator.comparingDouble(IndexMember::score).reversed());
          while (updated.size() > cap) {
            updated.remove(updated.size() - 1);
          }
          return updated;
        });
  }

  @Override
  public List<String> rangeNewestFirst(String indexKey, int limit) {
    List<IndexMember> members = indexes.getOrDefault(indexKey, List.of());
    return members.stream().limit(Math.max(0, limit)).map(IndexMember::member).toList();
  }

  private record Entry(String value, Instant expiresAt) {
    boolean isExpired(Instant now) {
      return expiresAt != null && !now.isBefore(expiresAt);
    }
  }

  private record IndexMember(String member, double score) {}
}
