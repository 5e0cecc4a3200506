package com.flamingo.ai.discovery.cache;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.util.StringUtils;

/** {@link CacheStore} on Redis strings (values) and sorted sets (indexes). */
@Slf4j
public class RedisCacheStore implements CacheStore {

  private final StringRedisTemplate redisTemplate;
  private final ValueOperations<String, String> valueOperations;
  private final ZSetOperations<String, String> zSetOperations;
  private final MeterRegistry meterRegistry;

  public RedisCacheStore(StringRedisTemplate redisTemplate, MeterRegistry meterRegistry) {
    this.redisTemplate = redisTemplate;
    this.valueOperations = redisTemplate.opsForValue();
    this.zSetOperations = redisTemplate.opsForZSet();
    this.meterRegistry = meterRegistry;
  }

  @Override
  public Optional<String> get(String key) {
    try {
      String value = valueOperations.get(key);
      if (!StringUtils.hasText(value)) {
        record("miss");
        return Optional.empty();
      }
      record("hit");
      return Optional.of(value);
    } catch (RuntimeException e) {
      log.warn("Redis read failed for key {}, treating as cache miss: {}", key, e.getMessage());
      record("error");
      return Optional.empty();
    }
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    try {
      if (ttl != null && !ttl.isZero() && !ttl.isNegative()) {
        valueOperations.set(key, value, ttl);
      } else {
        valueOperations.set(key, value);
      }
      record("write");
    } catch (RuntimeException e) {
      log.warn("Redis write failed for key {}: {}", key, e.getMessage());
      record("write_error");
    }
  }

  @Override
  public boolean exists(String key) {
    try {
      return Boolean.TRUE.equals(redisTemplate.hasKey(key));
    } catch (RuntimeException e) {
      log.warn("Redis exists check failed for key {}: {}", key, e.getMessage());
      record("error");
      return false;
    }
  }

  @Override
  public void appendToIndex(String indexKey, String member, double score, int cap) {
    try {
      zSetOperations.add(indexKey, member, score);
      // keep only the `cap` highest-scored members
      zSetOperations.removeRange(indexKey, 0, -(long) cap - 1);
      record("index_write");
    } catch (RuntimeException e) {
      log.warn("Redis index append failed for {}: {}", indexKey, e.getMessage());
      record("write_error");
    }
  }

  @Override
  public List<String> rangeNewestFirst(String indexKey, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    try {
      Set<String> members = zSetOperations.reverseRange(indexKey, 0, limit - 1L);
      return members == null ? List.of() : new ArrayList<>(members);
    } catch (RuntimeException e) {
      log.warn("Redis index read failed for {}: {}", indexKey, e.getMessage());
      record("error");
      return List.of();
    }
  }

  private void record(String result) {
    meterRegistry.counter("discovery.cache", "store", "redis", "result", result).increment();
  }
}
