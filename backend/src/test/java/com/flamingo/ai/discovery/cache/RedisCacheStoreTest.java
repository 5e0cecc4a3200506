package com.flamingo.ai.discovery.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.ZSetOperations;

@ExtendWith(MockitoExtension.class)
class RedisCacheStoreTest {

  @Mock private StringRedisTemplate redisTemplate;
  @Mock private ValueOperations<String, String> valueOperations;
  @Mock private ZSetOperations<String, String> zSetOperations;

  private SimpleMeterRegistry meterRegistry;
  private RedisCacheStore store;

  @BeforeEach
  void setUp() {
    when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    when(redisTemplate.opsForZSet()).thenReturn(zSetOperations);
    meterRegistry = new SimpleMeterRegistry();
    store = new RedisCacheStore(redisTemplate, meterRegistry);
  }

  @Test
  @DisplayName("should write values with their TTL")
  void shouldSetWithTtl() {
    store.set("k", "v", Duration.ofHours(24));

    verify(valueOperations).set("k", "v", Duration.ofHours(24));
  }

  @Test
  @DisplayName("should trim the index to the cap after adding")
  void shouldTrimIndexAfterAdd() {
    store.appendToIndex("history", "member", 42.0, 100);

    verify(zSetOperations).add("history", "member", 42.0);
    verify(zSetOperations).removeRange("history", 0, -101);
  }

  @Test
  @DisplayName("should read indexes highest score first")
  void shouldReverseRange() {
    when(zSetOperations.reverseRange("history", 0, 9))
        .thenReturn(new LinkedHashSet<>(List.of("b", "a")));

    assertThat(store.rangeNewestFirst("history", 10)).containsExactly("b", "a");
  }

  @Test
  @DisplayName("should degrade to a miss when Redis is unreachable")
  void shouldDegradeToMiss_whenReadFails() {
    when(valueOperations.get(anyString()))
        .thenThrow(new RedisConnectionFailureException("connection refused"));

    assertThat(store.get("k")).isEmpty();
    assertThat(
            meterRegistry.counter("discovery.cache", "store", "redis", "result", "error").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("should swallow write failures")
  void shouldIgnoreWriteFailure() {
    when(zSetOperations.add("history", "m", 1.0))
        .thenThrow(new RedisConnectionFailureException("connection refused"));

    store.appendToIndex("history", "m", 1.0, 100);

    assertThat(
            meterRegistry
                .counter("discovery.cache", "store", "redis", "result", "write_error")
                .count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("should count hits and misses")
  void shouldCountHitsAndMisses() {
    when(valueOperations.get("present")).thenReturn("{}");
    when(valueOperations.get("absent")).thenReturn(null);

    assertThat(store.get("present")).contains("{}");
    assertThat(store.get("absent")).isEmpty();
    assertThat(meterRegistry.counter("discovery.cache", "store", "redis", "result", "hit").count())
        .isEqualTo(1.0);
    assertThat(meterRegistry.counter("discovery.cache", "store", "redis", "result", "miss").count())
        .isEqualTo(1.0);
  }
}
