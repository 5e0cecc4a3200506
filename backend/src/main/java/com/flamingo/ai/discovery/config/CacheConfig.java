package com.flamingo.ai.discovery.config;

import com.flamingo.ai.discovery.cache.CacheStore;
import com.flamingo.ai.discovery.cache.InMemoryCacheStore;
import com.flamingo.ai.discovery.cache.RedisCacheStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/** Selects the cache backend from {@code discovery.cache.store}. */
@Configuration
@Slf4j
public class CacheConfig {

  @Bean
  public CacheStore cacheStore(
      DiscoveryConfig discoveryConfig,
      ObjectProvider<StringRedisTemplate> redisTemplate,
      MeterRegistry meterRegistry,
      Clock clock) {
    String store = discoveryConfig.getCache().getStore();
    if ("memory".equalsIgnoreCase(store)) {
      log.info("Using in-memory discovery cache");
      return new InMemoryCacheStore(clock);
    }
    StringRedisTemplate template = redisTemplate.getIfAvailable();
    if (template == null) {
      log.warn(
          "Cache store '{}' requested but no Redis template is configured; using memory", store);
      return new InMemoryCacheStore(clock);
    }
    log.info("Using Redis discovery cache");
    return new RedisCacheStore(template, meterRegistry);
  }
}
