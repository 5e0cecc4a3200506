package com.flamingo.ai.discovery.cache;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.discovery.config.DiscoveryConfig;
import com.flamingo.ai.discovery.domain.model.HistoryRecord;
import com.flamingo.ai.discovery.domain.model.PlaylistDetail;
import com.flamingo.ai.discovery.domain.model.PlaylistSummary;
import com.flamingo.ai.discovery.support.DiscoveryFixtures;
import com.flamingo.ai.discovery.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DiscoveryCacheTest {

  private MutableClock clock;
  private InMemoryCacheStore store;
  private DiscoveryCache cache;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    store = new InMemoryCacheStore(clock);
    cache = new DiscoveryCache(store, new ObjectMapper(), new DiscoveryConfig());
  }

  @Nested
  @DisplayName("Playlist details")
  class Details {

    @Test
    @DisplayName("should round trip a detail and expire it after 24 hours")
    void shouldExpireDetailAfterDay() {
      PlaylistDetail detail = DiscoveryFixtures.detail("p1", "Artist A", "Artist B");
      cache.saveDetail(detail);

      assertThat(cache.findDetail("p1")).contains(detail);

      clock.advance(Duration.ofHours(24));
      assertThat(cache.findDetail("p1")).isEmpty();
    }

    @Test
    @DisplayName("should treat a corrupt value as a miss")
    void shouldTreatCorruptValueAsMiss() {
      store.set(new CacheKeys("").detail("p1"), "{not json", Duration.ofHours(1));

      assertThat(cache.findDetail("p1")).isEmpty();
    }
  }

  @Nested
  @DisplayName("Summaries")
  class Summaries {

    @Test
    @DisplayName("should share a summary across case and whitespace variants of the query")
    void shouldNormalizeQuery() {
      PlaylistSummary summary = DiscoveryFixtures.summary("p1", 0.8);
      cache.saveSummary(summary, "Lofi Beats");

      assertThat(cache.findSummary("p1", "  lofi beats ")).contains(summary);
      assertThat(cache.findSummary("p1", "jazz")).isEmpty();
    }

    @Test
    @DisplayName("should keep summaries for seven days")
    void shouldExpireSummaryAfterWeek() {
      cache.saveSummary(DiscoveryFixtures.summary("p1", 0.8), "q");

      clock.advance(Duration.ofDays(6));
      assertThat(cache.findSummary("p1", "q")).isPresent();

      clock.advance(Duration.ofDays(1));
      assertThat(cache.findSummary("p1", "q")).isEmpty();
    }
  }

  @Test
  @DisplayName("should return history newest first and skip unreadable entries")
  void shouldReadHistoryNewestFirst() {
    cache.appendHistory("u1", new HistoryRecord("h1", "first", "m", 1000L, 3));
    cache.appendHistory("u1", new HistoryRecord("h2", "second", "m", 2000L, 5));
    store.appendToIndex(new CacheKeys("").history("u1"), "garbage", 1500, 100);

    assertThat(cache.history("u1"))
        .extracting(HistoryRecord::searchHash)
        .containsExactly("h2", "h1");
    assertThat(cache.history("someone-else")).isEmpty();
  }
}
