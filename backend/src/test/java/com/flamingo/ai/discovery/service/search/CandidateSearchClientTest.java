package com.flamingo.ai.discovery.service.search;

import static com.flamingo.ai.discovery.support.DiscoveryFixtures.IDENTITY;
import static com.flamingo.ai.discovery.support.DiscoveryFixtures.catalogPlaylist;
import static com.flamingo.ai.discovery.support.DiscoveryFixtures.searchPage;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.discovery.catalog.CatalogClient;
import com.flamingo.ai.discovery.catalog.dto.CatalogPage;
import com.flamingo.ai.discovery.catalog.dto.CatalogPlaylist;
import com.flamingo.ai.discovery.config.DiscoveryConfig;
import com.flamingo.ai.discovery.domain.enums.DiscoveryPhase;
import com.flamingo.ai.discovery.domain.model.Candidate;
import com.flamingo.ai.discovery.progress.ProgressEvent;
import com.flamingo.ai.discovery.progress.ProgressTracker;
import com.flamingo.ai.discovery.support.RecordingProgressPublisher;
import com.flamingo.ai.discovery.support.RecordingSleeper;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CandidateSearchClientTest {

  @Mock private CatalogClient catalogClient;

  private RecordingSleeper sleeper;
  private RecordingProgressPublisher publisher;
  private ProgressTracker tracker;
  private CandidateSearchClient searchClient;

  @BeforeEach
  void setUp() {
    sleeper = new RecordingSleeper();
    publisher = new RecordingProgressPublisher();
    tracker = new ProgressTracker(publisher, Clock.systemUTC(), "user-1", "session-1");
    tracker.enter(DiscoveryPhase.SEARCHING);
    searchClient = new CandidateSearchClient(catalogClient, new DiscoveryConfig(), sleeper);
  }

  @Test
  @DisplayName("should issue a single small request for a limit of one")
  void shouldFetchOnePage_whenLimitIsOne() {
    // Given
    when(catalogClient.searchPlaylists("access-token", "lofi", 1, 0)).thenReturn(searchPage(0, 1));

    // When
    SearchOutcome outcome = searchClient.search(IDENTITY, "lofi", 1, tracker);

    // Then
    assertThat(outcome.candidates()).hasSize(1);
    assertThat(outcome.pagesFetched()).isEqualTo(1);
    assertThat(sleeper.getSleeps()).isEmpty();
  }

  @Test
  @DisplayName("should page through 50, 50 and 20 with a fixed pause between pages")
  void shouldPaginate_whenLimitSpansPages() {
    // Given
    when(catalogClient.searchPlaylists("access-token", "lofi", 50, 0))
        .thenReturn(searchPage(0, 50));
    when(catalogClient.searchPlaylists("access-token", "lofi", 50, 50))
        .thenReturn(searchPage(50, 50));
    when(catalogClient.searchPlaylists("access-token", "lofi", 20, 100))
        .thenReturn(searchPage(100, 20));

    // When
    SearchOutcome outcome = searchClient.search(IDENTITY, "lofi", 120, tracker);

    // Then
    assertThat(outcome.candidates()).hasSize(120);
    assertThat(outcome.candidates().get(0).id()).isEqualTo("p0");
    assertThat(outcome.candidates().get(119).id()).isEqualTo("p119");
    assertThat(outcome.pagesFetched()).isEqualTo(3);
    assertThat(sleeper.getSleeps()).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(2));
    assertThat(publisher.getEvents())
        .filteredOn(event -> event.metadata() != null)
        .filteredOn(event -> Boolean.TRUE.equals(event.metadata().get("isRateLimitDelay")))
        .hasSize(2);
  }

  @Test
  @DisplayName("should stop at the first short page")
  void shouldStop_whenPageIsShort() {
    when(catalogClient.searchPlaylists("access-token", "rare", 50, 0))
        .thenReturn(searchPage(0, 30));

    SearchOutcome outcome = searchClient.search(IDENTITY, "rare", 120, tracker);

    assertThat(outcome.candidates()).hasSize(30);
    verify(catalogClient).searchPlaylists("access-token", "rare", 50, 0);
    verifyNoMoreInteractions(catalogClient);
    assertThat(sleeper.getSleeps()).isEmpty();
  }

  @Test
  @DisplayName("should skip null entries and playlists without an id")
  void shouldSkipNullEntries() {
    CatalogPage<CatalogPlaylist> page =
        new CatalogPage<>(
            Arrays.asList(catalogPlaylist("a", 10), null, catalogPlaylist(null, 10)), 3, 3, 0);
    when(catalogClient.searchPlaylists("access-token", "q", 3, 0)).thenReturn(page);

    SearchOutcome outcome = searchClient.search(IDENTITY, "q", 3, tracker);

    assertThat(outcome.candidates()).extracting(Candidate::id).containsExactly("a");
  }

  @Test
  @DisplayName("should report page progress with batch metadata")
  void shouldReportPageProgress() {
    when(catalogClient.searchPlaylists("access-token", "q", 10, 0)).thenReturn(searchPage(0, 10));

    searchClient.search(IDENTITY, "q", 10, tracker);

    ProgressEvent event = publisher.getEvents().get(0);
    assertThat(event.metadata())
        .containsEntry("batchNumber", 1)
        .containsEntry("totalBatches", 1)
        .containsEntry("playlistsFetched", 10)
        .containsEntry("targetTotal", 10);
    assertThat(event.progress()).isEqualTo(5.0);
  }

  @Test
  @DisplayName("should compute the number of pages for a limit")
  void shouldComputeRequiredPages() {
    assertThat(searchClient.requiredPages(1)).isEqualTo(1);
    assertThat(searchClient.requiredPages(50)).isEqualTo(1);
    assertThat(searchClient.requiredPages(51)).isEqualTo(2);
    assertThat(searchClient.requiredPages(200)).isEqualTo(4);
  }
}
