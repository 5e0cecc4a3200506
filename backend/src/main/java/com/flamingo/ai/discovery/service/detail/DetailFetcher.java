package com.flamingo.ai.discovery.service.detail;

import com.flamingo.ai.discovery.cache.DiscoveryCache;
import com.flamingo.ai.discovery.catalog.CatalogClient;
import com.flamingo.ai.discovery.catalog.dto.CatalogPage;
import com.flamingo.ai.discovery.catalog.dto.CatalogPlaylist;
import com.flamingo.ai.discovery.catalog.dto.CatalogTrackItem;
import com.flamingo.ai.discovery.config.DiscoveryConfig;
import com.flamingo.ai.discovery.domain.enums.Provenance;
import com.flamingo.ai.discovery.domain.model.FetchedDetail;
import com.flamingo.ai.discovery.domain.model.PlaylistDetail;
import com.flamingo.ai.discovery.domain.model.RequestIdentity;
import com.flamingo.ai.discovery.domain.model.SampledTrack;
import com.flamingo.ai.discovery.domain.model.TrackArtist;
import com.flamingo.ai.discovery.exception.CatalogAuthException;
import com.flamingo.ai.discovery.exception.CatalogException;
import com.flamingo.ai.discovery.progress.ProgressTracker;
import com.flamingo.ai.discovery.service.pacing.PacedSequencer;
import com.flamingo.ai.discovery.service.pacing.Sleeper;
import com.flamingo.ai.discovery.service.pacing.StepOutcome;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Cache-aside playlist details: metadata, the first sampled tracks and the artists across them.
 * Playlists are processed one at a time, pausing after each one that needed the catalog.
 *
 * <p>A playlist whose fetch fails is dropped and the batch goes on. A rejected access token is the
 * exception to that rule: {@link CatalogAuthException} aborts the whole batch, since every later
 * playlist would be rejected the same way.
 */
@Service
@Slf4j
public class DetailFetcher {

  private final CatalogClient catalogClient;
  private final DiscoveryCache cache;
  private final MeterRegistry meterRegistry;
  private final int trackPageSize;
  private final PacedSequencer trackPager;
  private final PacedSequencer detailPager;

  public DetailFetcher(
      CatalogClient catalogClient,
      DiscoveryCache cache,
      DiscoveryConfig discoveryConfig,
      Sleeper sleeper,
      MeterRegistry meterRegistry) {
    DiscoveryConfig.Catalog catalog = discoveryConfig.getCatalog();
    this.catalogClient = catalogClient;
    this.cache = cache;
    this.meterRegistry = meterRegistry;
    this.trackPageSize = catalog.getTrackPageSize();
    this.trackPager = new PacedSequencer(catalog.getTrackPageDelay(), sleeper);
    this.detailPager = new PacedSequencer(catalog.getDetailDelay(), sleeper);
  }

  /**
   * Returns one playlist's detail, from the cache when present.
   *
   * @throws CatalogException when the playlist cannot be fetched
   */
  public FetchedDetail fetch(RequestIdentity identity, String playlistId, int trackSampleSize) {
    Optional<PlaylistDetail> cached = cache.findDetail(playlistId);
    if (cached.isPresent()) {
      log.debug("Detail cache hit for playlist {}", playlistId);
      return new FetchedDetail(cached.get(), Provenance.FROM_CACHE);
    }

    log.debug("Fetching playlist {} from catalog", playlistId);
    CatalogPlaylist playlist = catalogClient.getPlaylist(identity.accessToken(), playlistId);
    List<SampledTrack> tracks = sampleTracks(identity, playlistId, trackSampleSize);
    PlaylistDetail detail =
        new PlaylistDetail(
            playlist.id() != null ? playlist.id() : playlistId,
            playlist.name() != null ? playlist.name() : "Untitled",
            playlist.ownerName(),
            playlist.description() != null ? playlist.description() : "",
            playlist.followerTotal(),
            playlist.trackTotal(),
            tracks,
            uniqueArtists(tracks),
            playlist.images());
    cache.saveDetail(detail);
    return new FetchedDetail(detail, Provenance.FROM_API);
  }

  /**
   * Fetches details for each id in order. A failed playlist is logged and dropped; a rejected
   * access token aborts the batch since every later call would fail the same way.
   */
  @Timed(value = "discovery.details", description = "Time to fetch playlist details")
  public DetailBatch fetchAll(
      RequestIdentity identity,
      List<String> playlistIds,
      int trackSampleSize,
      ProgressTracker tracker) {
    List<FetchedDetail> fetched = new ArrayList<>();
    List<String> dropped = new ArrayList<>();
    int total = playlistIds.size();

    detailPager.forEach(
        playlistIds,
        (playlistId, index) -> {
          tracker.item(
              "Fetching playlist details (%d/%d)...".formatted(index + 1, total),
              index,
              total,
              false);
          try {
            FetchedDetail detail = fetch(identity, playlistId, trackSampleSize);
            fetched.add(detail);
            tracker.item(
                "Loaded \"%s\" (%s)"
                    .formatted(detail.detail().name(), detail.provenance().getWireName()),
                index,
                total,
                true);
            return detail.fromCache() ? StepOutcome.local() : StepOutcome.upstream();
          } catch (CatalogAuthException e) {
            throw e;
          } catch (CatalogException e) {
            log.warn("Dropping playlist {}: {}", playlistId, e.getMessage());
            meterRegistry.counter("discovery.playlists.dropped", "stage", "details").increment();
            dropped.add(playlistId);
            return StepOutcome.upstream();
          }
        });

    DetailBatch batch = new DetailBatch(fetched, dropped);
    log.info(
        "Fetched {}/{} playlist details ({} from cache, {} from catalog)",
        fetched.size(),
        total,
        batch.fromCacheIds().size(),
        batch.fromApiIds().size());
    return batch;
  }

  private List<SampledTrack> sampleTracks(
      RequestIdentity identity, String playlistId, int trackSampleSize) {
    List<SampledTrack> tracks = new ArrayList<>();
    int maxPages = (trackSampleSize + trackPageSize - 1) / trackPageSize;
    trackPager.run(
        maxPages,
        page -> {
          int offset = page * trackPageSize;
          int limit = Math.min(trackPageSize, trackSampleSize - offset);
          CatalogPage<CatalogTrackItem> result =
              catalogClient.getPlaylistTracks(identity.accessToken(), playlistId, limit, offset);
          for (CatalogTrackItem item : result.nonNullItems()) {
            if (item.track() != null && item.track().id() != null) {
              tracks.add(toSampledTrack(item.track()));
            }
          }
          return result.rawSize() < limit ? StepOutcome.stop() : StepOutcome.upstream();
        },
        null);
    return tracks.size() > trackSampleSize ? tracks.subList(0, trackSampleSize) : tracks;
  }

  private static SampledTrack toSampledTrack(CatalogTrackItem.Track track) {
    List<TrackArtist> artists =
        track.artists() == null
            ? List.of()
            : track.artists().stream()
                .filter(artist -> artist != null)
                .map(artist -> new TrackArtist(artist.id(), artist.name()))
                .toList();
    return new SampledTrack(track.id(), track.name(), artists, track.durationMs(), track.uri());
  }

  private static List<String> uniqueArtists(List<SampledTrack> tracks) {
    Set<String> names = new LinkedHashSet<>();
    for (SampledTrack track : tracks) {
      for (TrackArtist artist : track.artists()) {
        if (artist.name() != null && !artist.name().isBlank()) {
          names.add(artist.name());
        }
      }
    }
    return new ArrayList<>(names);
  }
}
