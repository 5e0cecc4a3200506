package com.flamingo.ai.discovery.service.detail;

import com.flamingo.ai.discovery.domain.model.FetchedDetail;
import com.flamingo.ai.discovery.domain.model.PlaylistDetail;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Details fetched for a list of playlist ids, in request order.
 *
 * @param droppedIds ids whose fetch failed and were left out
 */
public record DetailBatch(List<FetchedDetail> fetched, List<String> droppedIds) {

  public DetailBatch {
    fetched = fetched == null ? List.of() : List.copyOf(fetched);
    droppedIds = droppedIds == null ? List.of() : List.copyOf(droppedIds);
  }

  public List<PlaylistDetail> details() {
    return fetched.stream().map(FetchedDetail::detail).toList();
  }

  public List<String> fromCacheIds() {
    return fetched.stream().filter(FetchedDetail::fromCache).map(f -> f.detail().id()).toList();
  }

  public List<String> fromApiIds() {
    return fetched.stream().filter(f -> !f.fromCache()).map(f -> f.detail().id()).toList();
  }

  /** Distinct artist names across all fetched playlists. */
  public int totalArtists() {
    Set<String> artists = new LinkedHashSet<>();
    fetched.forEach(f -> artists.addAll(f.detail().uniqueArtists()));
    return artists.size();
  }
}
