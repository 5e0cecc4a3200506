package com.flamingo.ai.discovery.domain.model;

import java.util.List;

/**
 * Full metadata, sampled tracks and unique artists for one playlist. Query-independent, so it is
 * cached by playlist id and shared across users.
 *
 * @param trackCount total tracks in the playlist as reported by the catalog, not the sample size
 * @param uniqueArtists distinct artist names across the sampled tracks, in first-seen order
 */
public record PlaylistDetail(
    String id,
    String name,
    String owner,
    String description,
    int followerCount,
    int trackCount,
    List<SampledTrack> sampledTracks,
    List<String> uniqueArtists,
    List<PlaylistImage> images) {

  public PlaylistDetail {
    sampledTracks = sampledTracks == null ? List.of() : List.copyOf(sampledTracks);
    uniqueArtists = uniqueArtists == null ? List.of() : List.copyOf(uniqueArtists);
    images = images == null ? List.of() : List.copyOf(images);
  }
}
