package com.flamingo.ai.discovery.domain.model;

import java.util.List;
import java.util.stream.Collectors;

/** One track from the sampled head of a playlist. */
public record SampledTrack(
    String id, String name, List<TrackArtist> artists, Integer durationMs, String uri) {

  public SampledTrack {
    artists = artists == null ? List.of() : List.copyOf(artists);
  }

  /** Comma-separated artist names, as quoted in prompts. */
  public String artistNames() {
    return artists.stream().map(TrackArtist::name).collect(Collectors.joining(", "));
  }
}
