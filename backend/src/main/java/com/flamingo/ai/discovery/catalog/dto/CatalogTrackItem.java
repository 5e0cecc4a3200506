package com.flamingo.ai.discovery.catalog.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Entry of a playlist track listing. The track itself may be null for removed items. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogTrackItem(Track track) {

  /** Track object. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Track(
      String id,
      String name,
      List<Artist> artists,
      @JsonProperty("duration_ms") Integer durationMs,
      String uri) {}

  /** Simplified artist object. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Artist(String id, String name) {}
}
