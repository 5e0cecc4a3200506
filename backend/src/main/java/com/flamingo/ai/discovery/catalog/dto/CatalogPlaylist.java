package com.flamingo.ai.discovery.catalog.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.discovery.domain.model.PlaylistImage;
import java.util.List;

/** Playlist object as returned by catalog search and playlist lookup. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogPlaylist(
    String id,
    String name,
    String description,
    Owner owner,
    Total tracks,
    Total followers,
    @JsonProperty("public") Boolean isPublic,
    List<PlaylistImage> images) {

  public String ownerName() {
    return owner != null && owner.displayName() != null ? owner.displayName() : "Unknown";
  }

  public int trackTotal() {
    return tracks != null && tracks.total() != null ? tracks.total() : 0;
  }

  public int followerTotal() {
    return followers != null && followers.total() != null ? followers.total() : 0;
  }

  /** Playlist owner. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Owner(String id, @JsonProperty("display_name") String displayName) {}

  /** Wrapper objects such as {@code {"total": 12}}. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Total(Integer total) {}
}
