package com.flamingo.ai.discovery.domain.model;

import java.util.List;

/** A playlist returned by catalog search, not yet analyzed. Lives for one request only. */
public record Candidate(
    String id,
    String name,
    String description,
    String owner,
    int trackCount,
    int followerCount,
    boolean isPublic,
    List<PlaylistImage> images) {

  public Candidate {
    images = images == null ? List.of() : List.copyOf(images);
  }
}
