package com.flamingo.ai.discovery.domain.model;

import com.flamingo.ai.discovery.domain.enums.AlignmentLevel;
import java.util.List;

/** A playlist's detail merged with its summary, as returned to the caller. */
public record RankedPlaylist(
    String id,
    String name,
    String owner,
    String description,
    int followers,
    int trackCount,
    List<PlaylistImage> images,
    List<String> uniqueArtists,
    String summary,
    AlignmentLevel alignmentLevel,
    PlaylistCharacteristics characteristics,
    double matchScore,
    String reasoning) {

  public static RankedPlaylist merge(PlaylistDetail detail, PlaylistSummary summary) {
    return new RankedPlaylist(
        detail.id(),
        detail.name(),
        detail.owner(),
        detail.description(),
        detail.followerCount(),
        detail.trackCount(),
        detail.images(),
        detail.uniqueArtists(),
        summary.summaryText(),
        summary.alignmentLevel(),
        summary.characteristics(),
        summary.matchScore(),
        summary.reasoning());
  }
}
