package com.flamingo.ai.discovery.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final output of one discovery request. Playlists are sorted by match score, highest first.
 * Empty results carry only the query, an empty list and a message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiscoveryResult(
    String query,
    List<RankedPlaylist> playlists,
    Integer totalSearchResults,
    Integer selectedCount,
    Integer finalCount,
    Map<String, String> phases,
    String message) {

  public static final String NO_PLAYLISTS_FOUND = "No playlists found for this query";
  public static final String NO_SUITABLE_PLAYLISTS = "No suitable playlists found";

  public DiscoveryResult {
    playlists = playlists == null ? List.of() : List.copyOf(playlists);
  }

  public static DiscoveryResult empty(String query, String message) {
    return new DiscoveryResult(query, List.of(), null, null, null, null, message);
  }

  public static DiscoveryResult completed(
      String query, List<RankedPlaylist> playlists, int totalSearchResults, int selectedCount) {
    Map<String, String> phases = new LinkedHashMap<>();
    phases.put("search", "complete");
    phases.put("selection", "llm");
    phases.put("details", "complete");
    phases.put("summarization", "complete");
    return new DiscoveryResult(
        query, playlists, totalSearchResults, selectedCount, playlists.size(), phases, null);
  }
}
