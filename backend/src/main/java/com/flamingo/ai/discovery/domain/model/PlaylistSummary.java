package com.flamingo.ai.discovery.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.discovery.domain.enums.AlignmentLevel;

/**
 * LLM match analysis of one playlist against one query. Cached by (playlist id, normalized query
 * hash).
 *
 * @param matchScore always within [0, 1]
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlaylistSummary(
    String playlistId,
    String summaryText,
    AlignmentLevel alignmentLevel,
    PlaylistCharacteristics characteristics,
    double matchScore,
    String reasoning,
    String model,
    String provider) {

  public PlaylistSummary {
    matchScore = clampScore(matchScore);
  }

  public static double clampScore(double score) {
    if (Double.isNaN(score)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, score));
  }
}
