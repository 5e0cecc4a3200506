package com.flamingo.ai.discovery.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.discovery.domain.enums.AlignmentLevel;
import com.flamingo.ai.discovery.domain.model.PlaylistCharacteristics;
import com.flamingo.ai.discovery.domain.model.PlaylistSummary;
import com.flamingo.ai.discovery.service.summary.SummaryOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a single playlist summary. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SummaryResponse {

  private String playlistId;
  private String summary;
  private AlignmentLevel alignmentLevel;
  private PlaylistCharacteristics characteristics;
  private double matchScore;
  private String reasoning;
  private String model;
  private String provider;
  private boolean fromCache;

  public static SummaryResponse from(SummaryOutcome outcome) {
    PlaylistSummary summary = outcome.summary();
    return SummaryResponse.builder()
        .playlistId(summary.playlistId())
        .summary(summary.summaryText())
        .alignmentLevel(summary.alignmentLevel())
        .characteristics(summary.characteristics())
        .matchScore(summary.matchScore())
        .reasoning(summary.reasoning())
        .model(summary.model())
        .provider(summary.provider())
        .fromCache(outcome.fromCache())
        .build();
  }
}
