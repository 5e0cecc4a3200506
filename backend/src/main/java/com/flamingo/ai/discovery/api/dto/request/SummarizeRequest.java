package com.flamingo.ai.discovery.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for summarizing a single playlist. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SummarizeRequest {

  @NotBlank(message = "Playlist id is required")
  private String playlistId;

  /** Query to analyse against. If null, the playlist is described on its own. */
  private String originalQuery;

  private String model;
  private Integer trackSampleSize;
}
