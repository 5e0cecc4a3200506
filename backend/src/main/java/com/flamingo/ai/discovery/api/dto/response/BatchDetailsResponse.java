package com.flamingo.ai.discovery.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.discovery.domain.model.PlaylistDetail;
import com.flamingo.ai.discovery.service.detail.DetailBatch;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for batch playlist details. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchDetailsResponse {

  private List<PlaylistDetail> playlists;
  private int totalArtists;
  private List<String> fetchedFromCache;

  @JsonProperty("fetchedFromAPI")
  private List<String> fetchedFromApi;

  public static BatchDetailsResponse from(DetailBatch batch) {
    return BatchDetailsResponse.builder()
        .playlists(batch.details())
        .totalArtists(batch.totalArtists())
        .fetchedFromCache(batch.fromCacheIds())
        .fetchedFromApi(batch.fromApiIds())
        .build();
  }
}
