package com.flamingo.ai.discovery.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.discovery.domain.model.Candidate;
import com.flamingo.ai.discovery.domain.model.DiscoveryResult;
import com.flamingo.ai.discovery.service.discovery.CandidateSelection;
import com.flamingo.ai.discovery.service.selection.SelectionOutcome;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the search-and-select call. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SelectionResponse {

  private String query;
  private List<Candidate> selectedPlaylists;
  private String llmReasoning;
  private Integer totalSearchResults;
  private String model;
  private String provider;
  private String message;

  public static SelectionResponse from(CandidateSelection selection) {
    SelectionOutcome outcome = selection.selection();
    if (outcome == null) {
      return SelectionResponse.builder()
          .query(selection.query())
          .selectedPlaylists(List.of())
          .message(DiscoveryResult.NO_PLAYLISTS_FOUND)
          .build();
    }
    return SelectionResponse.builder()
        .query(selection.query())
        .selectedPlaylists(outcome.selected())
        .llmReasoning(outcome.result().reasoning())
        .totalSearchResults(selection.totalSearchResults())
        .model(outcome.model())
        .provider(outcome.provider())
        .message(outcome.isEmpty() ? DiscoveryResult.NO_SUITABLE_PLAYLISTS : null)
        .build();
  }
}
