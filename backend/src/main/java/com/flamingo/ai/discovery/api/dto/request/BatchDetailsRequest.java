package com.flamingo.ai.discovery.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for fetching details of explicit playlists. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchDetailsRequest {

  @NotEmpty(message = "At least one playlist id is required")
  @Size(max = 10, message = "At most 10 playlists per request")
  private List<@NotBlank String> playlistIds;

  private Integer trackSampleSize;
}
