package com.flamingo.ai.discovery.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a discovery run. Limits are optional; out-of-range values are clamped rather
 * than rejected.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscoveryRequest {

  @NotBlank(message = "Query is required")
  @Size(max = 500, message = "Query must not exceed 500 characters")
  private String query;

  /** Optional model id. If null, uses the configured default model. */
  private String model;

  private Integer playlistLimit;
  private Integer trackSampleSize;
  private Integer renderLimit;
}
