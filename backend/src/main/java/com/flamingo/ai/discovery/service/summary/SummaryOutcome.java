package com.flamingo.ai.discovery.service.summary;

import com.flamingo.ai.discovery.domain.enums.Provenance;
import com.flamingo.ai.discovery.domain.model.PlaylistSummary;

/** A summary together with where it came from. */
public record SummaryOutcome(PlaylistSummary summary, Provenance provenance) {

  public boolean fromCache() {
    return provenance == Provenance.FROM_CACHE;
  }
}
