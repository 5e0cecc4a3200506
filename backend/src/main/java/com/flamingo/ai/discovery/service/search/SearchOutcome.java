package com.flamingo.ai.discovery.service.search;

import com.flamingo.ai.discovery.domain.model.Candidate;
import java.util.List;

/** Candidates collected by a paginated search, in catalog order. */
public record SearchOutcome(List<Candidate> candidates, int pagesFetched) {

  public SearchOutcome {
    candidates = candidates == null ? List.of() : List.copyOf(candidates);
  }

  public boolean isEmpty() {
    return candidates.isEmpty();
  }
}
