package com.flamingo.ai.discovery.service.discovery;

import com.flamingo.ai.discovery.service.search.SearchOutcome;
import com.flamingo.ai.discovery.service.selection.SelectionOutcome;

/**
 * Result of the search and selection phases.
 *
 * @param selection null when the search found nothing and no selection was attempted
 */
public record CandidateSelection(String query, SearchOutcome search, SelectionOutcome selection) {

  public int totalSearchResults() {
    return search.candidates().size();
  }
}
