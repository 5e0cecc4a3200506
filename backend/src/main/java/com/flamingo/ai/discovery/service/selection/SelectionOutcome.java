package com.flamingo.ai.discovery.service.selection;

import com.flamingo.ai.discovery.domain.model.Candidate;
import com.flamingo.ai.discovery.domain.model.SelectionResult;
import java.util.List;

/**
 * Selection together with the candidates it resolved to, in the model's order.
 *
 * @param model model that answered
 * @param provider provider label of the completion
 */
public record SelectionOutcome(
    SelectionResult result, List<Candidate> selected, String model, String provider) {

  public SelectionOutcome {
    selected = selected == null ? List.of() : List.copyOf(selected);
  }

  public boolean isEmpty() {
    return selected.isEmpty();
  }
}
