package com.flamingo.ai.discovery.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Ordered, duplicate-free playlist ids chosen for deep analysis, in the order the model returned
 * them.
 */
public record SelectionResult(List<String> selectedIds, String reasoning) {

  public SelectionResult {
    selectedIds =
        selectedIds == null
            ? List.of()
            : selectedIds.stream().filter(Objects::nonNull).map(String::trim).distinct().toList();
  }

  public boolean isEmpty() {
    return selectedIds.isEmpty();
  }
}
