package com.flamingo.ai.discovery.catalog.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** One page of a paginated catalog listing. Items may contain nulls on the wire. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogPage<T>(List<T> items, Integer total, Integer limit, Integer offset) {

  /** Items with null entries removed. */
  public List<T> nonNullItems() {
    if (items == null) {
      return List.of();
    }
    List<T> result = new ArrayList<>(items.size());
    items.stream().filter(Objects::nonNull).forEach(result::add);
    return result;
  }

  /** Size of the raw page, nulls included; used to detect the end of results. */
  public int rawSize() {
    return items == null ? 0 : items.size();
  }
}
