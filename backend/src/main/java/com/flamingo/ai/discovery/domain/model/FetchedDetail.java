package com.flamingo.ai.discovery.domain.model;

import com.flamingo.ai.discovery.domain.enums.Provenance;

/** A playlist detail together with where it was obtained. */
public record FetchedDetail(PlaylistDetail detail, Provenance provenance) {

  public boolean fromCache() {
    return provenance == Provenance.FROM_CACHE;
  }
}
