package com.flamingo.ai.discovery.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Where a piece of playlist data came from during one request. */
public enum Provenance {
  FROM_CACHE("fromCache"),
  FROM_API("fromAPI");

  private final String wireName;

  Provenance(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String getWireName() {
    return wireName;
  }
}
