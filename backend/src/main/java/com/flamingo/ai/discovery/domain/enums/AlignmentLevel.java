package com.flamingo.ai.discovery.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Coarse categorical strength of a playlist's match against a query. */
public enum AlignmentLevel {
  STRONG,
  MODERATE,
  WEAK,
  TANGENTIAL;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Resolves a wire value case-insensitively.
   *
   * @param value the raw value, may be null
   * @return the matching level, or null if the value is not a known level
   */
  @JsonCreator
  public static AlignmentLevel fromWire(String value) {
    if (value == null) {
      return null;
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    for (AlignmentLevel level : values()) {
      if (level.name().equals(normalized)) {
        return level;
      }
    }
    return null;
  }
}
