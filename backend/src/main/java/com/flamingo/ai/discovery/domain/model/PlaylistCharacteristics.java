package com.flamingo.ai.discovery.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/** Structured musical characteristics extracted by the summarizer. All fields are optional. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlaylistCharacteristics(
    String primaryGenre,
    String mood,
    List<String> instrumentation,
    String tempo,
    String decadeRange) {

  /** Used when the model returned no characteristics at all. */
  public static PlaylistCharacteristics fallback() {
    return new PlaylistCharacteristics("Various", "Mixed", null, "Varied", null);
  }
}
