package com.flamingo.ai.discovery.domain.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PlaylistSummaryTest {

  @Test
  @DisplayName("should keep match score within [0, 1]")
  void shouldClampScore() {
    assertThat(PlaylistSummary.clampScore(1.7)).isEqualTo(1.0);
    assertThat(PlaylistSummary.clampScore(-0.2)).isEqualTo(0.0);
    assertThat(PlaylistSummary.clampScore(Double.NaN)).isEqualTo(0.0);
    assertThat(PlaylistSummary.clampScore(0.42)).isEqualTo(0.42);
  }

  @Test
  @DisplayName("should clamp on construction")
  void shouldClampOnConstruction() {
    PlaylistSummary summary =
        new PlaylistSummary("p1", "text", null, null, 3.0, null, "model", "provider");

    assertThat(summary.matchScore()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("selection ids should drop nulls and duplicates but keep order")
  void selectionShouldBeOrderedSet() {
    SelectionResult result = new SelectionResult(Arrays.asList("b", null, "a", " b ", "c"), null);

    assertThat(result.selectedIds()).containsExactly("b", "a", "c");
    assertThat(new SelectionResult(List.of(), null).isEmpty()).isTrue();
  }
}
