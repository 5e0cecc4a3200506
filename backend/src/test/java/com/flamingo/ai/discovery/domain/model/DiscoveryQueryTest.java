package com.flamingo.ai.discovery.domain.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class DiscoveryQueryTest {

  private static final DiscoveryQuery.Defaults DEFAULTS = new DiscoveryQuery.Defaults(40, 30, 10);

  @Nested
  @DisplayName("Limit clamping")
  class Clamping {

    @ParameterizedTest
    @CsvSource({
      "0, 5, 0, 1, 10, 1",
      "-7, -1, -3, 1, 10, 1",
      "500, 1000, 99, 200, 100, 50",
      "1, 10, 1, 1, 10, 1",
      "200, 100, 50, 200, 100, 50",
      "75, 42, 12, 75, 42, 12"
    })
    @DisplayName("should keep every limit within its bounds")
    void shouldClampLimits(
        int playlistLimit,
        int trackSampleSize,
        int renderLimit,
        int expectedPlaylistLimit,
        int expectedTrackSampleSize,
        int expectedRenderLimit) {
      DiscoveryQuery query =
          new DiscoveryQuery("q", null, playlistLimit, trackSampleSize, renderLimit);

      assertThat(query.playlistLimit()).isEqualTo(expectedPlaylistLimit);
      assertThat(query.trackSampleSize()).isEqualTo(expectedTrackSampleSize);
      assertThat(query.renderLimit()).isEqualTo(expectedRenderLimit);
    }
  }

  @Test
  @DisplayName("should use defaults for absent limits")
  void shouldApplyDefaults_whenLimitsAbsent() {
    DiscoveryQuery query = DiscoveryQuery.of("  lofi beats ", null, null, null, null, DEFAULTS);

    assertThat(query.text()).isEqualTo("lofi beats");
    assertThat(query.playlistLimit()).isEqualTo(40);
    assertThat(query.trackSampleSize()).isEqualTo(30);
    assertThat(query.renderLimit()).isEqualTo(10);
  }

  @Test
  @DisplayName("should clamp present limits instead of replacing them with defaults")
  void shouldClampPresentZero() {
    DiscoveryQuery query = DiscoveryQuery.of("q", null, 0, null, 0, DEFAULTS);

    assertThat(query.playlistLimit()).isEqualTo(1);
    assertThat(query.renderLimit()).isEqualTo(1);
  }

  @Test
  @DisplayName("should fall back to the given model when none was requested")
  void shouldResolveModel() {
    assertThat(DiscoveryQuery.of("q", " ", null, null, null, DEFAULTS).modelOr("default"))
        .isEqualTo("default");
    assertThat(DiscoveryQuery.of("q", "my/model", null, null, null, DEFAULTS).modelOr("default"))
        .isEqualTo("my/model");
  }

  @Test
  @DisplayName("should lower-case the normalized text")
  void shouldNormalizeText() {
    DiscoveryQuery query = DiscoveryQuery.of(" Old School HIP hop ", null, 1, 10, 1, DEFAULTS);

    assertThat(query.normalizedText()).isEqualTo("old school hip hop");
  }
}
