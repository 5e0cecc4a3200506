package com.flamingo.ai.discovery.domain.model;

import java.util.Locale;

/**
 * A discovery query with its limits already clamped into range. Out-of-range limits are clamped,
 * never rejected; missing limits take the configured defaults.
 */
public record DiscoveryQuery(
    String text, String modelId, int playlistLimit, int trackSampleSize, int renderLimit) {

  public static final int MIN_PLAYLIST_LIMIT = 1;
  public static final int MAX_PLAYLIST_LIMIT = 200;
  public static final int MIN_TRACK_SAMPLE_SIZE = 10;
  public static final int MAX_TRACK_SAMPLE_SIZE = 100;
  public static final int MIN_RENDER_LIMIT = 1;
  public static final int MAX_RENDER_LIMIT = 50;

  public DiscoveryQuery {
    text = text == null ? "" : text.trim();
    modelId = modelId == null || modelId.isBlank() ? null : modelId.trim();
    playlistLimit = clamp(playlistLimit, MIN_PLAYLIST_LIMIT, MAX_PLAYLIST_LIMIT);
    trackSampleSize = clamp(trackSampleSize, MIN_TRACK_SAMPLE_SIZE, MAX_TRACK_SAMPLE_SIZE);
    renderLimit = clamp(renderLimit, MIN_RENDER_LIMIT, MAX_RENDER_LIMIT);
  }

  /**
   * Builds a query, substituting defaults for absent limits.
   *
   * @param text free-text query
   * @param modelId requested model, or null for the default model
   * @param playlistLimit requested candidate count, or null
   * @param trackSampleSize requested sampled tracks per playlist, or null
   * @param renderLimit requested maximum result count, or null
   * @param defaults the configured defaults
   * @return the clamped query
   */
  public static DiscoveryQuery of(
      String text,
      String modelId,
      Integer playlistLimit,
      Integer trackSampleSize,
      Integer renderLimit,
      Defaults defaults) {
    return new DiscoveryQuery(
        text,
        modelId,
        playlistLimit != null ? playlistLimit : defaults.playlistLimit(),
        trackSampleSize != null ? trackSampleSize : defaults.trackSampleSize(),
        renderLimit != null ? renderLimit : defaults.renderLimit());
  }

  /** Trimmed, lower-cased query text used for cache keys. */
  public String normalizedText() {
    return text.toLowerCase(Locale.ROOT);
  }

  /** Requested model, or {@code fallback} when none was given. */
  public String modelOr(String fallback) {
    return modelId != null ? modelId : fallback;
  }

  private static int clamp(int value, int min, int max) {
    return Math.min(Math.max(value, min), max);
  }

  /** Default limits used when a request omits them. */
  public record Defaults(int playlistLimit, int trackSampleSize, int renderLimit) {}
}
