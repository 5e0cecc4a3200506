package com.flamingo.ai.discovery.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Configuration properties for the playlist discovery pipeline. */
@ConfigurationProperties(prefix = "discovery")
@Getter
@Setter
public class DiscoveryConfig {

  private Catalog catalog = new Catalog();
  private Llm llm = new Llm();
  private Limits limits = new Limits();
  private Cache cache = new Cache();
  private Summarization summarization = new Summarization();
  private Progress progress = new Progress();

  /** Upstream music catalog (Spotify Web API compatible). */
  @Getter
  @Setter
  public static class Catalog {
    private String baseUrl = "https://api.spotify.com/v1";

    /** Page size for playlist search; the upstream caps it at 50. */
    private int searchPageSize = 50;

    /** Page size for playlist track listing; the upstream caps it at 100. */
    private int trackPageSize = 50;

    /** Fixed pause between successive search pages. */
    private Duration searchPageDelay = Duration.ofSeconds(2);

    /** Fixed pause between successive track pages of one playlist. */
    private Duration trackPageDelay = Duration.ofMillis(100);

    /** Fixed pause between per-playlist detail fetches that hit the upstream. */
    private Duration detailDelay = Duration.ofMillis(300);

    private Duration timeout = Duration.ofSeconds(15);
    private int maxInMemorySize = 4 * 1024 * 1024;
  }

  @Getter
  @Setter
  public static class Llm {
    private String defaultModel = "google/gemini-2.5-flash";

    /** Label reported as the provider of completions (the gateway behind the chat model). */
    private String provider = "openrouter";

    private double selectionTemperature = 0.3;
    private double summaryTemperature = 0.3;

    /** Attach a JSON schema to completion requests in addition to JSON mode. */
    private boolean structuredOutput = false;

    /** Maximum number of unique artists quoted in a summary prompt. */
    private int maxPromptArtists = 20;

    private TokenBudget selectionBudget = new TokenBudget(8_000, 150, 16_000, 60_000);
    private TokenBudget summaryBudget = new TokenBudget(10_000, 500, 20_000, 60_000);
  }

  /**
   * Linear output-token budget {@code base + perItem * items}, clamped to {@code [floor, ceiling]}.
   * The ceiling stays below the model's output limit.
   */
  @Getter
  @Setter
  public static class TokenBudget {
    private int base;
    private int perItem;
    private int floor;
    private int ceiling;

    public TokenBudget() {}

    public TokenBudget(int base, int perItem, int floor, int ceiling) {
      this.base = base;
      this.perItem = perItem;
      this.floor = floor;
      this.ceiling = ceiling;
    }

    public int forItems(int items) {
      long raw = (long) base + (long) perItem * Math.max(0, items);
      return (int) Math.min(Math.max(raw, floor), ceiling);
    }
  }

  /** Defaults applied when a discovery request omits a limit. Bounds are fixed by the API. */
  @Getter
  @Setter
  public static class Limits {
    private int defaultPlaylistLimit = 40;
    private int defaultTrackSampleSize = 30;
    private int defaultRenderLimit = 10;
  }

  @Getter
  @Setter
  public static class Cache {
    /** Cache backend: "redis" or "memory". */
    private String store = "redis";

    private String keyPrefix = "";
    private Duration detailTtl = Duration.ofHours(24);
    private Duration summaryTtl = Duration.ofDays(7);
    private Duration resultTtl = Duration.ofDays(30);
    private int historyCap = 100;
  }

  @Getter
  @Setter
  public static class Summarization {
    /**
     * When true, one playlist's summarization failure aborts the whole request. When false the
     * playlist is dropped like a failed detail fetch.
     */
    private boolean failFast = true;

    /** Fixed pause after each summary that required an LLM call. */
    private Duration delay = Duration.ofMillis(200);

    private double defaultScore = 0.7;
    private String defaultAlignment = "moderate";
  }

  @Getter
  @Setter
  public static class Progress {
    /** Pause between the finalizing step and the complete event. */
    private Duration finalizeDelay = Duration.ofMillis(500);

    private String eventName = "playlistDiscoveryProgress";
  }
}
