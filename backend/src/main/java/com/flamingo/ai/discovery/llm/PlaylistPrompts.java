package com.flamingo.ai.discovery.llm;

import com.flamingo.ai.discovery.config.DiscoveryConfig;
import com.flamingo.ai.discovery.domain.model.Candidate;
import com.flamingo.ai.discovery.domain.model.PlaylistDetail;
import com.flamingo.ai.discovery.domain.model.SampledTrack;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Builds the selection and summarization completion requests. */
@Component
@RequiredArgsConstructor
public class PlaylistPrompts {

  static final String SELECTION_SYSTEM =
      """
      You are a music curator AI that analyzes playlists and selects the best matches \
      for user queries. Always respond with valid JSON.""";

  static final String SUMMARY_SYSTEM =
      """
      You are an impartial music analyst providing evidence-based assessments. \
      Goal: Explain concisely HOW and WHY a playlist matches (or does not match) the user's query. \
      Tone: Analytical, neutral, objective. NO marketing language or superlatives. \
      Output: Valid JSON only.""";

  private static final String SELECTION_USER =
      """
      User is looking for playlists matching: "%1$s"

      Here are %2$d playlists from catalog search results:

      %3$s
      Analyze these playlists and select up to %4$d that best match the user's intent: "%1$s"

      Consider:
      - Name relevance to the query
      - Description content and how it matches the intent
      - Track count (prefer playlists with reasonable number of tracks, avoid very small ones)
      - Follower count as a quality/popularity signal
      - Owner credibility (verified accounts or high follower counts often indicate quality)

      Return between %5$d-%4$d playlist IDs that best match the query.
      Include more playlists to provide variety and fallback options.
      Focus on quality but aim for at least %6$d good matches when available.

      Respond with a JSON object containing:
      - selectedPlaylistIds: array of ONLY the playlist ID strings \
      (e.g., ["035OfvPcp5PUAAogsLxsbM", "7M65Xoo7Mr0XOrF5Dpd4CX"]) without any numbers or prefixes
      - reasoning: brief explanation of why these were chosen (optional)""";

  private static final String CANDIDATE_ENTRY =
      """
      [%d]
         ID: %s
         Name: "%s"
         Description: "%s"
         Owner: %s
         Tracks: %d
         Followers: %d
         Public: %s
      """;

  private static final String SUMMARY_USER =
      """
      Analyze this playlist against the user query: "%1$s"

      Playlist: %2$s
      Sample tracks (%3$d shown):
      %4$s

      Artists featured: %5$s

      Provide an HONEST assessment following these rules:

      STYLE GUIDE - MANDATORY:
      DO:
      - Use measured language: "partially", "mostly", "about half", "roughly 60%%"
      - Cite specific evidence: "7 of %3$d tracks are...", "tracks like X and Y show..."
      - Acknowledge mismatches: "later tracks drift into...", "some tracks don't align..."

      DON'T use these words (BANNED):
      - perfect, perfectly, iconic, legendary, masterpiece, epitomizes
      - amazing, incredible, fantastic, essential, definitive
      - must-have, sultry, cruising, windows-down

      ANALYSIS STRUCTURE:
      1. Match Analysis (2-3 sentences with evidence):
         - What percentage/fraction of tracks align with "%1$s"?
         - Which specific elements match vs don't match?
         - Reference actual track names or artists as evidence

      2. Alignment Level: Choose one: "strong" | "moderate" | "weak" | "tangential"

      3. Characteristics:
         - Primary genre(s)
         - Mood/energy
         - Era focus (decade or range)

      Respond with JSON:
      {
        "summary": "Your evidence-based match analysis",
        "alignmentLevel": "strong|moderate|weak|tangential",
        "characteristics": {
          "primaryGenre": "...",
          "mood": "...",
          "instrumentation": [...],
          "tempo": "slow|medium|fast|varied",
          "decadeRange": "..."
        },
        "matchScore": 0.0-1.0,
        "reasoning": "Brief explanation of why this score"
      }""";

  /** Stands in for the query when a summary is requested without one. */
  static final String GENERAL_APPEAL = "general listening appeal";

  private static final JsonSchema SELECTION_SCHEMA =
      JsonSchema.builder()
          .name("PlaylistSelection")
          .rootElement(
              JsonObjectSchema.builder()
                  .addProperty(
                      "selectedPlaylistIds",
                      JsonArraySchema.builder().items(JsonStringSchema.builder().build()).build())
                  .addStringProperty("reasoning")
                  .required("selectedPlaylistIds")
                  .build())
          .build();

  private static final JsonSchema SUMMARY_SCHEMA =
      JsonSchema.builder()
          .name("PlaylistSummarization")
          .rootElement(
              JsonObjectSchema.builder()
                  .addStringProperty("summary")
                  .addEnumProperty(
                      "alignmentLevel", List.of("strong", "moderate", "weak", "tangential"))
                  .addProperty(
                      "characteristics",
                      JsonObjectSchema.builder()
                          .addStringProperty("primaryGenre")
                          .addStringProperty("mood")
                          .addProperty(
                              "instrumentation",
                              JsonArraySchema.builder()
                                  .items(JsonStringSchema.builder().build())
                                  .build())
                          .addStringProperty("tempo")
                          .addStringProperty("decadeRange")
                          .build())
                  .addNumberProperty("matchScore")
                  .addStringProperty("reasoning")
                  .required("summary")
                  .build())
          .build();

  private final DiscoveryConfig discoveryConfig;

  /**
   * One request that narrows all candidates down to at most {@code renderLimit} ids.
   *
   * @param query the user's query text
   * @param candidates every candidate found by search
   * @param renderLimit the maximum number of ids to ask for
   * @param model the model id
   */
  public LlmCompletionRequest selection(
      String query, List<Candidate> candidates, int renderLimit, String model) {
    String enumerated =
        IntStream.range(0, candidates.size())
            .mapToObj(index -> candidateEntry(index + 1, candidates.get(index)))
            .collect(Collectors.joining("\n"));
    String prompt =
        SELECTION_USER.formatted(
            query,
            candidates.size(),
            enumerated,
            renderLimit,
            Math.min(renderLimit, 5),
            Math.min(renderLimit, 8));
    DiscoveryConfig.Llm llm = discoveryConfig.getLlm();
    return new LlmCompletionRequest(
        model,
        List.of(LlmMessage.system(SELECTION_SYSTEM), LlmMessage.user(prompt)),
        llm.isStructuredOutput() ? SELECTION_SCHEMA : null,
        llm.getSelectionTemperature(),
        llm.getSelectionBudget().forItems(candidates.size()));
  }

  /**
   * One request analyzing a playlist's sampled tracks against the query.
   *
   * @param query the user's query text, or null for a query-less summary
   * @param detail the playlist detail
   * @param trackSampleSize the number of sampled tracks to quote
   * @param batchSize number of playlists summarized in the same request, drives the token budget
   * @param model the model id
   */
  public LlmCompletionRequest summary(
      String query, PlaylistDetail detail, int trackSampleSize, int batchSize, String model) {
    List<SampledTrack> tracks =
        detail.sampledTracks().subList(0, Math.min(trackSampleSize, detail.sampledTracks().size()));
    String trackList =
        IntStream.range(0, tracks.size())
            .mapToObj(
                index ->
                    "%d. \"%s\" by %s"
                        .formatted(
                            index + 1, tracks.get(index).name(), tracks.get(index).artistNames()))
            .collect(Collectors.joining("\n"));
    DiscoveryConfig.Llm llm = discoveryConfig.getLlm();
    String artists =
        detail.uniqueArtists().stream()
            .limit(llm.getMaxPromptArtists())
            .collect(Collectors.joining(", "));
    String effectiveQuery = query == null || query.isBlank() ? GENERAL_APPEAL : query;
    String prompt =
        SUMMARY_USER.formatted(effectiveQuery, detail.name(), tracks.size(), trackList, artists);
    return new LlmCompletionRequest(
        model,
        List.of(LlmMessage.system(SUMMARY_SYSTEM), LlmMessage.user(prompt)),
        llm.isStructuredOutput() ? SUMMARY_SCHEMA : null,
        llm.getSummaryTemperature(),
        llm.getSummaryBudget().forItems(batchSize));
  }

  private static String candidateEntry(int number, Candidate candidate) {
    String description =
        candidate.description() == null || candidate.description().isBlank()
            ? "No description"
            : candidate.description();
    return CANDIDATE_ENTRY.formatted(
        number,
        candidate.id(),
        candidate.name(),
        description,
        candidate.owner(),
        candidate.trackCount(),
        candidate.followerCount(),
        candidate.isPublic());
  }
}
