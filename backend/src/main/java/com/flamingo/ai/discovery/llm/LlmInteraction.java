package com.flamingo.ai.discovery.llm;

/**
 * One selection or summary call as recorded in the interaction log.
 *
 * @param command what the call was for, e.g. "playlist_selection: lofi beats"
 * @param parseStatus null when the call failed before any content was returned
 */
public record LlmInteraction(
    String userId,
    String sessionId,
    String command,
    String model,
    String provider,
    long latencyMs,
    LlmUsage usage,
    LlmParseResult.Status parseStatus,
    boolean success,
    String message) {}
