package com.flamingo.ai.discovery.llm;

/** Raw completion text with call metadata. */
public record LlmCompletionResponse(
    String content, LlmUsage usage, long latencyMs, String model, String provider) {}
