package com.flamingo.ai.discovery.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes one JSON line per LLM interaction to the {@code discovery.llm.interactions} logger. User
 * ids are hashed before they are written. Failures here are logged and never propagate.
 */
@Component
@Slf4j
public class LlmInteractionLogger {

  private static final Logger INTERACTIONS = LoggerFactory.getLogger("discovery.llm.interactions");

  private final ObjectMapper objectMapper;
  private final Clock clock;

  public LlmInteractionLogger(ObjectMapper objectMapper, Clock clock) {
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  public void record(LlmInteraction interaction) {
    try {
      ObjectNode entry = objectMapper.createObjectNode();
      entry.put("timestamp", clock.millis());
      entry.put("userId", hashUserId(interaction.userId()));
      entry.put("sessionId", interaction.sessionId());
      entry.put("command", interaction.command());
      entry.put("model", interaction.model());
      entry.put("provider", interaction.provider());
      entry.put("latencyMs", interaction.latencyMs());
      entry.set("usage", objectMapper.valueToTree(interaction.usage()));
      entry.put(
          "parseStatus",
          interaction.parseStatus() == null ? null : interaction.parseStatus().name());
      entry.put("success", interaction.success());
      entry.put("message", interaction.message());
      INTERACTIONS.info(objectMapper.writeValueAsString(entry));
    } catch (JsonProcessingException | RuntimeException e) {
      log.warn("Failed to log LLM interaction '{}': {}", interaction.command(), e.getMessage());
    }
  }

  /** First 16 hex chars of the SHA-256 of the user id. */
  static String hashUserId(String userId) {
    if (userId == null) {
      return null;
    }
    try {
      byte[] digest =
          MessageDigest.getInstance("SHA-256").digest(userId.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(digest).substring(0, 16);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
