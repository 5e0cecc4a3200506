package com.flamingo.ai.discovery.domain.model;

/**
 * Caller identity supplied by the upstream identity provider.
 *
 * @param userId key used to namespace per-user cache entries and progress events
 * @param accessToken catalog access credential for this request
 * @param sessionId optional client session id echoed in progress events
 */
public record RequestIdentity(String userId, String accessToken, String sessionId) {

  public String sessionOrUnknown() {
    return sessionId == null || sessionId.isBlank() ? "unknown" : sessionId;
  }
}
