package com.flamingo.ai.discovery.api;

import com.flamingo.ai.discovery.domain.model.RequestIdentity;
import com.flamingo.ai.discovery.exception.MissingIdentityException;
import org.springframework.stereotype.Component;

/**
 * Reads the caller identity from the headers set by the upstream identity provider: {@code
 * X-User-Id}, {@code Authorization: Bearer <token>} and optionally {@code X-Session-Id}.
 */
@Component
public class RequestIdentityResolver {

  public static final String USER_HEADER = "X-User-Id";
  public static final String SESSION_HEADER = "X-Session-Id";
  private static final String BEARER_PREFIX = "Bearer ";

  /** Identity for calls that reach the catalog. */
  public RequestIdentity resolve(String userId, String authorization, String sessionId) {
    String user = requireUser(userId);
    if (authorization == null || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, 7)) {
      throw new MissingIdentityException("Missing catalog access token");
    }
    String token = authorization.substring(BEARER_PREFIX.length()).trim();
    if (token.isEmpty()) {
      throw new MissingIdentityException("Missing catalog access token");
    }
    return new RequestIdentity(user, token, sessionId);
  }

  /** User id alone, for calls that only touch the cache or the progress channel. */
  public String requireUser(String userId) {
    if (userId == null || userId.isBlank()) {
      throw new MissingIdentityException("User not authenticated");
    }
    return userId.trim();
  }
}
