package com.flamingo.ai.discovery.cache;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import org.springframework.util.DigestUtils;

/** Key layout of the discovery cache. */
public final class CacheKeys {

  private final String prefix;

  public CacheKeys(String prefix) {
    this.prefix = prefix == null ? "" : prefix;
  }

  public String detail(String playlistId) {
    return prefix + "playlist:details:" + playlistId;
  }

  public String summary(String playlistId, String query) {
    return prefix + "playlist:summary:" + playlistId + ":" + md5(normalize(query)).substring(0, 8);
  }

  public String result(String userId, String searchHash) {
    return prefix + "playlist:search:result:" + userId + ":" + searchHash;
  }

  public String history(String userId) {
    return prefix + "playlist:search:history:" + userId;
  }

  /** Identifies a (user, query, model) search; stable across requests. */
  public static String searchHash(String userId, String query, String model) {
    return md5(userId + ":" + normalize(query) + ":" + model);
  }

  /** Trim and lower-case. */
  public static String normalize(String query) {
    return query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
  }

  private static String md5(String value) {
    return DigestUtils.md5DigestAsHex(value.getBytes(StandardCharsets.UTF_8));
  }
}
