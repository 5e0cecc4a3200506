package com.flamingo.ai.discovery.catalog;

import com.flamingo.ai.discovery.catalog.dto.CatalogPage;
import com.flamingo.ai.discovery.catalog.dto.CatalogPlaylist;
import com.flamingo.ai.discovery.catalog.dto.CatalogTrackItem;

/**
 * Music catalog operations used by the discovery pipeline. Every call blocks until the upstream
 * answers; per-call timeouts are the implementation's concern.
 *
 * <p>Implementations throw {@link com.flamingo.ai.discovery.exception.CatalogAuthException} for a
 * rejected credential, {@link com.flamingo.ai.discovery.exception.CatalogRateLimitException} for
 * 429 answers and {@link com.flamingo.ai.discovery.exception.CatalogException} otherwise.
 */
public interface CatalogClient {

  CatalogPage<CatalogPlaylist> searchPlaylists(
      String accessToken, String query, int limit, int offset);

  CatalogPlaylist getPlaylist(String accessToken, String playlistId);

  CatalogPage<CatalogTrackItem> getPlaylistTracks(
      String accessToken, String playlistId, int limit, int offset);
}
