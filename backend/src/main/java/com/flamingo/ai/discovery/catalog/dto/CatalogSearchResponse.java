package com.flamingo.ai.discovery.catalog.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Envelope of a playlist search response. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogSearchResponse(CatalogPage<CatalogPlaylist> playlists) {}
