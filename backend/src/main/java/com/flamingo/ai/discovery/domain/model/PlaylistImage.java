package com.flamingo.ai.discovery.domain.model;

/** Cover image reference as reported by the catalog. */
public record PlaylistImage(String url, Integer width, Integer height) {}
