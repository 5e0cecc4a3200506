package com.flamingo.ai.discovery.domain.model;

/** Artist credit on a sampled track. */
public record TrackArtist(String id, String name) {}
