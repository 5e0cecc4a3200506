package com.flamingo.ai.discovery.llm;

import com.flamingo.ai.discovery.domain.enums.AlignmentLevel;
import com.flamingo.ai.discovery.domain.model.PlaylistCharacteristics;

/**
 * Fields read from a summarization response. Any field may be null when the model omitted it or
 * returned it with the wrong type.
 */
public record SummaryPayload(
    String summary,
    AlignmentLevel alignmentLevel,
    PlaylistCharacteristics characteristics,
    Double matchScore,
    String reasoning) {}
