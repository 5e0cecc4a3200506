package com.flamingo.ai.discovery.progress;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.discovery.domain.enums.DiscoveryPhase;
import java.util.Map;

/**
 * A phase or step update of one discovery request. Transient; never persisted.
 *
 * @param progress coarse percentage in [0, 100], illustrative only
 * @param itemNumber one-based position of the item being processed within the phase
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressEvent(
    String sessionId,
    String step,
    DiscoveryPhase phase,
    long timestamp,
    Double progress,
    Integer itemNumber,
    Integer totalItems,
    Map<String, Object> metadata) {}
