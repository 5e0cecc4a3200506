package com.flamingo.ai.discovery.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * States of one discovery request. Transitions only move forward; {@link #COMPLETE} and {@link
 * #FAILED} are terminal and {@link #FAILED} is reachable from any non-terminal state.
 */
public enum DiscoveryPhase {
  SEARCHING,
  ANALYZING,
  FETCHING,
  SUMMARIZING,
  COMPLETE,
  FAILED;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean isTerminal() {
    return this == COMPLETE || this == FAILED;
  }

  /**
   * Whether the state machine may move from this phase to {@code next}.
   *
   * @param next the candidate next phase
   * @return true for a forward move out of a non-terminal phase, or a move to FAILED
   */
  public boolean canTransitionTo(DiscoveryPhase next) {
    if (isTerminal()) {
      return false;
    }
    if (next == FAILED) {
      return true;
    }
    return next.ordinal() > ordinal();
  }
}
