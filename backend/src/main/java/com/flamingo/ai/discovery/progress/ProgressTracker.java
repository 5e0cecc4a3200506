package com.flamingo.ai.discovery.progress;

import com.flamingo.ai.discovery.domain.enums.DiscoveryPhase;
import java.time.Clock;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Progress reporting for one request. Tracks the current phase, refuses backward moves and maps
 * item positions onto a coarse percentage band per phase.
 */
@Slf4j
public class ProgressTracker {

  private final ProgressPublisher publisher;
  private final Clock clock;
  private final String userId;
  private final String sessionId;
  private DiscoveryPhase phase;

  public ProgressTracker(
      ProgressPublisher publisher, Clock clock, String userId, String sessionId) {
    this.publisher = publisher;
    this.clock = clock;
    this.userId = userId;
    this.sessionId = sessionId;
  }

  public DiscoveryPhase getPhase() {
    return phase;
  }

  /** Moves to {@code next}; a no-op when already there. */
  public void enter(DiscoveryPhase next) {
    if (next == phase) {
      return;
    }
    if (phase != null && !phase.canTransitionTo(next)) {
      throw new IllegalStateException("Illegal phase transition " + phase + " -> " + next);
    }
    log.debug("Discovery phase {} -> {}", phase, next);
    phase = next;
  }

  /** Moves to FAILED unless already terminal. */
  public void fail() {
    if (phase == null || !phase.isTerminal()) {
      phase = DiscoveryPhase.FAILED;
    }
  }

  /** Reports a step at a fixed position within the current phase's band. */
  public void step(String step, double fractionOfPhase) {
    publish(step, percent(fractionOfPhase), null, null, null);
  }

  public void step(String step, double fractionOfPhase, Map<String, Object> metadata) {
    publish(step, percent(fractionOfPhase), null, null, metadata);
  }

  /**
   * Reports work on item {@code itemNumber} (zero-based) of {@code totalItems}. The event carries
   * the one-based position.
   *
   * @param done whether the item is finished, which moves the bar to the item's upper edge
   */
  public void item(String step, int itemNumber, int totalItems, boolean done) {
    item(step, itemNumber, totalItems, done, null);
  }

  public void item(
      String step, int itemNumber, int totalItems, boolean done, Map<String, Object> metadata) {
    double fraction =
        totalItems <= 0 ? 0.0 : (itemNumber + (done ? 1.0 : 0.0)) / (double) totalItems;
    publish(step, percent(fraction), itemNumber + 1, totalItems, metadata);
  }

  /** Reports an event outside any band, e.g. 100 for completion. */
  public void absolute(String step, double progress) {
    publish(step, progress, null, null, null);
  }

  private double percent(double fractionOfPhase) {
    if (phase == null) {
      return 0.0;
    }
    double fraction = Math.max(0.0, Math.min(1.0, fractionOfPhase));
    return switch (phase) {
      case SEARCHING -> 5.0 * fraction;
      case ANALYZING -> 5.0 + 10.0 * fraction;
      case FETCHING -> 15.0 + 30.0 * fraction;
      case SUMMARIZING -> 45.0 + 50.0 * fraction;
      case COMPLETE -> 100.0;
      case FAILED -> 0.0;
    };
  }

  private void publish(
      String step,
      double progress,
      Integer itemNumber,
      Integer totalItems,
      Map<String, Object> metadata) {
    try {
      publisher.emit(
          userId,
          new ProgressEvent(
              sessionId,
              step,
              phase,
              clock.millis(),
              Math.round(progress * 10.0) / 10.0,
              itemNumber,
              totalItems,
              metadata));
    } catch (RuntimeException e) {
      log.debug("Progress publish failed for '{}': {}", step, e.getMessage());
    }
  }
}
