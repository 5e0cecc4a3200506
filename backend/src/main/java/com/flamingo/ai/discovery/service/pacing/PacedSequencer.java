package com.flamingo.ai.discovery.service.pacing;

import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs steps strictly one at a time, inserting a fixed (non-exponential) delay after every step
 * that touched a rate-limited upstream. There is never more than one step in flight.
 */
@Slf4j
public class PacedSequencer {

  private final Duration delay;
  private final Sleeper sleeper;

  public PacedSequencer(Duration delay, Sleeper sleeper) {
    this.delay = delay == null ? Duration.ZERO : delay;
    this.sleeper = sleeper;
  }

  /** Step over a fixed list of items. */
  @FunctionalInterface
  public interface ItemStep<T> {
    StepOutcome apply(T item, int index);
  }

  /** Step identified only by its index, for pagination where items are not known upfront. */
  @FunctionalInterface
  public interface IndexedStep {
    StepOutcome apply(int index);
  }

  /** Notified right before the sequencer sleeps. */
  @FunctionalInterface
  public interface DelayListener {
    void beforeDelay(int nextIndex, Duration delay);
  }

  public Duration getDelay() {
    return delay;
  }

  public <T> int forEach(List<T> items, ItemStep<T> step) {
    return run(items.size(), index -> step.apply(items.get(index), index), null);
  }

  /**
   * Runs up to {@code maxSteps} steps.
   *
   * @param maxSteps upper bound on the number of steps
   * @param step the step body
   * @param listener optional delay listener, may be null
   * @return number of steps executed
   */
  public int run(int maxSteps, IndexedStep step, DelayListener listener) {
    int executed = 0;
    boolean pendingDelay = false;
    for (int index = 0; index < maxSteps; index++) {
      if (pendingDelay) {
        pause(index, listener);
      }
      StepOutcome outcome = step.apply(index);
      executed++;
      if (!outcome.proceed()) {
        break;
      }
      pendingDelay = outcome.touchedUpstream();
    }
    return executed;
  }

  private void pause(int nextIndex, DelayListener listener) {
    if (delay.isZero() || delay.isNegative()) {
      return;
    }
    if (listener != null) {
      listener.beforeDelay(nextIndex, delay);
    }
    log.debug("Pacing upstream calls: waiting {}ms before step {}", delay.toMillis(), nextIndex);
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while pacing upstream calls", e);
    }
  }
}
