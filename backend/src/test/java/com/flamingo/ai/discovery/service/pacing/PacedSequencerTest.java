package com.flamingo.ai.discovery.service.pacing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.discovery.support.RecordingSleeper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PacedSequencerTest {

  private static final Duration DELAY = Duration.ofMillis(300);

  private final RecordingSleeper sleeper = new RecordingSleeper();

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  @Test
  @DisplayName("should pause between upstream steps but not after the last one")
  void shouldPauseBetweenUpstreamSteps() {
    PacedSequencer sequencer = new PacedSequencer(DELAY, sleeper);
    List<String> visited = new ArrayList<>();

    int executed =
        sequencer.forEach(
            List.of("a", "b", "c"),
            (item, index) -> {
              visited.add(item);
              return StepOutcome.upstream();
            });

    assertThat(executed).isEqualTo(3);
    assertThat(visited).containsExactly("a", "b", "c");
    assertThat(sleeper.getSleeps()).containsExactly(DELAY, DELAY);
  }

  @Test
  @DisplayName("should not pause after steps served locally")
  void shouldSkipDelay_whenStepWasLocal() {
    PacedSequencer sequencer = new PacedSequencer(DELAY, sleeper);

    sequencer.forEach(
        List.of("cached", "fetched", "cached", "last"),
        (item, index) -> item.equals("fetched") ? StepOutcome.upstream() : StepOutcome.local());

    assertThat(sleeper.getSleeps()).containsExactly(DELAY);
  }

  @Test
  @DisplayName("should stop early when a step says so")
  void shouldStop_whenStepStops() {
    PacedSequencer sequencer = new PacedSequencer(DELAY, sleeper);

    int executed =
        sequencer.run(5, index -> index == 1 ? StepOutcome.stop() : StepOutcome.upstream(), null);

    assertThat(executed).isEqualTo(2);
    assertThat(sleeper.getSleeps()).hasSize(1);
  }

  @Test
  @DisplayName("should notify the listener before each pause")
  void shouldNotifyListener() {
    PacedSequencer sequencer = new PacedSequencer(DELAY, sleeper);
    List<Integer> notified = new ArrayList<>();

    sequencer.run(3, index -> StepOutcome.upstream(), (next, delay) -> notified.add(next));

    assertThat(notified).containsExactly(1, 2);
  }

  @Test
  @DisplayName("should never sleep with a zero delay")
  void shouldNotSleep_whenDelayZero() {
    PacedSequencer sequencer = new PacedSequencer(Duration.ZERO, sleeper);

    sequencer.run(4, index -> StepOutcome.upstream(), null);

    assertThat(sleeper.getSleeps()).isEmpty();
  }

  @Test
  @DisplayName("should restore the interrupt flag when interrupted while pausing")
  void shouldPropagateInterrupt() {
    PacedSequencer sequencer =
        new PacedSequencer(
            DELAY,
            duration -> {
              throw new InterruptedException("stop");
            });

    assertThatThrownBy(() -> sequencer.run(2, index -> StepOutcome.upstream(), null))
        .isInstanceOf(IllegalStateException.class);
    assertThat(Thread.currentThread().isInterrupted()).isTrue();
  }
}
