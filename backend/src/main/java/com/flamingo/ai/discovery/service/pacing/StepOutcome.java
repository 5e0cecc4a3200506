package com.flamingo.ai.discovery.service.pacing;

/**
 * Result of one paced step.
 *
 * @param touchedUpstream whether the step called a rate-limited upstream; only then is the fixed
 *     delay inserted before the next step
 * @param proceed whether the sequencer should run the next step
 */
public record StepOutcome(boolean touchedUpstream, boolean proceed) {

  public static StepOutcome upstream() {
    return new StepOutcome(true, true);
  }

  public static StepOutcome local() {
    return new StepOutcome(false, true);
  }

  public static StepOutcome stop() {
    return new StepOutcome(false, false);
  }
}
