package com.flamingo.ai.discovery.service.pacing;

import java.time.Duration;

/** Blocks the current thread for a duration. Replaced by a recording fake in tests. */
@FunctionalInterface
public interface Sleeper {

  void sleep(Duration duration) throws InterruptedException;

  static Sleeper system() {
    return duration -> Thread.sleep(duration.toMillis());
  }
}
