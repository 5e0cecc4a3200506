package com.flamingo.ai.discovery.support;

import com.flamingo.ai.discovery.service.pacing.Sleeper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** Sleeper that records requested pauses instead of blocking. */
public class RecordingSleeper implements Sleeper {

  private final List<Duration> sleeps = new ArrayList<>();

  @Override
  public void sleep(Duration duration) {
    sleeps.add(duration);
  }

  public List<Duration> getSleeps() {
    return sleeps;
  }
}
