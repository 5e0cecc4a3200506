package com.flamingo.ai.discovery.progress;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/** {@link ProgressPublisher} backed by one multicast Reactor sink per user, served as SSE. */
@Component
@Slf4j
public class SseProgressPublisher implements ProgressPublisher {

  private final Map<String, UserChannel> channels = new ConcurrentHashMap<>();
  private final AtomicInteger activeSubscribers = new AtomicInteger(0);
  private final MeterRegistry meterRegistry;

  public SseProgressPublisher(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    meterRegistry.gauge("discovery.progress.subscribers", activeSubscribers);
  }

  /**
   * Live events for {@code userId} from now on; earlier events are not replayed. The user's channel
   * is resolved when the returned flux is subscribed, not when it is built.
   */
  public Flux<ProgressEvent> subscribe(String userId) {
    return Flux.defer(
        () -> {
          UserChannel channel = attach(userId);
          return channel
              .sink()
              .asFlux()
              .doOnSubscribe(
                  subscription -> {
                    activeSubscribers.incrementAndGet();
                    log.debug("Progress subscriber attached");
                  })
              .doFinally(
                  signal -> {
                    activeSubscribers.decrementAndGet();
                    detach(userId, channel);
                    log.debug("Progress subscriber detached: {}", signal);
                  });
        });
  }

  private UserChannel attach(String userId) {
    return channels.compute(
        userId,
        (key, existing) -> {
          UserChannel channel = existing != null ? existing : new UserChannel();
          channel.attached().incrementAndGet();
          return channel;
        });
  }

  // The channel leaves the map only once its last attached subscriber is gone.
  private void detach(String userId, UserChannel channel) {
    channels.computeIfPresent(
        userId,
        (key, current) -> {
          if (current != channel) {
            return current;
          }
          return channel.attached().decrementAndGet() == 0 ? null : channel;
        });
  }

  boolean hasChannel(String userId) {
    return channels.containsKey(userId);
  }

  @Override
  public void emit(String userId, ProgressEvent event) {
    UserChannel channel = channels.get(userId);
    if (channel == null) {
      log.trace("No progress listener, dropping '{}'", event.step());
      return;
    }
    Sinks.EmitResult result;
    Sinks.Many<ProgressEvent> sink = channel.sink();
    synchronized (sink) {
      result = sink.tryEmitNext(event);
    }
    if (result.isFailure()) {
      meterRegistry.counter("discovery.progress.dropped", "reason", result.name()).increment();
      log.trace("Progress event '{}' dropped: {}", event.step(), result);
    }
  }

  private record UserChannel(Sinks.Many<ProgressEvent> sink, AtomicInteger attached) {
    UserChannel() {
      this(Sinks.many().multicast().directBestEffort(), new AtomicInteger(0));
    }
  }
}
