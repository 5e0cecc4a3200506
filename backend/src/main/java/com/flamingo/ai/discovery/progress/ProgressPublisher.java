package com.flamingo.ai.discovery.progress;

/**
 * Outbound sink for progress events, addressed per user. Delivery is best-effort: events for a
 * user with no listener are dropped, nothing is buffered and {@link #emit} never throws.
 */
public interface ProgressPublisher {

  void emit(String userId, ProgressEvent event);
}
